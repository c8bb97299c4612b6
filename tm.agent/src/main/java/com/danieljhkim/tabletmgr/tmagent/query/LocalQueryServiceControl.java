package com.danieljhkim.tabletmgr.tmagent.query;

import java.util.Set;

import com.danieljhkim.tabletmgr.tmcommon.topo.Tablet;
import com.danieljhkim.tabletmgr.tmcommon.topo.TabletAlias;

import lombok.extern.slf4j.Slf4j;

/**
 * Query service control used when no query engine runs in-process: tracks and logs the serving state the agent
 * asks for.
 */
@Slf4j
public class LocalQueryServiceControl implements QueryServiceControl {

	private volatile boolean serving;
	private volatile Set<String> blacklistedTables = Set.of();

	@Override
	public void register(TabletAlias alias) {
		log.info("Query service registered for tablet {}", alias);
	}

	@Override
	public void allowQueries(Tablet tablet, Set<String> blacklistedTables) {
		this.blacklistedTables = Set.copyOf(blacklistedTables);
		if (!serving) {
			log.info("Enabling query service for {} as {}", tablet.alias(), tablet.type());
		}
		serving = true;
	}

	@Override
	public void disallowQueries() {
		if (serving) {
			log.info("Disabling query service");
		}
		serving = false;
	}

	@Override
	public boolean isServing() {
		return serving;
	}

	public Set<String> getBlacklistedTables() {
		return blacklistedTables;
	}
}
