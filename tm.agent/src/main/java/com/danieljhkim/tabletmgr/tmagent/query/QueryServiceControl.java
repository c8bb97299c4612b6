package com.danieljhkim.tabletmgr.tmagent.query;

import java.util.Set;

import com.danieljhkim.tabletmgr.tmcommon.topo.TabletAlias;
import com.danieljhkim.tabletmgr.tmcommon.topo.Tablet;

/**
 * Control handle on the query-serving engine of this tablet.
 */
public interface QueryServiceControl {

	/**
	 * Tells the engine which tablet it serves for. Called once the agent is registered.
	 */
	void register(TabletAlias alias);

	/**
	 * Starts (or keeps) serving queries for {@code tablet}, refusing the given tables.
	 */
	void allowQueries(Tablet tablet, Set<String> blacklistedTables);

	/**
	 * Stops serving queries. A no-op when not serving.
	 */
	void disallowQueries();

	boolean isServing();
}
