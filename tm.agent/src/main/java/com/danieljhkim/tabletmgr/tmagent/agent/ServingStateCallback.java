package com.danieljhkim.tabletmgr.tmagent.agent;

import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.danieljhkim.tabletmgr.tmagent.binlog.BinlogPlayerController;
import com.danieljhkim.tabletmgr.tmagent.query.QueryServiceControl;
import com.danieljhkim.tabletmgr.tmagent.state.TabletStateStore;
import com.danieljhkim.tabletmgr.tmcommon.topo.Tablet;
import com.danieljhkim.tabletmgr.tmcommon.topo.TabletControl;
import com.danieljhkim.tabletmgr.tmcommon.topo.TabletType;
import com.danieljhkim.tabletmgr.tmcommon.topo.TopoServer;

/**
 * Default tablet change callback: refreshes the tablet control from the topology store, then starts or stops the
 * query service and the binlog players to match the new record.
 */
public class ServingStateCallback implements TabletChangeCallback {

	private static final Logger logger = LoggerFactory.getLogger(ServingStateCallback.class);

	private final TopoServer topoServer;
	private final TabletStateStore stateStore;
	private final QueryServiceControl queryService;
	private final BinlogPlayerController binlogPlayers;

	public ServingStateCallback(
			TopoServer topoServer,
			TabletStateStore stateStore,
			QueryServiceControl queryService,
			BinlogPlayerController binlogPlayers) {
		this.topoServer = topoServer;
		this.stateStore = stateStore;
		this.queryService = queryService;
		this.binlogPlayers = binlogPlayers;
	}

	@Override
	public void onTabletChange(Tablet oldTablet, Tablet newTablet) {
		TabletControl control = readTabletControl(newTablet);
		stateStore.setTabletControl(control);

		boolean allowQueries = newTablet.isRunningQueryService()
				&& (control == null || !control.disableQueryService());
		if (allowQueries) {
			Set<String> blacklisted = control == null ? Set.of() : control.blacklistedTables();
			queryService.allowQueries(newTablet, blacklisted);
		} else {
			queryService.disallowQueries();
		}

		if (oldTablet.type() == TabletType.MASTER && newTablet.type() != TabletType.MASTER) {
			logger.info("Tablet {} is no longer master, stopping binlog players", newTablet.alias());
			binlogPlayers.stopAllPlayersAndReset();
		}

		if (oldTablet.type() != newTablet.type()) {
			logger.info("Tablet {} changed type {} -> {} (serving={})", newTablet.alias(), oldTablet.type(),
					newTablet.type(), allowQueries);
		}
	}

	private TabletControl readTabletControl(Tablet tablet) {
		if (tablet.alias() == null || tablet.keyspace().isEmpty()) {
			return null;
		}
		return topoServer.getTabletControl(tablet.alias().cell(), tablet.keyspace(), tablet.shard(), tablet.type())
				.orElse(null);
	}
}
