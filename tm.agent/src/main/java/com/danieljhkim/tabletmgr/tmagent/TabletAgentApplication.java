package com.danieljhkim.tabletmgr.tmagent;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.danieljhkim.tabletmgr.tmagent.agent.ActionAgent;
import com.danieljhkim.tabletmgr.tmagent.health.HealthCheckScheduler;
import com.danieljhkim.tabletmgr.tmagent.health.MysqlHealthReporter;
import com.danieljhkim.tabletmgr.tmagent.mysql.HikariMysqlDaemon;
import com.danieljhkim.tabletmgr.tmagent.query.LocalQueryServiceControl;
import com.danieljhkim.tabletmgr.tmagent.server.TabletServer;
import com.danieljhkim.tabletmgr.tmcommon.config.SystemConfig;
import com.danieljhkim.tabletmgr.tmcommon.exception.TopoNotFoundException;
import com.danieljhkim.tabletmgr.tmcommon.topo.InMemoryTopoServer;
import com.danieljhkim.tabletmgr.tmcommon.topo.Tablet;
import com.danieljhkim.tabletmgr.tmcommon.topo.TabletAlias;
import com.danieljhkim.tabletmgr.tmcommon.topo.TabletType;
import com.danieljhkim.tabletmgr.tmcommon.topo.TopoServer;

public class TabletAgentApplication {

	private static final Logger logger = LoggerFactory.getLogger(TabletAgentApplication.class);

	public static void main(String[] args) {
		try {
			SystemConfig config = args.length < 1 ? SystemConfig.load() : SystemConfig.load(args[0]);

			TabletAlias alias = TabletAlias.parse(config.getProperty("tablet.alias", "test-0000000100"));
			int port = config.getInt("tablet.port", 15000);
			int securePort = config.getInt("tablet.securePort", 0);
			int mysqlPort = config.getInt("mysql.port", 0);

			TopoServer topoServer = new InMemoryTopoServer();
			seedTablet(topoServer, alias, config);

			ActionAgent agent = ActionAgent.builder()
					.alias(alias)
					.topoServer(topoServer)
					.mysqlDaemon(new HikariMysqlDaemon(config))
					.binlogPlayers(() -> logger.info("Stopping all binlog players"))
					.queryService(new LocalQueryServiceControl())
					.hostnameOverride(config.getProperty("tablet.hostname", ""))
					.lockTimeout(config.getMillis("tablet.lockTimeoutMs", 30_000))
					.historyLength(config.getInt("health.historyLength", 16))
					.healthStreamBufferSize(config.getInt("health.streamBufferSize", 10))
					.build();
			agent.start(mysqlPort, port, securePort);

			HealthCheckScheduler scheduler = new HealthCheckScheduler(
					agent, new MysqlHealthReporter(agent.getMysqlDaemon()), config);
			TabletServer tabletServer = new TabletServer(port, agent, scheduler);

			Runtime.getRuntime().addShutdownHook(new Thread(() -> {
				logger.info("Shutting down tablet agent {}...", alias);
				try {
					tabletServer.shutdown();
				} catch (InterruptedException e) {
					logger.error("Error during shutdown", e);
					Thread.currentThread().interrupt();
				}
			}));

			tabletServer.start();
		} catch (Exception e) {
			logger.error("Tablet agent failed to start", e);
			System.exit(1);
		}
	}

	/**
	 * The bundled topology store starts empty, so the tablet record is created from config on first boot.
	 */
	private static void seedTablet(TopoServer topoServer, TabletAlias alias, SystemConfig config) {
		try {
			topoServer.getTablet(alias);
		} catch (TopoNotFoundException e) {
			Tablet tablet = Tablet.create(
					alias,
					config.getProperty("topo.keyspace", "test_keyspace"),
					config.getProperty("topo.shard", "0"),
					TabletType.valueOf(config.getProperty("topo.type", "REPLICA")));
			topoServer.createTablet(tablet);
			logger.info("Created tablet record {} in {}/{}", alias, tablet.keyspace(), tablet.shard());
		}
	}

	private TabletAgentApplication() {
	}
}
