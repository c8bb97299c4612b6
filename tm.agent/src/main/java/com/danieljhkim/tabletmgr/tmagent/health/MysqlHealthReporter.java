package com.danieljhkim.tabletmgr.tmagent.health;

import java.time.Duration;

import com.danieljhkim.tabletmgr.tmagent.mysql.MysqlDaemon;

/**
 * Minimal reporter: the tablet is healthy as long as its MySQL daemon answers. Replication delay is not measured
 * and reported as zero.
 */
public class MysqlHealthReporter implements HealthReporter {

	private final MysqlDaemon mysqlDaemon;

	public MysqlHealthReporter(MysqlDaemon mysqlDaemon) {
		this.mysqlDaemon = mysqlDaemon;
	}

	@Override
	public Duration report(boolean isReplicaType, boolean shouldQueryServiceBeRunning) {
		mysqlDaemon.getListeningPort();
		return Duration.ZERO;
	}
}
