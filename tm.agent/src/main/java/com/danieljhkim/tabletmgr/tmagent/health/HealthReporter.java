package com.danieljhkim.tabletmgr.tmagent.health;

import java.time.Duration;

/**
 * Computes the health of this tablet.
 */
public interface HealthReporter {

	/**
	 * @param isReplicaType
	 *            whether the tablet currently replicates from a master
	 * @param shouldQueryServiceBeRunning
	 *            whether the tablet is expected to serve queries
	 * @return the measured replication delay
	 * @throws Exception
	 *             describing why the tablet is unhealthy
	 */
	Duration report(boolean isReplicaType, boolean shouldQueryServiceBeRunning) throws Exception;
}
