package com.danieljhkim.tabletmgr.tmagent.health;

import java.time.Duration;
import java.time.Instant;

/**
 * One entry of the health history.
 *
 * @param error
 *            empty when the check passed
 */
public record HealthRecord(Instant time, String error, Duration replicationDelay) {

	public HealthRecord {
		error = error == null ? "" : error;
		replicationDelay = replicationDelay == null ? Duration.ZERO : replicationDelay;
	}

	/**
	 * Two records are duplicates when they carry the same error and the same whole-second replication delay.
	 */
	public boolean isDuplicate(HealthRecord other) {
		return other != null
				&& error.equals(other.error)
				&& replicationDelay.getSeconds() == other.replicationDelay.getSeconds();
	}
}
