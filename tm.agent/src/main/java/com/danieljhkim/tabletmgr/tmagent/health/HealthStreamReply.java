package com.danieljhkim.tabletmgr.tmagent.health;

import java.time.Duration;
import java.time.Instant;

import com.danieljhkim.tabletmgr.tmcommon.topo.Tablet;

/**
 * Point-in-time health snapshot sent to health stream subscribers.
 *
 * @param healthError
 *            empty when the tablet is healthy
 */
public record HealthStreamReply(Tablet tablet, Duration replicationDelay, String healthError, Instant timestamp) {

	public HealthStreamReply {
		replicationDelay = replicationDelay == null ? Duration.ZERO : replicationDelay;
		healthError = healthError == null ? "" : healthError;
		timestamp = timestamp == null ? Instant.now() : timestamp;
	}

	public boolean isHealthy() {
		return healthError.isEmpty();
	}
}
