package com.danieljhkim.tabletmgr.tmagent.state;

import java.time.Duration;

import com.danieljhkim.tabletmgr.tmcommon.exception.HealthCheckNotRunException;

/**
 * Result of the latest health check: healthy when {@code error} is null, otherwise the reason.
 */
public record HealthStatus(Duration replicationDelay, Exception error) {

	private static final HealthCheckNotRunException NOT_RUN = new HealthCheckNotRunException();
	private static final HealthStatus NOT_YET_RUN = new HealthStatus(Duration.ZERO, NOT_RUN);

	public HealthStatus {
		replicationDelay = replicationDelay == null ? Duration.ZERO : replicationDelay;
	}

	/**
	 * Status held before the first health check completes. Never healthy.
	 */
	public static HealthStatus notYetRun() {
		return NOT_YET_RUN;
	}

	public static HealthStatus healthy(Duration replicationDelay) {
		return new HealthStatus(replicationDelay, null);
	}

	public static HealthStatus unhealthy(Duration replicationDelay, Exception error) {
		if (error == null) {
			throw new IllegalArgumentException("unhealthy status needs an error");
		}
		return new HealthStatus(replicationDelay, error);
	}

	public boolean isHealthy() {
		return error == null;
	}

	public boolean isNotYetRun() {
		return error instanceof HealthCheckNotRunException;
	}

	/** Error text for status pages and stream replies; empty when healthy. */
	public String errorMessage() {
		if (error == null) {
			return "";
		}
		return error.getMessage() == null ? error.getClass().getSimpleName() : error.getMessage();
	}
}
