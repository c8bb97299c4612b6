package com.danieljhkim.tabletmgr.tmcommon.exception;

import io.grpc.Status;

/**
 * Health error reported before the first health check has completed.
 * Distinct from any real health failure so callers can tell "unknown" from "unhealthy".
 */
public class HealthCheckNotRunException extends TabletManagerException {

	public HealthCheckNotRunException() {
		super("healthcheck not run yet");
	}

	@Override
	public Status.Code getGrpcStatusCode() {
		return Status.Code.UNAVAILABLE;
	}
}
