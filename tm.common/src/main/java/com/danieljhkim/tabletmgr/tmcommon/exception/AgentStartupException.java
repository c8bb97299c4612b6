package com.danieljhkim.tabletmgr.tmcommon.exception;

import io.grpc.Status;

/**
 * Thrown when an agent cannot register its tablet during startup. Maps to gRPC INTERNAL.
 */
public class AgentStartupException extends TabletManagerException {

	public AgentStartupException(String message) {
		super(message);
	}

	public AgentStartupException(String message, String tabletAlias) {
		super(message, tabletAlias);
	}

	public AgentStartupException(String message, Throwable cause) {
		super(message, cause);
	}

	public AgentStartupException(String message, String tabletAlias, Throwable cause) {
		super(message, tabletAlias, cause);
	}

	@Override
	public Status.Code getGrpcStatusCode() {
		return Status.Code.INTERNAL;
	}
}
