package com.danieljhkim.tabletmgr.tmcommon.exception;

import io.grpc.Status;

/**
 * Thrown when another action holds the action lock for longer than the lock timeout.
 * Maps to gRPC DEADLINE_EXCEEDED.
 */
public class ActionLockTimeoutException extends TabletManagerException {

	public ActionLockTimeoutException(String message) {
		super(message);
	}

	public ActionLockTimeoutException(String message, String tabletAlias) {
		super(message, tabletAlias);
	}

	public ActionLockTimeoutException(String message, Throwable cause) {
		super(message, cause);
	}

	public ActionLockTimeoutException(String message, String tabletAlias, Throwable cause) {
		super(message, tabletAlias, cause);
	}

	@Override
	public Status.Code getGrpcStatusCode() {
		return Status.Code.DEADLINE_EXCEEDED;
	}
}
