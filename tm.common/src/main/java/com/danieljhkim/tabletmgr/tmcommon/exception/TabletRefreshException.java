package com.danieljhkim.tabletmgr.tmcommon.exception;

import io.grpc.Status;

/**
 * Thrown when the tablet record cannot be re-read after an action.
 * The cached record can no longer be trusted, so the caller decides whether to retry.
 * Maps to gRPC FAILED_PRECONDITION.
 */
public class TabletRefreshException extends TabletManagerException {

	public TabletRefreshException(String message) {
		super(message);
	}

	public TabletRefreshException(String message, String tabletAlias) {
		super(message, tabletAlias);
	}

	public TabletRefreshException(String message, Throwable cause) {
		super(message, cause);
	}

	public TabletRefreshException(String message, String tabletAlias, Throwable cause) {
		super(message, tabletAlias, cause);
	}

	@Override
	public Status.Code getGrpcStatusCode() {
		return Status.Code.FAILED_PRECONDITION;
	}
}
