package com.danieljhkim.tabletmgr.tmcommon.exception;

import io.grpc.Status;

/**
 * Thrown when a versioned topology write lost a race against another writer.
 * Maps to gRPC ABORTED.
 */
public class TopoVersionMismatchException extends TabletManagerException {

	public TopoVersionMismatchException(String message) {
		super(message);
	}

	public TopoVersionMismatchException(String message, String tabletAlias) {
		super(message, tabletAlias);
	}

	public TopoVersionMismatchException(String message, Throwable cause) {
		super(message, cause);
	}

	public TopoVersionMismatchException(String message, String tabletAlias, Throwable cause) {
		super(message, tabletAlias, cause);
	}

	@Override
	public Status.Code getGrpcStatusCode() {
		return Status.Code.ABORTED;
	}
}
