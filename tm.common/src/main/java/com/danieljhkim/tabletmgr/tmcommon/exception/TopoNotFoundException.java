package com.danieljhkim.tabletmgr.tmcommon.exception;

import io.grpc.Status;

/**
 * Thrown when the topology store has no node for the requested key. Maps to gRPC NOT_FOUND.
 */
public class TopoNotFoundException extends TabletManagerException {

	public TopoNotFoundException(String message) {
		super(message);
	}

	public TopoNotFoundException(String message, String tabletAlias) {
		super(message, tabletAlias);
	}

	public TopoNotFoundException(String message, Throwable cause) {
		super(message, cause);
	}

	public TopoNotFoundException(String message, String tabletAlias, Throwable cause) {
		super(message, tabletAlias, cause);
	}

	@Override
	public Status.Code getGrpcStatusCode() {
		return Status.Code.NOT_FOUND;
	}
}
