package com.danieljhkim.tabletmgr.tmcommon.exception;

import io.grpc.Status;

/**
 * Thrown when the topology store cannot serve a request. Maps to gRPC UNAVAILABLE.
 */
public class TopoUnavailableException extends TabletManagerException {

	public TopoUnavailableException(String message) {
		super(message);
	}

	public TopoUnavailableException(String message, String tabletAlias) {
		super(message, tabletAlias);
	}

	public TopoUnavailableException(String message, Throwable cause) {
		super(message, cause);
	}

	public TopoUnavailableException(String message, String tabletAlias, Throwable cause) {
		super(message, tabletAlias, cause);
	}

	@Override
	public Status.Code getGrpcStatusCode() {
		return Status.Code.UNAVAILABLE;
	}
}
