package com.danieljhkim.tabletmgr.tmcommon.exception;

import io.grpc.Status;

/**
 * Thrown when creating a topology node that already exists. Maps to gRPC ALREADY_EXISTS.
 */
public class TopoNodeExistsException extends TabletManagerException {

	public TopoNodeExistsException(String message) {
		super(message);
	}

	public TopoNodeExistsException(String message, String tabletAlias) {
		super(message, tabletAlias);
	}

	public TopoNodeExistsException(String message, Throwable cause) {
		super(message, cause);
	}

	public TopoNodeExistsException(String message, String tabletAlias, Throwable cause) {
		super(message, tabletAlias, cause);
	}

	@Override
	public Status.Code getGrpcStatusCode() {
		return Status.Code.ALREADY_EXISTS;
	}
}
