package com.danieljhkim.tabletmgr.tmcommon.exception;

import io.grpc.Status;

/**
 * Thrown when the topology store's view of a tablet is inconsistent. Maps to gRPC FAILED_PRECONDITION.
 */
public class TopoValidationException extends TabletManagerException {

	public TopoValidationException(String message) {
		super(message);
	}

	public TopoValidationException(String message, String tabletAlias) {
		super(message, tabletAlias);
	}

	public TopoValidationException(String message, Throwable cause) {
		super(message, cause);
	}

	public TopoValidationException(String message, String tabletAlias, Throwable cause) {
		super(message, tabletAlias, cause);
	}

	@Override
	public Status.Code getGrpcStatusCode() {
		return Status.Code.FAILED_PRECONDITION;
	}
}
