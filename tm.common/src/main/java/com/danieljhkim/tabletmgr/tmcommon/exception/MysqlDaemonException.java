package com.danieljhkim.tabletmgr.tmcommon.exception;

import io.grpc.Status;

/**
 * Thrown when the local MySQL daemon cannot be queried. Maps to gRPC UNAVAILABLE.
 */
public class MysqlDaemonException extends TabletManagerException {

	public MysqlDaemonException(String message) {
		super(message);
	}

	public MysqlDaemonException(String message, String tabletAlias) {
		super(message, tabletAlias);
	}

	public MysqlDaemonException(String message, Throwable cause) {
		super(message, cause);
	}

	public MysqlDaemonException(String message, String tabletAlias, Throwable cause) {
		super(message, tabletAlias, cause);
	}

	@Override
	public Status.Code getGrpcStatusCode() {
		return Status.Code.UNAVAILABLE;
	}
}
