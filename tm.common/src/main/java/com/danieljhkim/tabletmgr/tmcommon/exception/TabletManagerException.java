package com.danieljhkim.tabletmgr.tmcommon.exception;

import io.grpc.Status;

/**
 * Base of the agent's unchecked failures: topology store errors, refresh and startup failures, action lock
 * timeouts and MySQL daemon errors. Each subclass fixes the gRPC status code an RPC caller sees, and the alias
 * of the tablet concerned travels along so the interceptor can return it as a trailer.
 */
public abstract class TabletManagerException extends RuntimeException {

	private final String tabletAlias;

	protected TabletManagerException(String message) {
		super(message);
		this.tabletAlias = null;
	}

	protected TabletManagerException(String message, String tabletAlias) {
		super(message);
		this.tabletAlias = tabletAlias;
	}

	protected TabletManagerException(String message, Throwable cause) {
		super(message, cause);
		this.tabletAlias = null;
	}

	protected TabletManagerException(String message, String tabletAlias, Throwable cause) {
		super(message, cause);
		this.tabletAlias = tabletAlias;
	}

	/**
	 * Returns the gRPC status code for this exception.
	 */
	public abstract Status.Code getGrpcStatusCode();

	/**
	 * Returns the {@code <cell>-<uid>} alias of the tablet this failure concerns, or null when it is not tied to
	 * one tablet (e.g. the whole topology store is unreachable).
	 */
	public String getTabletAlias() {
		return tabletAlias;
	}

	/**
	 * Builds the gRPC Status for this exception.
	 */
	public Status toGrpcStatus() {
		return Status.fromCode(getGrpcStatusCode())
				.withDescription(getMessage())
				.withCause(getCause());
	}
}
