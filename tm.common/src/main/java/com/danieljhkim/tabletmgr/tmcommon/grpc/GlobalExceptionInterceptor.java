package com.danieljhkim.tabletmgr.tmcommon.grpc;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.danieljhkim.tabletmgr.tmcommon.exception.TabletManagerException;

import io.grpc.ForwardingServerCallListener.SimpleForwardingServerCallListener;
import io.grpc.Metadata;
import io.grpc.ServerCall;
import io.grpc.ServerCallHandler;
import io.grpc.ServerInterceptor;
import io.grpc.Status;

/**
 * Global gRPC interceptor that catches exceptions escaping a handler and maps
 * them to gRPC status codes. Domain exceptions carry their own code; standard
 * Java exceptions are mapped here.
 */
public class GlobalExceptionInterceptor implements ServerInterceptor {

	private static final Logger logger = LoggerFactory.getLogger(GlobalExceptionInterceptor.class);

	public static final Metadata.Key<String> TABLET_ALIAS_KEY = Metadata.Key.of("x-tablet-alias",
			Metadata.ASCII_STRING_MARSHALLER);

	@Override
	public <ReqT, RespT> ServerCall.Listener<ReqT> interceptCall(
			ServerCall<ReqT, RespT> call,
			Metadata headers,
			ServerCallHandler<ReqT, RespT> next) {

		ServerCall.Listener<ReqT> delegate = next.startCall(call, headers);

		return new SimpleForwardingServerCallListener<ReqT>(delegate) {

			@Override
			public void onHalfClose() {
				try {
					super.onHalfClose();
				} catch (RuntimeException e) {
					Status status = mapExceptionToStatus(e);
					logException(status, e);
					call.close(status, buildTrailers(e));
				}
			}
		};
	}

	private void logException(Status status, Throwable t) {
		switch (status.getCode()) {
			case INTERNAL -> logger.error("Unhandled exception in gRPC call", t);
			case UNAVAILABLE, DEADLINE_EXCEEDED, FAILED_PRECONDITION ->
				logger.warn("gRPC call failed: {} - {}", status.getCode(), status.getDescription());
			default -> logger.debug("gRPC exception: {} - {}", status.getCode(), status.getDescription());
		}
	}

	/**
	 * Maps exceptions to gRPC Status.
	 */
	static Status mapExceptionToStatus(Throwable t) {
		if (t instanceof TabletManagerException tmEx) {
			return tmEx.toGrpcStatus();
		}
		if (t instanceof IllegalArgumentException e) {
			return Status.INVALID_ARGUMENT.withDescription(e.getMessage());
		}
		if (t instanceof IllegalStateException e) {
			return Status.FAILED_PRECONDITION.withDescription(e.getMessage());
		}
		return Status.INTERNAL.withDescription("Internal server error");
	}

	static Metadata buildTrailers(Throwable t) {
		Metadata trailers = new Metadata();
		if (t instanceof TabletManagerException tmEx && tmEx.getTabletAlias() != null) {
			trailers.put(TABLET_ALIAS_KEY, tmEx.getTabletAlias());
		}
		return trailers;
	}
}
