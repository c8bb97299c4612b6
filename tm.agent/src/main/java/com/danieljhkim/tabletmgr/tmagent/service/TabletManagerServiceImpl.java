package com.danieljhkim.tabletmgr.tmagent.service;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import com.danieljhkim.tabletmgr.proto.tabletmanager.ChangeTypeRequest;
import com.danieljhkim.tabletmgr.proto.tabletmanager.ChangeTypeResponse;
import com.danieljhkim.tabletmgr.proto.tabletmanager.GetTabletRequest;
import com.danieljhkim.tabletmgr.proto.tabletmanager.GetTabletResponse;
import com.danieljhkim.tabletmgr.proto.tabletmanager.HealthStreamReply;
import com.danieljhkim.tabletmgr.proto.tabletmanager.PingRequest;
import com.danieljhkim.tabletmgr.proto.tabletmanager.PingResponse;
import com.danieljhkim.tabletmgr.proto.tabletmanager.RefreshStateRequest;
import com.danieljhkim.tabletmgr.proto.tabletmanager.RefreshStateResponse;
import com.danieljhkim.tabletmgr.proto.tabletmanager.StreamHealthRequest;
import com.danieljhkim.tabletmgr.proto.tabletmanager.TabletManagerGrpc;
import com.danieljhkim.tabletmgr.tmagent.agent.ActionAgent;
import com.danieljhkim.tabletmgr.tmagent.converter.ProtoConverter;
import com.danieljhkim.tabletmgr.tmagent.health.HealthStreamSubscription;
import com.danieljhkim.tabletmgr.tmcommon.topo.TabletInfo;
import com.danieljhkim.tabletmgr.tmcommon.topo.TabletType;

import io.grpc.stub.ServerCallStreamObserver;
import io.grpc.stub.StreamObserver;
import lombok.extern.slf4j.Slf4j;

/**
 * gRPC front of the {@link ActionAgent}. Errors are thrown and mapped to a status by the global interceptor.
 */
@Slf4j
public class TabletManagerServiceImpl extends TabletManagerGrpc.TabletManagerImplBase {

	private static final long STREAM_POLL_MILLIS = 500;

	private final ActionAgent agent;
	private final ExecutorService streamExecutor;

	public TabletManagerServiceImpl(ActionAgent agent) {
		this.agent = agent;
		AtomicInteger counter = new AtomicInteger();
		this.streamExecutor = Executors.newCachedThreadPool(r -> {
			Thread t = new Thread(r, "health-stream-" + counter.incrementAndGet());
			t.setDaemon(true);
			return t;
		});
	}

	@Override
	public void ping(PingRequest request, StreamObserver<PingResponse> responseObserver) {
		String payload = agent.ping(request.getPayload());
		responseObserver.onNext(PingResponse.newBuilder().setPayload(payload).build());
		responseObserver.onCompleted();
	}

	@Override
	public void getTablet(GetTabletRequest request, StreamObserver<GetTabletResponse> responseObserver) {
		TabletInfo info = agent.getTablet();
		if (info == null) {
			throw new IllegalStateException("tablet " + agent.getAlias() + " has not been loaded yet");
		}
		responseObserver.onNext(GetTabletResponse.newBuilder()
				.setTablet(ProtoConverter.toProto(info.tablet()))
				.setVersion(info.version())
				.build());
		responseObserver.onCompleted();
	}

	@Override
	public void refreshState(RefreshStateRequest request, StreamObserver<RefreshStateResponse> responseObserver) {
		agent.refreshState();
		responseObserver.onNext(RefreshStateResponse.getDefaultInstance());
		responseObserver.onCompleted();
	}

	@Override
	public void changeType(ChangeTypeRequest request, StreamObserver<ChangeTypeResponse> responseObserver) {
		TabletType type = ProtoConverter.fromProto(request.getTabletType());
		if (type == TabletType.UNKNOWN) {
			throw new IllegalArgumentException("tablet_type must be set");
		}
		agent.changeType(type);
		responseObserver.onNext(ChangeTypeResponse.getDefaultInstance());
		responseObserver.onCompleted();
	}

	/**
	 * Forwards health snapshots to the caller until it cancels or the agent closes the subscription.
	 */
	@Override
	public void streamHealth(StreamHealthRequest request, StreamObserver<HealthStreamReply> responseObserver) {
		HealthStreamSubscription subscription = agent.subscribeHealth();
		log.info("Health stream {} opened", subscription.getHandle());
		if (responseObserver instanceof ServerCallStreamObserver<HealthStreamReply> serverObserver) {
			serverObserver.setOnCancelHandler(() -> {
				log.info("Health stream {} cancelled by client", subscription.getHandle());
				agent.unsubscribeHealth(subscription.getHandle());
			});
		}
		streamExecutor.execute(() -> pump(subscription, responseObserver));
	}

	private void pump(HealthStreamSubscription subscription, StreamObserver<HealthStreamReply> responseObserver) {
		try {
			while (!subscription.isClosed()) {
				var reply = subscription.poll(STREAM_POLL_MILLIS, TimeUnit.MILLISECONDS);
				if (reply != null) {
					responseObserver.onNext(ProtoConverter.toProto(reply));
				}
			}
			responseObserver.onCompleted();
		} catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			agent.unsubscribeHealth(subscription.getHandle());
		} catch (RuntimeException e) {
			// usually the client went away between the closed check and onNext
			log.debug("Health stream {} ended: {}", subscription.getHandle(), e.getMessage());
			agent.unsubscribeHealth(subscription.getHandle());
		}
	}

	public void shutdown() {
		streamExecutor.shutdownNow();
	}
}
