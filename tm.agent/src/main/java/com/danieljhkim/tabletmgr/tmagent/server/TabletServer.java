package com.danieljhkim.tabletmgr.tmagent.server;

import java.io.IOException;
import java.util.concurrent.TimeUnit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.danieljhkim.tabletmgr.tmagent.agent.ActionAgent;
import com.danieljhkim.tabletmgr.tmagent.health.HealthCheckScheduler;
import com.danieljhkim.tabletmgr.tmagent.service.TabletManagerServiceImpl;
import com.danieljhkim.tabletmgr.tmcommon.grpc.GlobalExceptionInterceptor;

import io.grpc.Server;
import io.grpc.ServerInterceptors;
import io.grpc.ServerServiceDefinition;
import io.grpc.netty.shaded.io.grpc.netty.NettyServerBuilder;

/**
 * Hosts the tablet manager RPC service for a started agent and runs its health checks.
 */
public class TabletServer {
	private static final Logger logger = LoggerFactory.getLogger(TabletServer.class);

	private final Server server;
	private final ActionAgent agent;
	private final HealthCheckScheduler healthCheckScheduler;
	private final TabletManagerServiceImpl service;

	public TabletServer(int port, ActionAgent agent, HealthCheckScheduler healthCheckScheduler) {
		this.agent = agent;
		this.healthCheckScheduler = healthCheckScheduler;
		this.service = new TabletManagerServiceImpl(agent);
		ServerServiceDefinition interceptedService = ServerInterceptors.intercept(service,
				new GlobalExceptionInterceptor());

		this.server = NettyServerBuilder
				.forPort(port)
				.addService(interceptedService)
				.build();
	}

	public void start() throws IOException, InterruptedException {
		healthCheckScheduler.start();
		server.start();
		logger.info("Tablet manager gRPC server for {} listening on port {}", agent.getAlias(), server.getPort());
		server.awaitTermination();
	}

	/**
	 * Stops serving RPCs first, then health checks, then the agent itself.
	 */
	public void shutdown() throws InterruptedException {
		server.shutdown();
		try {
			healthCheckScheduler.shutdown();
		} catch (Exception e) {
			logger.warn("Failed to shutdown health check scheduler", e);
		}
		try {
			agent.stop();
		} catch (Exception e) {
			logger.warn("Failed to stop agent for tablet {}", agent.getAlias(), e);
		}
		service.shutdown();
		if (!server.awaitTermination(3, TimeUnit.SECONDS)) {
			server.shutdownNow();
		}
		logger.info("TabletServer stopped");
	}
}
