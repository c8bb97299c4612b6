package com.danieljhkim.tabletmgr.tmagent.health;

import java.time.Duration;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

import com.danieljhkim.tabletmgr.tmagent.agent.ActionAgent;
import com.danieljhkim.tabletmgr.tmagent.state.HealthStatus;
import com.danieljhkim.tabletmgr.tmcommon.config.SystemConfig;
import com.danieljhkim.tabletmgr.tmcommon.topo.TabletInfo;

import lombok.extern.slf4j.Slf4j;

/**
 * Runs the tablet's {@link HealthReporter} periodically and publishes each result through the agent.
 * Checks never overlap, so results reach subscribers in the order they were computed.
 */
@Slf4j
public class HealthCheckScheduler {

	private final ScheduledExecutorService healthScheduler;
	private final ActionAgent agent;
	private final HealthReporter reporter;
	private final int intervalSeconds;

	public HealthCheckScheduler(ActionAgent agent, HealthReporter reporter, SystemConfig config) {
		this(agent, reporter, config.getInt("health.checkIntervalSeconds", 20));
	}

	public HealthCheckScheduler(ActionAgent agent, HealthReporter reporter, int intervalSeconds) {
		if (intervalSeconds <= 0) {
			throw new IllegalArgumentException("health check interval must be positive: " + intervalSeconds);
		}
		this.agent = agent;
		this.reporter = reporter;
		this.intervalSeconds = intervalSeconds;
		this.healthScheduler = Executors.newSingleThreadScheduledExecutor(r -> {
			Thread t = new Thread(r, "tablet-health-check");
			t.setDaemon(true);
			return t;
		});
	}

	public void start() {
		log.info("Starting health check scheduler with interval {} seconds", intervalSeconds);
		healthScheduler.scheduleWithFixedDelay(this::scheduledCheck, 0, intervalSeconds, TimeUnit.SECONDS);
	}

	public void shutdown() throws InterruptedException {
		log.info("Shutting down health check scheduler...");
		healthScheduler.shutdown();
		if (!healthScheduler.awaitTermination(5, TimeUnit.SECONDS)) {
			log.warn("Health check scheduler did not terminate in time; forcing shutdown");
			healthScheduler.shutdownNow();
		}
	}

	private void scheduledCheck() {
		try {
			runHealthCheck();
		} catch (RuntimeException e) {
			log.warn("Error during scheduled health check", e);
		}
	}

	/**
	 * Runs one check now and publishes its result. Reporter failures become an unhealthy status.
	 */
	public synchronized HealthStatus runHealthCheck() {
		TabletInfo tablet = agent.getTablet();
		boolean isReplicaType = tablet != null && tablet.type().isReplicaType();
		boolean shouldQueryServiceBeRunning = tablet != null
				&& tablet.isRunningQueryService()
				&& !agent.isQueryServiceDisabled();

		HealthStatus status;
		try {
			Duration delay = reporter.report(isReplicaType, shouldQueryServiceBeRunning);
			status = HealthStatus.healthy(delay);
		} catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			log.warn("Health check for tablet {} was interrupted", agent.getAlias());
			status = HealthStatus.unhealthy(Duration.ZERO, e);
		} catch (Exception e) {
			log.warn("Health check failed for tablet {}: {}", agent.getAlias(), e.getMessage());
			status = HealthStatus.unhealthy(Duration.ZERO, e);
		}
		agent.publishHealth(status);
		return status;
	}
}
