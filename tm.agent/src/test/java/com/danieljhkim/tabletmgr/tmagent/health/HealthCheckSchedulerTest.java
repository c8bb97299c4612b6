package com.danieljhkim.tabletmgr.tmagent.health;

import static org.junit.jupiter.api.Assertions.*;

import java.time.Duration;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.danieljhkim.tabletmgr.tmagent.agent.ActionAgent;
import com.danieljhkim.tabletmgr.tmagent.fakes.FakeHostResolver;
import com.danieljhkim.tabletmgr.tmagent.fakes.FakeMysqlDaemon;
import com.danieljhkim.tabletmgr.tmagent.fakes.RecordingHealthReporter;
import com.danieljhkim.tabletmgr.tmagent.state.HealthStatus;
import com.danieljhkim.tabletmgr.tmcommon.topo.InMemoryTopoServer;
import com.danieljhkim.tabletmgr.tmcommon.topo.Tablet;
import com.danieljhkim.tabletmgr.tmcommon.topo.TabletAlias;
import com.danieljhkim.tabletmgr.tmcommon.topo.TabletControl;
import com.danieljhkim.tabletmgr.tmcommon.topo.TabletType;

class HealthCheckSchedulerTest {

	private static final TabletAlias ALIAS = new TabletAlias("cell1", 100);

	private InMemoryTopoServer topo;
	private ActionAgent agent;
	private RecordingHealthReporter reporter;
	private HealthCheckScheduler scheduler;

	@BeforeEach
	void setUp() {
		topo = new InMemoryTopoServer();
		topo.createTablet(Tablet.create(ALIAS, "ks", "0", TabletType.REPLICA));
		agent = ActionAgent.newTestAgent(topo, ALIAS, "host-a", new FakeHostResolver("host-a", "10.0.0.5"), 15000,
				new FakeMysqlDaemon(3306));
		reporter = new RecordingHealthReporter();
		scheduler = new HealthCheckScheduler(agent, reporter, 1);
	}

	@AfterEach
	void tearDown() throws InterruptedException {
		scheduler.shutdown();
		agent.stop();
	}

	@Test
	void subscriber_receivesResultsInComputedOrder() {
		HealthStreamSubscription subscription = agent.subscribeHealth();
		reporter.thenReport(Duration.ofSeconds(2)).thenReport(Duration.ofSeconds(5));

		scheduler.runHealthCheck();
		scheduler.runHealthCheck();

		HealthStreamReply first = subscription.poll();
		HealthStreamReply second = subscription.poll();
		assertEquals(Duration.ofSeconds(2), first.replicationDelay());
		assertEquals(Duration.ofSeconds(5), second.replicationDelay());
		assertTrue(first.isHealthy());
		assertEquals(Duration.ofSeconds(5), agent.getHealth().replicationDelay());
		assertEquals(2, agent.getHistory().size());
	}

	@Test
	void concurrentChecks_publishInComputedOrder() throws Exception {
		CountDownLatch entered = new CountDownLatch(1);
		CountDownLatch release = new CountDownLatch(1);
		AtomicInteger calls = new AtomicInteger();
		HealthCheckScheduler racing = new HealthCheckScheduler(agent, (isReplicaType, shouldRun) -> {
			if (calls.incrementAndGet() == 1) {
				entered.countDown();
				release.await(5, TimeUnit.SECONDS);
				return Duration.ofSeconds(2);
			}
			return Duration.ofSeconds(5);
		}, 1);
		HealthStreamSubscription subscription = agent.subscribeHealth();

		Thread first = new Thread(racing::runHealthCheck);
		first.start();
		assertTrue(entered.await(5, TimeUnit.SECONDS));
		Thread second = new Thread(racing::runHealthCheck);
		second.start();
		long deadline = System.currentTimeMillis() + 5000;
		while (second.getState() != Thread.State.BLOCKED && System.currentTimeMillis() < deadline) {
			Thread.sleep(5);
		}
		assertEquals(Thread.State.BLOCKED, second.getState());
		release.countDown();
		first.join(5000);
		second.join(5000);

		assertEquals(Duration.ofSeconds(2), subscription.poll().replicationDelay());
		assertEquals(Duration.ofSeconds(5), subscription.poll().replicationDelay());
		assertEquals(Duration.ofSeconds(5), agent.getHealth().replicationDelay());
		racing.shutdown();
	}

	@Test
	void interruptedCheck_restoresInterruptFlag() {
		reporter.thenFail(new InterruptedException("shutting down"));

		HealthStatus status = scheduler.runHealthCheck();

		assertTrue(Thread.interrupted());
		assertFalse(status.isHealthy());
		assertEquals("shutting down", agent.getHealth().errorMessage());
	}

	@Test
	void reporterFailure_publishesUnhealthyStatus() {
		HealthStreamSubscription subscription = agent.subscribeHealth();
		reporter.thenFail(new IllegalStateException("replication is not running"));

		HealthStatus status = scheduler.runHealthCheck();

		assertFalse(status.isHealthy());
		assertFalse(status.isNotYetRun());
		assertEquals("replication is not running", agent.getHealth().errorMessage());
		assertEquals("replication is not running", subscription.poll().healthError());
	}

	@Test
	void reporter_seesTabletRoleAndServingControl() {
		scheduler.runHealthCheck();
		assertTrue(reporter.lastIsReplicaType());
		assertTrue(reporter.lastShouldQueryServiceBeRunning());

		topo.setTabletControl("cell1", "ks", "0", TabletType.REPLICA, new TabletControl(Set.of(), true));
		agent.refreshState();
		scheduler.runHealthCheck();
		assertFalse(reporter.lastShouldQueryServiceBeRunning());
	}

	@Test
	void healthBeforeFirstCheck_isNotYetRun() {
		assertTrue(agent.getHealth().isNotYetRun());
		assertEquals("healthcheck not run yet", agent.getHealth().errorMessage());
	}

	@Test
	void start_runsChecksPeriodically() throws InterruptedException {
		scheduler.start();

		long deadline = System.currentTimeMillis() + TimeUnit.SECONDS.toMillis(5);
		while (agent.getHealth().isNotYetRun() && System.currentTimeMillis() < deadline) {
			Thread.sleep(20);
		}

		assertTrue(reporter.getCalls() >= 1);
		assertFalse(agent.getHealth().isNotYetRun());
	}
}
