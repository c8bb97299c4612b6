package com.danieljhkim.tabletmgr.tmagent.agent;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.danieljhkim.tabletmgr.tmagent.binlog.BinlogPlayerController;
import com.danieljhkim.tabletmgr.tmagent.health.HealthHistory;
import com.danieljhkim.tabletmgr.tmagent.health.HealthRecord;
import com.danieljhkim.tabletmgr.tmagent.health.HealthStreamBroadcaster;
import com.danieljhkim.tabletmgr.tmagent.health.HealthStreamReply;
import com.danieljhkim.tabletmgr.tmagent.health.HealthStreamSubscription;
import com.danieljhkim.tabletmgr.tmagent.mysql.MysqlDaemon;
import com.danieljhkim.tabletmgr.tmagent.query.LocalQueryServiceControl;
import com.danieljhkim.tabletmgr.tmagent.query.QueryServiceControl;
import com.danieljhkim.tabletmgr.tmagent.state.HealthStatus;
import com.danieljhkim.tabletmgr.tmagent.state.TabletStateStore;
import com.danieljhkim.tabletmgr.tmagent.topo.HostResolver;
import com.danieljhkim.tabletmgr.tmagent.topo.TopologySynchronizer;
import com.danieljhkim.tabletmgr.tmcommon.exception.ActionLockTimeoutException;
import com.danieljhkim.tabletmgr.tmcommon.exception.AgentStartupException;
import com.danieljhkim.tabletmgr.tmcommon.exception.TabletRefreshException;
import com.danieljhkim.tabletmgr.tmcommon.topo.Tablet;
import com.danieljhkim.tabletmgr.tmcommon.topo.TabletAlias;
import com.danieljhkim.tabletmgr.tmcommon.topo.TabletInfo;
import com.danieljhkim.tabletmgr.tmcommon.topo.TabletType;
import com.danieljhkim.tabletmgr.tmcommon.topo.TopoServer;

/**
 * The agent of one tablet. It keeps the topology store's record of the tablet in sync with the local machine and
 * runs the change callback whenever the cached record moves. Health results are published through it as well.
 *
 * <p>
 * Locking:
 * <ul>
 * <li>{@code actionLock} serializes mutating actions. It is taken first, through {@link #runAction} or
 * {@link #callAction}, and may be held across topology store, DNS and MySQL calls. Because every state
 * change dispatch happens under it, the change callback never runs concurrently with itself. {@link #stop()}
 * waits for it before tearing collaborators down, and actions are refused unless the agent is running.</li>
 * <li>The {@link TabletStateStore} lock is held for single reads and writes only and may be taken while holding
 * the action lock, never the other way round.</li>
 * <li>The {@link HealthStreamBroadcaster} lock is unrelated to both and is never nested with the state store's.
 * </li>
 * </ul>
 */
public class ActionAgent {

	private static final Logger logger = LoggerFactory.getLogger(ActionAgent.class);

	private final TabletAlias alias;
	private final TopoServer topoServer;
	private final MysqlDaemon mysqlDaemon;
	private final BinlogPlayerController binlogPlayers;
	private final QueryServiceControl queryService;
	private final TabletStateStore stateStore;
	private final TopologySynchronizer synchronizer;
	private final StateChangeDispatcher dispatcher;
	private final HealthStreamBroadcaster healthStream;
	private final HealthHistory history;
	private final Duration lockTimeout;
	private final ExecutorService batchExecutor;
	private final boolean ownsBatchExecutor;

	private final ReentrantLock actionLock = new ReentrantLock();
	// orders store update, history and broadcast of concurrent health results the same way
	private final Object healthPublishMutex = new Object();
	private final AtomicReference<AgentState> state = new AtomicReference<>(AgentState.UNINITIALIZED);

	private ActionAgent(Builder builder) {
		this.alias = Objects.requireNonNull(builder.alias, "alias cannot be null");
		this.topoServer = Objects.requireNonNull(builder.topoServer, "topoServer cannot be null");
		this.mysqlDaemon = Objects.requireNonNull(builder.mysqlDaemon, "mysqlDaemon cannot be null");
		this.binlogPlayers = Objects.requireNonNull(builder.binlogPlayers, "binlogPlayers cannot be null");
		this.queryService = Objects.requireNonNull(builder.queryService, "queryService cannot be null");
		this.lockTimeout = Objects.requireNonNull(builder.lockTimeout, "lockTimeout cannot be null");
		this.stateStore = new TabletStateStore();
		this.synchronizer = new TopologySynchronizer(
				alias,
				topoServer,
				mysqlDaemon,
				stateStore,
				builder.hostResolver,
				builder.hostnameOverride);
		TabletChangeCallback callback = builder.changeCallback != null
				? builder.changeCallback
				: new ServingStateCallback(topoServer, stateStore, queryService, binlogPlayers);
		this.dispatcher = new StateChangeDispatcher(stateStore, callback);
		this.healthStream = new HealthStreamBroadcaster(builder.healthStreamBufferSize);
		this.history = new HealthHistory(builder.historyLength);
		this.ownsBatchExecutor = builder.batchExecutor == null;
		this.batchExecutor = ownsBatchExecutor
				? Executors.newSingleThreadExecutor(r -> {
					Thread t = new Thread(r, "tablet-agent-batch");
					t.setDaemon(true);
					return t;
				})
				: builder.batchExecutor;
	}

	public static Builder builder() {
		return new Builder();
	}

	/**
	 * Builds and starts an agent around a caller-supplied topology store and MySQL daemon, with no-op binlog
	 * players and a local query service control.
	 */
	public static ActionAgent newTestAgent(
			TopoServer topoServer,
			TabletAlias alias,
			String hostname,
			HostResolver hostResolver,
			int vtPort,
			MysqlDaemon mysqlDaemon) {
		ActionAgent agent = builder()
				.alias(alias)
				.topoServer(topoServer)
				.mysqlDaemon(mysqlDaemon)
				.binlogPlayers(() -> {
				})
				.queryService(new LocalQueryServiceControl())
				.hostnameOverride(hostname)
				.hostResolver(hostResolver)
				.build();
		agent.start(0, vtPort, 0);
		return agent;
	}

	// ============================
	// Lifecycle
	// ============================

	/**
	 * Registers the tablet in the topology store, reloads it, verifies it and runs the first state change.
	 *
	 * @param mysqlPort
	 *            the MySQL port if known, 0 to ask the daemon
	 * @throws AgentStartupException
	 *             if the tablet cannot be read or registered, or {@link #stop()} was called meanwhile; the agent
	 *             is then stopped
	 */
	public void start(int mysqlPort, int vtPort, int vtsPort) {
		if (!state.compareAndSet(AgentState.UNINITIALIZED, AgentState.STARTING)) {
			throw new IllegalStateException("agent for " + alias + " cannot start from state " + state.get());
		}
		int knownMysqlPort = mysqlPort != 0 ? mysqlPort : discoverMysqlPort();
		try {
			callActionIn(AgentState.STARTING, "Start", () -> {
				synchronizer.readTablet();
				synchronizer.register(knownMysqlPort, vtPort, vtsPort);
				synchronizer.reload();
				synchronizer.verifyTopology();
				synchronizer.verifyServingAddrs();
				try {
					dispatcher.updateState(Tablet.EMPTY, "Start");
				} catch (RuntimeException e) {
					logger.warn("Initial updateState failed, will need a state change before running properly", e);
				}
				queryService.register(alias);
				if (!state.compareAndSet(AgentState.STARTING, AgentState.RUNNING)) {
					queryService.disallowQueries();
					throw new IllegalStateException("agent was stopped during startup");
				}
				return null;
			});
		} catch (RuntimeException e) {
			state.set(AgentState.STOPPED);
			if (ownsBatchExecutor) {
				batchExecutor.shutdownNow();
			}
			logger.error("Failed to start agent for tablet {}", alias, e);
			throw new AgentStartupException("failed to start agent: " + e.getMessage(), alias.toString(), e);
		}
		logger.info("Agent for tablet {} is running", alias);
	}

	private int discoverMysqlPort() {
		try {
			return mysqlDaemon.getListeningPort();
		} catch (RuntimeException e) {
			logger.warn("Cannot get current mysql port, will use 0 for now: {}", e.getMessage());
			return 0;
		}
	}

	/**
	 * Refuses new actions and closes open health streams, then waits for the running action to finish before
	 * stopping the binlog players and releasing the MySQL daemon connections, in that order.
	 */
	public void stop() {
		AgentState previous = state.getAndSet(AgentState.STOPPED);
		if (previous == AgentState.STOPPED) {
			return;
		}
		logger.info("Stopping agent for tablet {}", alias);
		healthStream.closeAll();
		actionLock.lock();
		try {
			if (ownsBatchExecutor) {
				batchExecutor.shutdown();
			}
			binlogPlayers.stopAllPlayersAndReset();
		} finally {
			try {
				mysqlDaemon.close();
			} finally {
				actionLock.unlock();
			}
		}
	}

	// ============================
	// Actions
	// ============================

	/**
	 * Runs {@code action} while holding the action lock.
	 *
	 * @throws ActionLockTimeoutException
	 *             if the lock is not free within the lock timeout
	 * @throws IllegalStateException
	 *             if the agent is not running
	 */
	public void runAction(String name, Runnable action) {
		callAction(name, () -> {
			action.run();
			return null;
		});
	}

	/**
	 * Like {@link #runAction} for actions with a result.
	 */
	public <T> T callAction(String name, Supplier<T> action) {
		return callActionIn(AgentState.RUNNING, name, action);
	}

	private <T> T callActionIn(AgentState required, String name, Supplier<T> action) {
		acquireActionLock(name);
		try {
			AgentState current = state.get();
			if (current != required) {
				throw new IllegalStateException(
						"agent for " + alias + " is " + current + ", cannot run action " + name);
			}
			return action.get();
		} finally {
			actionLock.unlock();
		}
	}

	private void acquireActionLock(String name) {
		try {
			if (!actionLock.tryLock(lockTimeout.toMillis(), TimeUnit.MILLISECONDS)) {
				throw new ActionLockTimeoutException(
						"action " + name + " timed out after " + lockTimeout.toMillis() + "ms waiting for the action lock",
						alias.toString());
			}
		} catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			throw new ActionLockTimeoutException("interrupted waiting for the action lock", alias.toString(), e);
		}
	}

	/**
	 * Re-reads the tablet after an action that may have changed it, fixes a drifted MySQL port and runs the state
	 * change callback with the record from before the refresh. Must be called from inside an action.
	 *
	 * @throws TabletRefreshException
	 *             if the record cannot be re-read; the callback is not run
	 */
	public void refreshTablet(String reason) {
		if (!actionLock.isHeldByCurrentThread()) {
			throw new IllegalStateException("refreshTablet(" + reason + ") must run inside an action");
		}
		logger.info("Executing post-action state refresh: {}", reason);

		TabletInfo previous = stateStore.getTablet();
		Tablet oldTablet = previous == null ? Tablet.EMPTY : previous.tablet();

		TabletInfo fresh;
		try {
			fresh = synchronizer.readTablet();
		} catch (RuntimeException e) {
			logger.warn("Failed rereading tablet after {} - services may be inconsistent: {}", reason, e.getMessage());
			throw new TabletRefreshException(
					"Failed rereading tablet after " + reason + ": " + e.getMessage(), alias.toString(), e);
		}

		synchronizer.checkMysqlPort(fresh).ifPresent(stateStore::setTablet);
		dispatcher.updateState(oldTablet, reason);
		logger.info("Done with post-action state refresh");
	}

	public void refreshState() {
		runAction("RefreshState", () -> refreshTablet("RefreshState"));
	}

	/**
	 * Changes the tablet type in the topology store, then refreshes and moves the serving address from the old
	 * type's directory entry to the new one.
	 */
	public void changeType(TabletType newType) {
		Objects.requireNonNull(newType, "newType cannot be null");
		runAction("ChangeType", () -> {
			TabletInfo before = stateStore.getTablet();
			topoServer.updateTabletFields(alias, tablet -> tablet.withType(newType));
			refreshTablet("ChangeType");
			if (before != null && before.type() != newType) {
				synchronizer.removeServingAddr(before.tablet());
			}
			synchronizer.verifyServingAddrs();
		});
	}

	/**
	 * Runs {@code action} as an action on the agent's background executor, followed by a refresh tagged with
	 * {@code reason}. The returned future only reports completion; cancelling it does not interrupt the work.
	 */
	public CompletableFuture<Void> runBackgroundAction(String reason, Runnable action) {
		if (state.get() != AgentState.RUNNING) {
			return CompletableFuture.failedFuture(new IllegalStateException(
					"agent for " + alias + " is " + state.get() + ", cannot run action " + reason));
		}
		return CompletableFuture.runAsync(() -> runAction(reason, () -> {
			action.run();
			refreshTablet(reason);
		}), batchExecutor);
	}

	public String ping(String payload) {
		return payload;
	}

	// ============================
	// Health
	// ============================

	/**
	 * Stores a fresh health result, records it in the history and broadcasts it to health stream subscribers.
	 */
	public HealthStreamReply publishHealth(HealthStatus status) {
		synchronized (healthPublishMutex) {
			Instant now = Instant.now();
			stateStore.setHealth(status);
			history.add(new HealthRecord(now, status.errorMessage(), status.replicationDelay()));
			TabletInfo tablet = stateStore.getTablet();
			HealthStreamReply reply = new HealthStreamReply(
					tablet == null ? Tablet.EMPTY : tablet.tablet(),
					status.replicationDelay(),
					status.errorMessage(),
					now);
			healthStream.broadcast(reply);
			return reply;
		}
	}

	public int broadcastHealthStreamReply(HealthStreamReply reply) {
		return healthStream.broadcast(reply);
	}

	/**
	 * @throws IllegalStateException
	 *             if the agent has been stopped
	 */
	public HealthStreamSubscription subscribeHealth() {
		return healthStream.subscribe();
	}

	public boolean unsubscribeHealth(long handle) {
		return healthStream.unsubscribe(handle);
	}

	public int getHealthStreamSize() {
		return healthStream.size();
	}

	// ============================
	// State accessors
	// ============================

	public TabletInfo getTablet() {
		return stateStore.getTablet();
	}

	public HealthStatus getHealth() {
		return stateStore.getHealth();
	}

	public Set<String> getBlacklistedTables() {
		return stateStore.getBlacklistedTables();
	}

	public boolean isQueryServiceDisabled() {
		return stateStore.isQueryServiceDisabled();
	}

	public HealthHistory getHistory() {
		return history;
	}

	public AgentState getState() {
		return state.get();
	}

	public TabletAlias getAlias() {
		return alias;
	}

	public MysqlDaemon getMysqlDaemon() {
		return mysqlDaemon;
	}

	public static class Builder {
		private TabletAlias alias;
		private TopoServer topoServer;
		private MysqlDaemon mysqlDaemon;
		private BinlogPlayerController binlogPlayers;
		private QueryServiceControl queryService;
		private TabletChangeCallback changeCallback;
		private HostResolver hostResolver = HostResolver.dns();
		private String hostnameOverride = "";
		private Duration lockTimeout = Duration.ofSeconds(30);
		private int historyLength = 16;
		private int healthStreamBufferSize = 10;
		private ExecutorService batchExecutor;

		public Builder alias(TabletAlias alias) {
			this.alias = alias;
			return this;
		}

		public Builder topoServer(TopoServer topoServer) {
			this.topoServer = topoServer;
			return this;
		}

		public Builder mysqlDaemon(MysqlDaemon mysqlDaemon) {
			this.mysqlDaemon = mysqlDaemon;
			return this;
		}

		public Builder binlogPlayers(BinlogPlayerController binlogPlayers) {
			this.binlogPlayers = binlogPlayers;
			return this;
		}

		public Builder queryService(QueryServiceControl queryService) {
			this.queryService = queryService;
			return this;
		}

		/**
		 * Replaces the default {@link ServingStateCallback}.
		 */
		public Builder changeCallback(TabletChangeCallback changeCallback) {
			this.changeCallback = changeCallback;
			return this;
		}

		public Builder hostResolver(HostResolver hostResolver) {
			this.hostResolver = hostResolver;
			return this;
		}

		public Builder hostnameOverride(String hostnameOverride) {
			this.hostnameOverride = hostnameOverride;
			return this;
		}

		public Builder lockTimeout(Duration lockTimeout) {
			this.lockTimeout = lockTimeout;
			return this;
		}

		public Builder historyLength(int historyLength) {
			this.historyLength = historyLength;
			return this;
		}

		public Builder healthStreamBufferSize(int healthStreamBufferSize) {
			this.healthStreamBufferSize = healthStreamBufferSize;
			return this;
		}

		/**
		 * Executor for background actions. Defaults to a single daemon thread owned by the agent.
		 */
		public Builder batchExecutor(ExecutorService batchExecutor) {
			this.batchExecutor = batchExecutor;
			return this;
		}

		public ActionAgent build() {
			return new ActionAgent(this);
		}
	}
}
