package com.danieljhkim.tabletmgr.tmagent.topo;

import java.io.IOException;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.danieljhkim.tabletmgr.tmagent.mysql.MysqlDaemon;
import com.danieljhkim.tabletmgr.tmagent.state.TabletStateStore;
import com.danieljhkim.tabletmgr.tmcommon.exception.TopoUnavailableException;
import com.danieljhkim.tabletmgr.tmcommon.topo.EndPoint;
import com.danieljhkim.tabletmgr.tmcommon.topo.Tablet;
import com.danieljhkim.tabletmgr.tmcommon.topo.TabletAlias;
import com.danieljhkim.tabletmgr.tmcommon.topo.TabletInfo;
import com.danieljhkim.tabletmgr.tmcommon.topo.TopoServer;

/**
 * Keeps the topology store's record for this tablet in line with the local machine, and the local cache in line
 * with the store.
 *
 * <p>
 * Every method here may block on the topology store, DNS or the MySQL daemon. Callers hold the action lock
 * (never the state store's lock) around them.
 */
public class TopologySynchronizer {

	private static final Logger logger = LoggerFactory.getLogger(TopologySynchronizer.class);

	private final TabletAlias alias;
	private final TopoServer topoServer;
	private final MysqlDaemon mysqlDaemon;
	private final TabletStateStore stateStore;
	private final HostResolver hostResolver;
	private final String hostnameOverride;

	public TopologySynchronizer(
			TabletAlias alias,
			TopoServer topoServer,
			MysqlDaemon mysqlDaemon,
			TabletStateStore stateStore,
			HostResolver hostResolver,
			String hostnameOverride) {
		this.alias = alias;
		this.topoServer = topoServer;
		this.mysqlDaemon = mysqlDaemon;
		this.stateStore = stateStore;
		this.hostResolver = hostResolver;
		this.hostnameOverride = hostnameOverride == null ? "" : hostnameOverride;
	}

	/**
	 * Reads the tablet record from the store and replaces the cached copy with it.
	 */
	public TabletInfo readTablet() {
		TabletInfo tablet = topoServer.getTablet(alias);
		stateStore.setTablet(tablet);
		return tablet;
	}

	/**
	 * Writes hostname, IP address and ports into the stored record. Only those fields are touched; everything else
	 * in the record is whatever the store holds at write time.
	 *
	 * @param mysqlPort
	 *            written only when non-zero, an unknown port leaves the stored one alone
	 * @param vtPort
	 *            always written
	 * @param vtsPort
	 *            written when non-zero, removed otherwise
	 */
	public TabletInfo register(int mysqlPort, int vtPort, int vtsPort) {
		String hostname = resolveHostname();
		String ipAddr;
		try {
			ipAddr = hostResolver.resolveIpAddr(hostname);
		} catch (IOException e) {
			throw new TopoUnavailableException("cannot resolve ip address of " + hostname, alias.toString(), e);
		}

		TabletInfo written = topoServer.updateTabletFields(alias, tablet -> {
			Map<String, Integer> ports = new HashMap<>(tablet.portMap());
			if (mysqlPort != 0) {
				ports.put(Tablet.MYSQL_PORT, mysqlPort);
			}
			ports.put(Tablet.VT_PORT, vtPort);
			if (vtsPort != 0) {
				ports.put(Tablet.VTS_PORT, vtsPort);
			} else {
				ports.remove(Tablet.VTS_PORT);
			}
			return tablet.withHostname(hostname).withIpAddr(ipAddr).withPortMap(ports);
		});
		logger.info("Registered tablet {} as {} ({}) with ports {}", alias, hostname, ipAddr,
				written.tablet().portMap());
		return written;
	}

	private String resolveHostname() {
		if (!hostnameOverride.isEmpty()) {
			return hostnameOverride;
		}
		try {
			return hostResolver.fullyQualifiedHostname();
		} catch (IOException e) {
			throw new TopoUnavailableException("cannot resolve local hostname", alias.toString(), e);
		}
	}

	/**
	 * Re-reads the record after {@link #register} so the cache holds the store's merged result.
	 */
	public TabletInfo reload() {
		return readTablet();
	}

	/**
	 * Runs the store's consistency check for this tablet. A failed check is logged and otherwise ignored: the
	 * store is likely just transiently inconsistent.
	 *
	 * @return true if the check passed
	 */
	public boolean verifyTopology() {
		if (stateStore.getTablet() == null) {
			throw new IllegalStateException("tablet " + alias + " has not been read yet");
		}
		try {
			topoServer.validateTablet(alias);
			return true;
		} catch (RuntimeException e) {
			logger.warn("Tablet validate failed for {}: {}", alias, e.getMessage());
			return false;
		}
	}

	/**
	 * Publishes this tablet's endpoint in the serving-address directory when the tablet is eligible to serve.
	 * Failures are logged and swallowed.
	 *
	 * @return true if an endpoint was published
	 */
	public boolean verifyServingAddrs() {
		TabletInfo info = stateStore.getTablet();
		if (info == null || !info.isRunningQueryService()) {
			return false;
		}
		Tablet tablet = info.tablet();
		try {
			EndPoint endPoint = tablet.endPoint();
			topoServer.updateTabletEndpoint(alias.cell(), tablet.keyspace(), tablet.shard(), tablet.type(),
					endPoint);
			logger.debug("Published endpoint {} for {}/{}/{}", endPoint, tablet.keyspace(), tablet.shard(),
					tablet.type());
			return true;
		} catch (RuntimeException e) {
			logger.warn("Failed to publish serving address of {}: {}", alias, e.getMessage());
			return false;
		}
	}

	/**
	 * Withdraws the endpoint published under {@code oldTablet}'s type once the tablet has moved to another type.
	 * Failures are logged and swallowed.
	 *
	 * @return true if the directory entry was removed
	 */
	public boolean removeServingAddr(Tablet oldTablet) {
		if (!oldTablet.isRunningQueryService()) {
			return false;
		}
		try {
			topoServer.deleteTabletEndpoint(alias.cell(), oldTablet.keyspace(), oldTablet.shard(), oldTablet.type(),
					alias.uid());
			logger.debug("Removed endpoint of {} from {}/{}/{}", alias, oldTablet.keyspace(), oldTablet.shard(),
					oldTablet.type());
			return true;
		} catch (RuntimeException e) {
			logger.warn("Failed to remove old serving address of {}: {}", alias, e.getMessage());
			return false;
		}
	}

	/**
	 * Compares the MySQL port in {@code tablet} with the daemon's actual port and writes the daemon's value back
	 * when they differ.
	 *
	 * @return the updated record, or empty when nothing changed or the write-back failed
	 */
	public Optional<TabletInfo> checkMysqlPort(TabletInfo tablet) {
		int actualPort;
		try {
			actualPort = mysqlDaemon.getListeningPort();
		} catch (RuntimeException e) {
			logger.warn("Cannot get current mysql port, not checking it: {}", e.getMessage());
			return Optional.empty();
		}

		int cachedPort = tablet.tablet().port(Tablet.MYSQL_PORT);
		if (actualPort == cachedPort) {
			return Optional.empty();
		}

		logger.warn("MySQL port has changed from {} to {}, updating it in tablet record", cachedPort, actualPort);
		TabletInfo updated = tablet.withTablet(tablet.tablet().withPort(Tablet.MYSQL_PORT, actualPort));
		try {
			long newVersion = topoServer.updateTablet(updated);
			return Optional.of(new TabletInfo(updated.tablet(), newVersion));
		} catch (RuntimeException e) {
			logger.warn("Failed to update tablet record, may use old mysql port: {}", e.getMessage());
			return Optional.empty();
		}
	}

	public TabletAlias getAlias() {
		return alias;
	}
}
