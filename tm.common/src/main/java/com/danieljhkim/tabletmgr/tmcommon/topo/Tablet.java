package com.danieljhkim.tabletmgr.tmcommon.topo;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;

/**
 * Immutable cluster-visible record of one tablet. The topology store owns the durable copy;
 * writers derive a modified copy with the {@code with*} methods.
 *
 * <p>
 * {@code tags} holds fields this agent does not own. They are carried through every rewrite unchanged.
 */
public record Tablet(
        TabletAlias alias,
        String hostname,
        String ipAddr,
        Map<String, Integer> portMap,
        String keyspace,
        String shard,
        TabletType type,
        Map<String, String> tags) {

    public static final String MYSQL_PORT = "mysql";
    public static final String VT_PORT = "vt";
    public static final String VTS_PORT = "vts";

    /** Record with no identity, used as the "previous" tablet for the first state change. */
    public static final Tablet EMPTY = new Tablet(null, "", "", Map.of(), "", "", TabletType.UNKNOWN, Map.of());

    public Tablet {
        hostname = hostname == null ? "" : hostname;
        ipAddr = ipAddr == null ? "" : ipAddr;
        keyspace = keyspace == null ? "" : keyspace;
        shard = shard == null ? "" : shard;
        if (type == null) {
            type = TabletType.UNKNOWN;
        }
        portMap = portMap == null ? Collections.emptyMap() : Collections.unmodifiableMap(new HashMap<>(portMap));
        tags = tags == null ? Collections.emptyMap() : Collections.unmodifiableMap(new HashMap<>(tags));
    }

    /**
     * Convenience constructor for a freshly created, not yet registered tablet.
     */
    public static Tablet create(TabletAlias alias, String keyspace, String shard, TabletType type) {
        return new Tablet(alias, "", "", Map.of(), keyspace, shard, type, Map.of());
    }

    public Tablet withHostname(String newHostname) {
        return new Tablet(alias, newHostname, ipAddr, portMap, keyspace, shard, type, tags);
    }

    public Tablet withIpAddr(String newIpAddr) {
        return new Tablet(alias, hostname, newIpAddr, portMap, keyspace, shard, type, tags);
    }

    public Tablet withType(TabletType newType) {
        return new Tablet(alias, hostname, ipAddr, portMap, keyspace, shard, newType, tags);
    }

    public Tablet withPortMap(Map<String, Integer> newPortMap) {
        return new Tablet(alias, hostname, ipAddr, newPortMap, keyspace, shard, type, tags);
    }

    public Tablet withPort(String name, int port) {
        Map<String, Integer> ports = new HashMap<>(portMap);
        ports.put(name, port);
        return withPortMap(ports);
    }

    public Tablet withoutPort(String name) {
        if (!portMap.containsKey(name)) {
            return this;
        }
        Map<String, Integer> ports = new HashMap<>(portMap);
        ports.remove(name);
        return withPortMap(ports);
    }

    public Tablet withTag(String key, String value) {
        Map<String, String> newTags = new HashMap<>(tags);
        newTags.put(key, value);
        return new Tablet(alias, hostname, ipAddr, portMap, keyspace, shard, type, newTags);
    }

    /**
     * Returns the named port, or 0 when the port map has no entry for it.
     */
    public int port(String name) {
        Integer port = portMap.get(name);
        return port == null ? 0 : port;
    }

    public boolean isRunningQueryService() {
        return type.isRunningQueryService();
    }

    /**
     * Builds the address this tablet publishes in the serving-address directory.
     */
    public EndPoint endPoint() {
        if (alias == null) {
            throw new IllegalStateException("tablet has no alias");
        }
        if (hostname.isEmpty()) {
            throw new IllegalStateException("tablet " + alias + " has no hostname");
        }
        return new EndPoint(alias.uid(), hostname, portMap);
    }
}
