package com.danieljhkim.tabletmgr.tmcommon.topo;

import java.util.List;
import java.util.Optional;
import java.util.function.UnaryOperator;

/**
 * Shared registry of tablet records, serving addresses and tablet controls.
 *
 * <p>
 * Other processes write to the same records concurrently. Writes are either field-scoped
 * read-modify-write ({@link #updateTabletFields}) or conditional on a previously read version
 * ({@link #updateTablet}); callers never get exclusive ownership of a record.
 */
public interface TopoServer {

    /**
     * Creates a tablet record.
     *
     * @throws com.danieljhkim.tabletmgr.tmcommon.exception.TopoNodeExistsException
     *             if a record already exists for the alias
     */
    void createTablet(Tablet tablet);

    /**
     * Reads a tablet record and its current version.
     *
     * @throws com.danieljhkim.tabletmgr.tmcommon.exception.TopoNotFoundException
     *             if there is no record for the alias
     */
    TabletInfo getTablet(TabletAlias alias);

    /**
     * Applies {@code update} to the current stored record and writes the result back. The store retries the
     * function on concurrent writers, so it must be free of side effects.
     *
     * @return the record as written
     */
    TabletInfo updateTabletFields(TabletAlias alias, UnaryOperator<Tablet> update);

    /**
     * Writes {@code tabletInfo} if the stored version still equals {@link TabletInfo#version()}.
     *
     * @return the new version
     * @throws com.danieljhkim.tabletmgr.tmcommon.exception.TopoVersionMismatchException
     *             if another writer got there first
     */
    long updateTablet(TabletInfo tabletInfo);

    /**
     * Publishes (or replaces) an endpoint in the serving-address directory for cell/keyspace/shard/type, keyed by
     * the endpoint uid.
     */
    void updateTabletEndpoint(String cell, String keyspace, String shard, TabletType type, EndPoint endPoint);

    /**
     * Removes the endpoint with {@code uid} from the directory entry for cell/keyspace/shard/type. Removing an
     * endpoint that is not there is not an error.
     */
    void deleteTabletEndpoint(String cell, String keyspace, String shard, TabletType type, long uid);

    /**
     * Lists the endpoints published for cell/keyspace/shard/type.
     */
    List<EndPoint> getEndPoints(String cell, String keyspace, String shard, TabletType type);

    /**
     * Checks that the store's view of the tablet is internally consistent.
     *
     * @throws com.danieljhkim.tabletmgr.tmcommon.exception.TabletManagerException
     *             describing the inconsistency
     */
    void validateTablet(TabletAlias alias);

    Optional<TabletControl> getTabletControl(String cell, String keyspace, String shard, TabletType type);

    void setTabletControl(String cell, String keyspace, String shard, TabletType type, TabletControl control);
}
