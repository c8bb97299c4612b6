package com.danieljhkim.tabletmgr.tmcommon.topo;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.UnaryOperator;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.danieljhkim.tabletmgr.tmcommon.exception.TopoNodeExistsException;
import com.danieljhkim.tabletmgr.tmcommon.exception.TopoNotFoundException;
import com.danieljhkim.tabletmgr.tmcommon.exception.TopoUnavailableException;
import com.danieljhkim.tabletmgr.tmcommon.exception.TopoValidationException;
import com.danieljhkim.tabletmgr.tmcommon.exception.TopoVersionMismatchException;

/**
 * Process-local {@link TopoServer}.
 *
 * <p>
 * Suitable for single-process deployments and tests. Versions are bumped on every write so the
 * optimistic-concurrency contract behaves like a remote store's.
 */
public class InMemoryTopoServer implements TopoServer {

    private static final Logger logger = LoggerFactory.getLogger(InMemoryTopoServer.class);
    private static final int MAX_UPDATE_ATTEMPTS = 8;

    private record ServingKey(String cell, String keyspace, String shard, TabletType type) {
    }

    private final Map<TabletAlias, TabletInfo> tablets = new ConcurrentHashMap<>();
    private final Map<ServingKey, Map<Long, EndPoint>> servingGraph = new ConcurrentHashMap<>();
    private final Map<ServingKey, TabletControl> tabletControls = new ConcurrentHashMap<>();

    @Override
    public void createTablet(Tablet tablet) {
        if (tablet.alias() == null) {
            throw new IllegalArgumentException("tablet has no alias");
        }
        TabletInfo existing = tablets.putIfAbsent(tablet.alias(), new TabletInfo(tablet, 1));
        if (existing != null) {
            throw new TopoNodeExistsException("tablet already exists", tablet.alias().toString());
        }
        logger.debug("Created tablet {}", tablet.alias());
    }

    @Override
    public TabletInfo getTablet(TabletAlias alias) {
        TabletInfo info = tablets.get(alias);
        if (info == null) {
            throw new TopoNotFoundException("no tablet record for " + alias, alias.toString());
        }
        return info;
    }

    @Override
    public TabletInfo updateTabletFields(TabletAlias alias, UnaryOperator<Tablet> update) {
        for (int attempt = 0; attempt < MAX_UPDATE_ATTEMPTS; attempt++) {
            TabletInfo current = getTablet(alias);
            Tablet updated = update.apply(current.tablet());
            if (updated == null) {
                throw new IllegalArgumentException("update function returned null for " + alias);
            }
            TabletInfo next = new TabletInfo(updated, current.version() + 1);
            if (tablets.replace(alias, current, next)) {
                return next;
            }
            logger.debug("Concurrent write on tablet {}, retrying update (attempt {})", alias, attempt + 1);
        }
        throw new TopoUnavailableException(
                "gave up updating tablet after " + MAX_UPDATE_ATTEMPTS + " conflicting writes", alias.toString());
    }

    @Override
    public long updateTablet(TabletInfo tabletInfo) {
        TabletAlias alias = tabletInfo.alias();
        TabletInfo current = getTablet(alias);
        if (current.version() != tabletInfo.version()) {
            throw new TopoVersionMismatchException(
                    "tablet version " + tabletInfo.version() + " is stale, store has " + current.version(),
                    alias.toString());
        }
        TabletInfo next = new TabletInfo(tabletInfo.tablet(), current.version() + 1);
        if (!tablets.replace(alias, current, next)) {
            throw new TopoVersionMismatchException("tablet changed during update", alias.toString());
        }
        return next.version();
    }

    @Override
    public void updateTabletEndpoint(String cell, String keyspace, String shard, TabletType type, EndPoint endPoint) {
        servingGraph.computeIfAbsent(new ServingKey(cell, keyspace, shard, type), k -> new ConcurrentHashMap<>())
                .put(endPoint.uid(), endPoint);
    }

    @Override
    public void deleteTabletEndpoint(String cell, String keyspace, String shard, TabletType type, long uid) {
        Map<Long, EndPoint> endPoints = servingGraph.get(new ServingKey(cell, keyspace, shard, type));
        if (endPoints != null) {
            endPoints.remove(uid);
        }
    }

    @Override
    public List<EndPoint> getEndPoints(String cell, String keyspace, String shard, TabletType type) {
        Map<Long, EndPoint> endPoints = servingGraph.get(new ServingKey(cell, keyspace, shard, type));
        return endPoints == null ? List.of() : List.copyOf(new ArrayList<>(endPoints.values()));
    }

    @Override
    public void validateTablet(TabletAlias alias) {
        Tablet tablet = getTablet(alias).tablet();
        if (!alias.equals(tablet.alias())) {
            throw new TopoValidationException(
                    "tablet record stored under " + alias + " names " + tablet.alias(), alias.toString());
        }
        if (tablet.type() != TabletType.IDLE && tablet.type() != TabletType.SCRAP
                && (tablet.keyspace().isEmpty() || tablet.shard().isEmpty())) {
            throw new TopoValidationException(
                    "tablet of type " + tablet.type() + " has no keyspace/shard", alias.toString());
        }
    }

    @Override
    public Optional<TabletControl> getTabletControl(String cell, String keyspace, String shard, TabletType type) {
        return Optional.ofNullable(tabletControls.get(new ServingKey(cell, keyspace, shard, type)));
    }

    @Override
    public void setTabletControl(String cell, String keyspace, String shard, TabletType type, TabletControl control) {
        ServingKey key = new ServingKey(cell, keyspace, shard, type);
        if (control == null) {
            tabletControls.remove(key);
        } else {
            tabletControls.put(key, control);
        }
    }
}
