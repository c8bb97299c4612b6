package com.danieljhkim.tabletmgr.tmcommon.topo;

/**
 * A {@link Tablet} as read from the topology store, together with the store version it was read at.
 * Passing it back to {@link TopoServer#updateTablet(TabletInfo)} makes the write conditional on that version.
 */
public record TabletInfo(Tablet tablet, long version) {

    public TabletInfo {
        if (tablet == null) {
            throw new IllegalArgumentException("tablet cannot be null");
        }
    }

    public TabletAlias alias() {
        return tablet.alias();
    }

    public String keyspace() {
        return tablet.keyspace();
    }

    public String shard() {
        return tablet.shard();
    }

    public TabletType type() {
        return tablet.type();
    }

    public boolean isRunningQueryService() {
        return tablet.isRunningQueryService();
    }

    public TabletInfo withTablet(Tablet newTablet) {
        return new TabletInfo(newTablet, version);
    }
}
