package com.danieljhkim.tabletmgr.tmcommon.topo;

/**
 * Role a tablet currently plays in its shard.
 */
public enum TabletType {
    UNKNOWN,
    IDLE,
    MASTER,
    REPLICA,
    RDONLY,
    SPARE,
    EXPERIMENTAL,
    SCHEMA_UPGRADE,
    BACKUP,
    RESTORE,
    WORKER,
    SCRAP;

    /** Returns true if a tablet of this type is expected to answer queries. */
    public boolean isRunningQueryService() {
        return switch (this) {
            case MASTER, REPLICA, RDONLY, SPARE, EXPERIMENTAL, SCHEMA_UPGRADE, WORKER -> true;
            default -> false;
        };
    }

    /** Returns true if a tablet of this type replicates from a master. */
    public boolean isReplicaType() {
        return switch (this) {
            case REPLICA, RDONLY, SPARE, EXPERIMENTAL, SCHEMA_UPGRADE, BACKUP, RESTORE, WORKER -> true;
            default -> false;
        };
    }
}
