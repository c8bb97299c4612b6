package com.danieljhkim.tabletmgr.tmcommon.topo;

import java.util.Set;

/**
 * Serving overrides set on a tablet by an external controller (e.g. during a traffic migration).
 * Always replaced as a whole, never merged.
 */
public record TabletControl(Set<String> blacklistedTables, boolean disableQueryService) {

    public TabletControl {
        blacklistedTables = blacklistedTables == null ? Set.of() : Set.copyOf(blacklistedTables);
    }
}
