package com.danieljhkim.tabletmgr.tmcommon.topo;

import java.util.Map;

/**
 * Network address of a serving tablet as published in the serving-address directory.
 */
public record EndPoint(long uid, String host, Map<String, Integer> namedPortMap) {

    public EndPoint {
        if (host == null || host.isBlank()) {
            throw new IllegalArgumentException("host cannot be null or blank");
        }
        namedPortMap = namedPortMap == null ? Map.of() : Map.copyOf(namedPortMap);
    }
}
