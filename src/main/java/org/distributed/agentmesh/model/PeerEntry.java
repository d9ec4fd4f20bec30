package org.distributed.agentmesh.model;

import java.time.Instant;

import lombok.Value;

/**
 * Read snapshot of one peer table row. Health is null when no health
 * outcome was ever recorded for the peer.
 */
@Value
public class PeerEntry {
    String id;
    AgentRecord record;
    PeerAddress address;
    PeerHealth health;
    Instant lastSeen;

    public boolean hasHealthRecord() {
        return health != null;
    }

    public String endpointPath(String logicalName, String fallback) {
        String path = record.getEndpoints() == null ? null : record.getEndpoints().get(logicalName);
        // Only paths are usable here, absolute URLs point at whatever host registered them
        if (path == null || path.isBlank() || path.contains("://")) {
            return fallback;
        }
        return path;
    }
}
