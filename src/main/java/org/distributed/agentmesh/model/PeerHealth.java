package org.distributed.agentmesh.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum PeerHealth {
    UNKNOWN("unknown"),
    HEALTHY("healthy"),
    UNHEALTHY("unhealthy");

    private final String status;

    PeerHealth(String status) {
        this.status = status;
    }

    @JsonValue
    public String getStatus() {
        return status;
    }
}
