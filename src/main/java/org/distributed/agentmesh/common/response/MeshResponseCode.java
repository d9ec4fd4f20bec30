package org.distributed.agentmesh.common.response;

import lombok.AllArgsConstructor;

/**
 * Mapping table for management response codes and messages
 * */
@AllArgsConstructor
public enum MeshResponseCode {
    SUCCESS("0000", "Success"),

    REGISTRY_UNAVAILABLE("0202", "Registry unavailable"),

    GOSSIP_ALREADY_RUNNING("0301", "Gossip protocol already running"),
    GOSSIP_NOT_RUNNING("0302", "Gossip protocol not running"),

    UNKNOWN_ERROR("9999", "System error");

    private String code;
    private String message;

    public String getCode() {
        return this.code;
    }

    public String getMessage() {
        return this.message;
    }
}
