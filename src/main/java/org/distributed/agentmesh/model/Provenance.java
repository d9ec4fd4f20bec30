package org.distributed.agentmesh.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * How a peer record was learned.
 */
public enum Provenance {
    REGISTRY("registry"),
    DNS("dns"),
    GOSSIP("gossip");

    private final String tag;

    Provenance(String tag) {
        this.tag = tag;
    }

    @JsonValue
    public String getTag() {
        return tag;
    }

    @JsonCreator
    public static Provenance fromTag(String tag) {
        for (Provenance provenance : values()) {
            if (provenance.tag.equalsIgnoreCase(tag)) {
                return provenance;
            }
        }
        throw new IllegalArgumentException("Unknown provenance: " + tag);
    }
}
