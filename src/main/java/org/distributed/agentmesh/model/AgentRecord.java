package org.distributed.agentmesh.model;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * Everything known about one agent.
 * Records are never patched: a newer discovery or exchange produces a new
 * instance through {@link #toBuilder()} and replaces the old one.
 *
 * JSON example (snake_case on the wire):
 * {"id":"agent1.agents.local","capabilities":["chat"],"interfaces":{"rest":"http://agent1:8000/v1"},"last_update":1712345678.1}
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public class AgentRecord {

    public static final String REST_INTERFACE = "rest";
    public static final String PEERS_ENDPOINT = "peers";
    public static final String PING_ENDPOINT = "ping";

    String id;
    String name;
    String description;

    @Builder.Default
    List<String> capabilities = new ArrayList<>();

    // protocol name -> URL, e.g. rest -> http://agent1:8000/v1
    @Builder.Default
    Map<String, String> interfaces = new HashMap<>();

    // logical name -> path, e.g. peers -> /peers
    @Builder.Default
    Map<String, String> endpoints = new HashMap<>();

    String host;

    // Kept as received; registries and DNS hand out both numbers and strings
    String port;

    String version;

    @Builder.Default
    List<String> protocols = new ArrayList<>();

    @Builder.Default
    Map<String, String> modelInfo = new HashMap<>();

    String owner;
    Instant lastUpdate;
    Provenance provenance;
    Instant cacheTime;

    // Only set on placeholders learned through gossip
    Boolean needsResolution;
    String discoveredVia;

    /**
     * Minimal record for an id learned through gossip that could not be resolved yet.
     */
    public static AgentRecord placeholder(String id, String discoveredVia) {
        return AgentRecord.builder()
                .id(id)
                .provenance(Provenance.GOSSIP)
                .needsResolution(true)
                .discoveredVia(discoveredVia)
                .build();
    }

    public boolean hasCapability(String capability) {
        return capabilities != null && capabilities.contains(capability);
    }

    @JsonIgnore
    public boolean isPlaceholder() {
        return Boolean.TRUE.equals(needsResolution);
    }

    @JsonIgnore
    public String getProvider() {
        return modelInfo == null ? null : modelInfo.get("provider");
    }

    public AgentRecord cachedAs(Provenance source, Instant now) {
        return toBuilder().provenance(source).cacheTime(now).build();
    }
}
