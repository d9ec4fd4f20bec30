package org.distributed.agentmesh.config;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import org.distributed.agentmesh.model.AgentRecord;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import lombok.Data;

/**
 * Identity of the local node and the location of its external collaborators.
 */
@Data
@Validated
@Configuration
@ConfigurationProperties(prefix = "agent")
public class AgentProperties {

    // Globally unique, domain-like, e.g. agent1.agents.local
    @NotBlank
    private String id;

    private String name;
    private String description;
    private List<String> capabilities = new ArrayList<>();

    // Host other nodes should use to reach this one
    private String host;

    @Min(1)
    @Max(65535)
    private int port = 8000;

    private String version = "0.1.0";
    private List<String> protocols = new ArrayList<>(List.of("rest-json"));
    private Map<String, String> interfaces = new HashMap<>();
    private Map<String, String> endpoints = new HashMap<>();
    private Map<String, String> modelInfo = new HashMap<>();
    private String owner;

    @NotBlank
    private String registryUrl = "http://registry:5000";

    private String dnsServer = "bind";
    private int dnsPort = 53;

    /**
     * Record this node registers with the directory and serves on /metadata.
     */
    public AgentRecord toRecord(Instant now) {
        // unset environment placeholders bind as empty strings
        String advertisedHost = blankToNull(host);
        Map<String, String> advertisedInterfaces = new HashMap<>(interfaces);
        if (!advertisedInterfaces.containsKey(AgentRecord.REST_INTERFACE) && advertisedHost != null) {
            advertisedInterfaces.put(AgentRecord.REST_INTERFACE, "http://" + advertisedHost + ":" + port + "/v1");
        }
        Map<String, String> advertisedEndpoints = new HashMap<>(endpoints);
        advertisedEndpoints.putIfAbsent(AgentRecord.PEERS_ENDPOINT, "/peers");
        advertisedEndpoints.putIfAbsent(AgentRecord.PING_ENDPOINT, "/health");
        advertisedEndpoints.putIfAbsent("metadata", "/metadata");

        return AgentRecord.builder()
                .id(id)
                .name(blankToNull(name) != null ? name : "Agent-" + id)
                .description(blankToNull(description))
                .capabilities(new ArrayList<>(capabilities))
                .interfaces(advertisedInterfaces)
                .endpoints(advertisedEndpoints)
                .host(advertisedHost)
                .port(String.valueOf(port))
                .version(version)
                .protocols(new ArrayList<>(protocols))
                .modelInfo(new HashMap<>(modelInfo))
                .owner(owner)
                .lastUpdate(now)
                .build();
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value;
    }
}
