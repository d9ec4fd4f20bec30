package org.distributed.agentmesh.config;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import org.distributed.agentmesh.discovery.DiscoveryMethod;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import lombok.Data;

@Data
@Validated
@Configuration
@ConfigurationProperties(prefix = "discovery")
public class DiscoveryProperties {

    // How long a resolved record is served from the cache
    @NotNull
    private Duration cacheTtl = Duration.ofSeconds(600);

    // Period of the full directory refresh
    @NotNull
    private Duration refreshInterval = Duration.ofSeconds(300);

    // Single-id lookup order
    @NotEmpty
    private List<DiscoveryMethod> methods = new ArrayList<>(List.of(DiscoveryMethod.REGISTRY, DiscoveryMethod.DNS));

    @NotNull
    private Duration registryTimeout = Duration.ofSeconds(10);

    @NotNull
    private Duration registryConnectTimeout = Duration.ofSeconds(3);
}
