package org.distributed.agentmesh.config;

import java.time.Duration;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.Data;

@Data
@Validated
@Configuration
@ConfigurationProperties(prefix = "gossip")
public class GossipProperties {

    // Start the gossip loop at boot
    private boolean enabled = true;

    @NotNull
    private Duration interval = Duration.ofSeconds(60);

    // Peers contacted per round
    @Min(1)
    private int fanout = 3;

    // Cap on the peer ids sent in one exchange
    @Min(0)
    private int maxPeersToExchange = 10;

    @NotNull
    private Duration peerTtl = Duration.ofSeconds(3600);

    // Unknown-health peers seen within this window still count as usable
    @NotNull
    private Duration usableWindow = Duration.ofSeconds(300);

    @NotNull
    private Duration exchangeTimeout = Duration.ofSeconds(5);

    @NotNull
    private Duration healthTimeout = Duration.ofSeconds(2);

    @NotNull
    private Duration connectTimeout = Duration.ofSeconds(2);

    @Min(1)
    private int maxConcurrentExchanges = 5;
}
