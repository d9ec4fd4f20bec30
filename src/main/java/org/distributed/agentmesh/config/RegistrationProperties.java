package org.distributed.agentmesh.config;

import java.time.Duration;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.Data;

/**
 * Timing of the registration / heartbeat state machine.
 */
@Data
@Validated
@Configuration
@ConfigurationProperties(prefix = "registration")
public class RegistrationProperties {

    @NotNull
    private Duration heartbeatInterval = Duration.ofSeconds(60);

    // Minimum gap between two registration attempts
    @NotNull
    private Duration registerCooldown = Duration.ofSeconds(10);

    // Consecutive failures before backing off
    @Min(1)
    private int maxAttempts = 5;

    @NotNull
    private Duration backoff = Duration.ofSeconds(60);

    @NotNull
    private Duration heartbeatTimeout = Duration.ofSeconds(5);
}
