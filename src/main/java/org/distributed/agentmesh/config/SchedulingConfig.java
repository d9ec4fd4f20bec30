package org.distributed.agentmesh.config;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Turns on the registration and refresh loops. The test profile switches them off.
 */
@Configuration
@EnableScheduling
@ConditionalOnProperty(name = "mesh.scheduling.enabled", havingValue = "true", matchIfMissing = true)
public class SchedulingConfig {
}
