package org.distributed.agentmesh.heartbeat;

import java.time.Instant;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class RegistrationStatus {
    String agentId;
    boolean registered;
    int failedAttempts;
    Instant lastHeartbeat;
    Instant lastAttempt;
    Instant backoffUntil;
}
