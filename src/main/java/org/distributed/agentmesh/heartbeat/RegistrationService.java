package org.distributed.agentmesh.heartbeat;

import java.time.Clock;
import java.time.Instant;

import org.distributed.agentmesh.common.exception.RegistryException;
import org.distributed.agentmesh.config.AgentProperties;
import org.distributed.agentmesh.config.RegistrationProperties;
import org.distributed.agentmesh.discovery.HeartbeatStatus;
import org.distributed.agentmesh.discovery.RegistryLink;
import org.springframework.scheduling.annotation.Scheduled;

import lombok.extern.slf4j.Slf4j;

/**
 * Keeps this node registered with the directory.
 * While registered a heartbeat goes out every heartbeat interval. While not,
 * a registration is attempted at most once per cooldown; after max attempts
 * consecutive failures the loop backs off and starts counting again.
 * A heartbeat answered with "not found", or max attempts heartbeats in a row
 * that fail in transport, drop the node back to unregistered.
 */
@Slf4j
public class RegistrationService {

    private final RegistryLink registryLink;
    private final AgentProperties agentProperties;
    private final RegistrationProperties properties;
    private final Clock clock;

    private boolean registered = false;
    private int failedAttempts = 0;
    private int heartbeatErrors = 0;
    private Instant lastAttempt;
    private Instant lastHeartbeat;
    private Instant backoffUntil;

    public RegistrationService(RegistryLink registryLink, AgentProperties agentProperties,
                               RegistrationProperties properties, Clock clock) {
        this.registryLink = registryLink;
        this.agentProperties = agentProperties;
        this.properties = properties;
        this.clock = clock;
    }

    @Scheduled(initialDelay = 1000, fixedDelay = 1000)
    public synchronized void tick() {
        Instant now = clock.instant();
        if (registered) {
            if (lastHeartbeat == null || !now.isBefore(lastHeartbeat.plus(properties.getHeartbeatInterval()))) {
                sendHeartbeat(now);
            }
            return;
        }
        if (backoffUntil != null && now.isBefore(backoffUntil)) {
            return;
        }
        if (lastAttempt != null && now.isBefore(lastAttempt.plus(properties.getRegisterCooldown()))) {
            return;
        }
        register();
    }

    /**
     * One registration attempt, counted against max attempts.
     * @return true when the directory accepted the record
     */
    public synchronized boolean register() {
        Instant now = clock.instant();
        lastAttempt = now;
        String agentId = agentProperties.getId();
        try {
            registryLink.register(agentProperties.toRecord(now));
            registered = true;
            failedAttempts = 0;
            heartbeatErrors = 0;
            backoffUntil = null;
            lastHeartbeat = now;
            log.info("[Registration] Agent {} registered", agentId);
            return true;
        } catch (RegistryException e) {
            failedAttempts++;
            log.warn("[Registration] Registration attempt {}/{} failed for {}: {}",
                    failedAttempts, properties.getMaxAttempts(), agentId, e.getMessage());
            if (failedAttempts >= properties.getMaxAttempts()) {
                backoffUntil = now.plus(properties.getBackoff());
                failedAttempts = 0;
                log.error("[Registration] Max registration attempts reached, backing off for {}s",
                        properties.getBackoff().getSeconds());
            }
            return false;
        }
    }

    /**
     * Best effort removal from the directory, used on shutdown.
     */
    public synchronized void unregister() {
        if (!registered) {
            return;
        }
        try {
            registryLink.unregister(agentProperties.getId());
            log.info("[Registration] Agent {} unregistered", agentProperties.getId());
        } catch (RegistryException e) {
            log.warn("[Registration] Failed to unregister {}: {}", agentProperties.getId(), e.getMessage());
        }
        registered = false;
    }

    public synchronized boolean isRegistered() {
        return registered;
    }

    public synchronized RegistrationStatus status() {
        return RegistrationStatus.builder()
                .agentId(agentProperties.getId())
                .registered(registered)
                .failedAttempts(failedAttempts)
                .lastHeartbeat(lastHeartbeat)
                .lastAttempt(lastAttempt)
                .backoffUntil(backoffUntil)
                .build();
    }

    private void sendHeartbeat(Instant now) {
        lastHeartbeat = now;
        HeartbeatStatus status = registryLink.heartbeat(agentProperties.getId());
        switch (status) {
            case OK:
                heartbeatErrors = 0;
                log.debug("[Registration] Heartbeat acknowledged");
                break;
            case NOT_FOUND:
                registered = false;
                heartbeatErrors = 0;
                // the next registration waits out the cooldown
                lastAttempt = now;
                log.warn("[Registration] Agent {} not found in registry, will re-register", agentProperties.getId());
                break;
            default:
                heartbeatErrors++;
                log.warn("[Registration] Heartbeat failed ({} in a row)", heartbeatErrors);
                if (heartbeatErrors >= properties.getMaxAttempts()) {
                    registered = false;
                    heartbeatErrors = 0;
                    lastAttempt = now;
                    log.error("[Registration] Registry unreachable, marking agent as unregistered");
                }
                break;
        }
    }
}
