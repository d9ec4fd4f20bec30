package org.distributed.agentmesh.heartbeat;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.time.Instant;
import java.util.Map;

import org.distributed.agentmesh.MutableClock;
import org.distributed.agentmesh.common.exception.RegistryException;
import org.distributed.agentmesh.config.AgentProperties;
import org.distributed.agentmesh.config.RegistrationProperties;
import org.distributed.agentmesh.discovery.HeartbeatStatus;
import org.distributed.agentmesh.discovery.RegistryLink;
import org.distributed.agentmesh.model.AgentRecord;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import lombok.extern.slf4j.Slf4j;

@Slf4j
class RegistrationServiceTest {

    private static final String AGENT_ID = "agent1.agents.local";

    private MutableClock clock;
    private RegistryLink registryLink;
    private RegistrationService registrationService;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2025-01-01T00:00:00Z"));
        registryLink = mock(RegistryLink.class);
        AgentProperties agentProperties = new AgentProperties();
        agentProperties.setId(AGENT_ID);
        agentProperties.setHost("agent1");
        registrationService = new RegistrationService(registryLink, agentProperties, new RegistrationProperties(), clock);
    }

    @Test
    void testHeartbeatNotFoundTriggersReRegistrationAfterCooldown() {
        when(registryLink.register(any(AgentRecord.class))).thenReturn(Map.of("status", "success"));
        when(registryLink.heartbeat(AGENT_ID)).thenReturn(HeartbeatStatus.NOT_FOUND);

        registrationService.tick();
        assertThat(registrationService.isRegistered()).isTrue();

        clock.advanceSeconds(60);
        registrationService.tick();
        assertThat(registrationService.isRegistered()).isFalse();

        // still inside the 10s cooldown
        clock.advanceSeconds(5);
        registrationService.tick();
        verify(registryLink, times(1)).register(any(AgentRecord.class));
        assertThat(registrationService.isRegistered()).isFalse();

        clock.advanceSeconds(5);
        registrationService.tick();
        verify(registryLink, times(2)).register(any(AgentRecord.class));
        assertThat(registrationService.isRegistered()).isTrue();
    }

    @Test
    void testHeartbeatWaitsForInterval() {
        when(registryLink.heartbeat(AGENT_ID)).thenReturn(HeartbeatStatus.OK);
        registrationService.tick();

        clock.advanceSeconds(59);
        registrationService.tick();
        verify(registryLink, never()).heartbeat(AGENT_ID);

        clock.advanceSeconds(1);
        registrationService.tick();
        verify(registryLink, times(1)).heartbeat(AGENT_ID);
        assertThat(registrationService.isRegistered()).isTrue();
    }

    @Test
    void testBacksOffAfterMaxFailedAttempts() {
        when(registryLink.register(any(AgentRecord.class))).thenThrow(new RegistryException("Connection refused", null));

        for (int i = 0; i < 5; i++) {
            registrationService.tick();
            clock.advanceSeconds(10);
        }
        verify(registryLink, times(5)).register(any(AgentRecord.class));
        assertThat(registrationService.status().getBackoffUntil()).isEqualTo(Instant.parse("2025-01-01T00:01:40Z"));

        // t=50s, inside the 60s back-off that started at t=40s
        registrationService.tick();
        verify(registryLink, times(5)).register(any(AgentRecord.class));

        clock.advanceSeconds(50);
        registrationService.tick();
        verify(registryLink, times(6)).register(any(AgentRecord.class));
        assertThat(registrationService.status().getFailedAttempts()).isEqualTo(1);
    }

    @Test
    void testRepeatedHeartbeatErrorsDropRegistration() {
        when(registryLink.heartbeat(AGENT_ID)).thenReturn(HeartbeatStatus.ERROR);
        registrationService.tick();

        for (int i = 0; i < 4; i++) {
            clock.advanceSeconds(60);
            registrationService.tick();
            assertThat(registrationService.isRegistered()).isTrue();
        }
        clock.advanceSeconds(60);
        registrationService.tick();

        assertThat(registrationService.isRegistered()).isFalse();
    }

    @Test
    void testUnregisterOnlyWhenRegistered() {
        registrationService.unregister();
        verify(registryLink, never()).unregister(AGENT_ID);

        registrationService.register();
        registrationService.unregister();

        verify(registryLink, times(1)).unregister(AGENT_ID);
        assertThat(registrationService.isRegistered()).isFalse();
    }
}
