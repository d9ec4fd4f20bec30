package org.distributed.agentmesh;

import static org.assertj.core.api.Assertions.assertThat;

import org.distributed.agentmesh.gossip.GossipEngine;
import org.distributed.agentmesh.heartbeat.RegistrationService;
import org.distributed.agentmesh.peer.PeerTable;
import org.junit.jupiter.api.Test;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;

import jakarta.annotation.Resource;
import lombok.extern.slf4j.Slf4j;

@Slf4j
@SpringBootTest
@ActiveProfiles("test")
class AgentMeshApplicationTests {

    @Resource
    private PeerTable peerTable;

    @Resource
    private GossipEngine gossipEngine;

    @Resource
    private RegistrationService registrationService;

    @Test
    void contextLoads() {
        assertThat(peerTable.getSelfId()).isEqualTo("test-agent.agents.local");
        // bootstrap is off under the test profile
        assertThat(gossipEngine.isRunning()).isFalse();
        assertThat(registrationService.isRegistered()).isFalse();
    }
}
