package org.distributed.agentmesh.peer;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.Map;

import org.distributed.agentmesh.model.AgentRecord;
import org.distributed.agentmesh.model.PeerAddress;
import org.junit.jupiter.api.Test;

import lombok.extern.slf4j.Slf4j;

@Slf4j
class PeerAddressResolverTest {

    @Test
    void testExplicitHostAndPort() {
        AgentRecord record = AgentRecord.builder().id("agent2.agents.local").host("10.0.0.5").port("9001").build();

        PeerAddress address = PeerAddressResolver.resolve(record.getId(), record);

        assertThat(address).isEqualTo(new PeerAddress("10.0.0.5", 9001));
    }

    @Test
    void testHostAndPortFromRestInterface() {
        AgentRecord record = AgentRecord.builder()
                .id("agent2.agents.local")
                .interfaces(Map.of("rest", "http://agent2:8080/v1"))
                .build();

        PeerAddress address = PeerAddressResolver.resolve(record.getId(), record);

        assertThat(address).isEqualTo(new PeerAddress("agent2", 8080));
    }

    @Test
    void testExplicitPortWinsOverInterfacePort() {
        AgentRecord record = AgentRecord.builder()
                .id("agent2.agents.local")
                .port("9000")
                .interfaces(Map.of("rest", "http://agent2:8080/v1"))
                .build();

        PeerAddress address = PeerAddressResolver.resolve(record.getId(), record);

        assertThat(address).isEqualTo(new PeerAddress("agent2", 9000));
    }

    @Test
    void testInvalidPortIsSkipped() {
        AgentRecord record = AgentRecord.builder()
                .id("agent2.agents.local")
                .port("not-a-port")
                .interfaces(Map.of("rest", "http://agent2:8081/v1"))
                .build();

        PeerAddress address = PeerAddressResolver.resolve(record.getId(), record);

        log.info("Resolved address: {}", address);
        assertThat(address.getPort()).isEqualTo(8081);
    }

    @Test
    void testHostFromIdLeadingLabelAndDefaultPort() {
        AgentRecord record = AgentRecord.placeholder("agent3.agents.local", "agent2.agents.local");

        PeerAddress address = PeerAddressResolver.resolve(record.getId(), record);

        assertThat(address).isEqualTo(new PeerAddress("agent3", PeerAddress.DEFAULT_PORT));
        assertThat(address.uri("/peers")).hasToString("http://agent3:8000/peers");
    }

    @Test
    void testIdWithoutDotLeavesHostUnknown() {
        AgentRecord record = AgentRecord.builder().id("standalone").build();

        PeerAddress address = PeerAddressResolver.resolve(record.getId(), record);

        assertThat(address.isResolvable()).isFalse();
        assertThat(address.getPort()).isEqualTo(PeerAddress.DEFAULT_PORT);
    }
}
