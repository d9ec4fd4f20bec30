package org.distributed.agentmesh.discovery;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.jsonPath;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withServerError;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withStatus;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import org.distributed.agentmesh.common.exception.RegistryException;
import org.distributed.agentmesh.config.JacksonConfig;
import org.distributed.agentmesh.model.AgentQuery;
import org.distributed.agentmesh.model.AgentRecord;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.converter.StringHttpMessageConverter;
import org.springframework.http.converter.json.MappingJackson2HttpMessageConverter;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestTemplate;

import lombok.extern.slf4j.Slf4j;

@Slf4j
class RestRegistryLinkTest {

    private MockRestServiceServer server;
    private RestRegistryLink registryLink;

    @BeforeEach
    void setUp() {
        RestTemplate restTemplate = new RestTemplate(List.of(
                new StringHttpMessageConverter(),
                new MappingJackson2HttpMessageConverter(new JacksonConfig().objectMapper())));
        server = MockRestServiceServer.bindTo(restTemplate).build();
        registryLink = new RestRegistryLink(restTemplate, restTemplate, "http://registry:5000/");
    }

    @Test
    void testRegisterSendsSnakeCaseRecord() {
        server.expect(requestTo("http://registry:5000/registerAgent"))
                .andExpect(method(HttpMethod.POST))
                .andExpect(jsonPath("$.id").value("agent1.agents.local"))
                .andExpect(jsonPath("$.model_info.provider").value("openai"))
                .andRespond(withSuccess("{\"status\":\"success\",\"agent\":{\"id\":\"agent1.agents.local\"}}",
                        MediaType.APPLICATION_JSON));

        Map<String, Object> answer = registryLink.register(AgentRecord.builder()
                .id("agent1.agents.local")
                .modelInfo(Map.of("provider", "openai"))
                .lastUpdate(Instant.parse("2025-01-01T00:00:00Z"))
                .build());

        assertThat(answer).containsEntry("status", "success");
        server.verify();
    }

    @Test
    void testListAgentsByCapability() {
        server.expect(requestTo("http://registry:5000/agents?capability=chat&limit=10"))
                .andExpect(method(HttpMethod.GET))
                .andRespond(withSuccess("{\"agents\":[{\"id\":\"agent2.agents.local\",\"capabilities\":[\"chat\"],"
                        + "\"model_info\":{\"provider\":\"anthropic\"},\"port\":8001,\"extra\":true}]}",
                        MediaType.APPLICATION_JSON));

        List<AgentRecord> agents = registryLink.listAgents(AgentQuery.builder().capability("chat").limit(10).build());

        assertThat(agents).hasSize(1);
        assertThat(agents.get(0).getProvider()).isEqualTo("anthropic");
        assertThat(agents.get(0).getPort()).isEqualTo("8001");
    }

    @Test
    void testGetAgentNotFoundIsEmpty() {
        server.expect(requestTo("http://registry:5000/agents/ghost.agents.local"))
                .andRespond(withStatus(HttpStatus.NOT_FOUND));

        assertThat(registryLink.getAgent("ghost.agents.local")).isEmpty();
    }

    @Test
    void testGetAgentServerErrorThrows() {
        server.expect(requestTo("http://registry:5000/agents/agent2.agents.local")).andRespond(withServerError());

        assertThatThrownBy(() -> registryLink.getAgent("agent2.agents.local"))
                .isInstanceOf(RegistryException.class)
                .satisfies(e -> assertThat(((RegistryException) e).getStatusCode()).isEqualTo(500));
    }

    @Test
    void testHeartbeatStatuses() {
        server.expect(requestTo("http://registry:5000/agents/agent1.agents.local/heartbeat"))
                .andExpect(method(HttpMethod.PUT))
                .andRespond(withSuccess());
        server.expect(requestTo("http://registry:5000/agents/agent1.agents.local/heartbeat"))
                .andRespond(withStatus(HttpStatus.NOT_FOUND));
        server.expect(requestTo("http://registry:5000/agents/agent1.agents.local/heartbeat"))
                .andRespond(withServerError());

        assertThat(registryLink.heartbeat("agent1.agents.local")).isEqualTo(HeartbeatStatus.OK);
        assertThat(registryLink.heartbeat("agent1.agents.local")).isEqualTo(HeartbeatStatus.NOT_FOUND);
        assertThat(registryLink.heartbeat("agent1.agents.local")).isEqualTo(HeartbeatStatus.ERROR);
        server.verify();
    }

    @Test
    void testUnregister() {
        server.expect(requestTo("http://registry:5000/agents/agent1.agents.local"))
                .andExpect(method(HttpMethod.DELETE))
                .andRespond(withSuccess());

        registryLink.unregister("agent1.agents.local");

        server.verify();
    }
}
