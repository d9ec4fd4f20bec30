package org.distributed.agentmesh.controller;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import java.util.List;
import java.util.Optional;

import org.distributed.agentmesh.discovery.DnsLink;
import org.distributed.agentmesh.discovery.RegistryLink;
import org.distributed.agentmesh.gossip.GossipEngine;
import org.distributed.agentmesh.model.AgentQuery;
import org.distributed.agentmesh.model.AgentRecord;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import lombok.extern.slf4j.Slf4j;

@Slf4j
@SpringBootTest
@AutoConfigureMockMvc
@ActiveProfiles("test")
class DiscoveryControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockitoBean
    private GossipEngine gossipEngine;

    @MockitoBean
    private RegistryLink registryLink;

    @MockitoBean
    private DnsLink dnsLink;

    @Test
    void testDiscoverRequiresCapability() throws Exception {
        mockMvc.perform(get("/discover"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("Missing capability parameter"));
    }

    @Test
    void testDiscoverByCapability() throws Exception {
        when(registryLink.listAgents(any(AgentQuery.class)))
                .thenReturn(List.of(AgentRecord.builder().id("agent5.agents.local").capabilities(List.of("chat")).build()));

        mockMvc.perform(get("/discover").param("capability", "chat"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.agents[0].id").value("agent5.agents.local"))
                .andExpect(jsonPath("$.agents[0].provenance").value("registry"));
    }

    @Test
    void testSearchRejectsEmptyCriteria() throws Exception {
        mockMvc.perform(post("/search").contentType(MediaType.APPLICATION_JSON).content("{}"))
                .andExpect(status().isBadRequest());
    }

    @Test
    void testResolveUnknownAgent() throws Exception {
        when(registryLink.getAgent("ghost.agents.local")).thenReturn(Optional.empty());
        when(dnsLink.resolve("ghost.agents.local")).thenReturn(Optional.empty());

        mockMvc.perform(get("/resolve/ghost.agents.local"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.error").value("Agent not found"));
    }
}
