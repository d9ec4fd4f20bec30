package org.distributed.agentmesh.controller;

import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import java.util.List;

import org.distributed.agentmesh.discovery.DnsLink;
import org.distributed.agentmesh.discovery.RegistryLink;
import org.distributed.agentmesh.gossip.GossipEngine;
import org.distributed.agentmesh.model.AgentRecord;
import org.distributed.agentmesh.peer.PeerTable;
import org.distributed.agentmesh.peer.RestPeerClient;
import org.junit.jupiter.api.AfterEach;
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
class PeerControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private PeerTable peerTable;

    @MockitoBean
    private GossipEngine gossipEngine;

    @MockitoBean
    private RegistryLink registryLink;

    @MockitoBean
    private DnsLink dnsLink;

    @AfterEach
    void tearDown() {
        for (String id : peerTable.ids()) {
            peerTable.remove(id);
        }
    }

    @Test
    void testGetPeers() throws Exception {
        peerTable.upsert("agent2.agents.local", AgentRecord.builder().id("agent2.agents.local").build());

        mockMvc.perform(get("/peers"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.peers[0]").value("agent2.agents.local"));
    }

    @Test
    void testPostPeers() throws Exception {
        when(gossipEngine.receivePeers(anyList(), eq("agent2.agents.local")))
                .thenReturn(List.of("agent3.agents.local"));

        mockMvc.perform(post("/peers")
                        .contentType(MediaType.APPLICATION_JSON)
                        .header(RestPeerClient.GOSSIP_FROM_HEADER, "agent2.agents.local")
                        .content("{\"peers\":[\"agent3.agents.local\"]}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("success"))
                .andExpect(jsonPath("$.added_peers[0]").value("agent3.agents.local"))
                .andExpect(jsonPath("$.total_peers").value(0));

        verify(gossipEngine).receivePeers(List.of("agent3.agents.local"), "agent2.agents.local");
    }

    @Test
    void testPostPeersWithoutPeersField() throws Exception {
        mockMvc.perform(post("/peers")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"agents\":[]}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").exists());
    }

    @Test
    void testHealthAndMetadata() throws Exception {
        mockMvc.perform(get("/health"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("ok"));

        mockMvc.perform(get("/metadata"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.id").value("test-agent.agents.local"))
                .andExpect(jsonPath("$.endpoints.peers").value("/peers"))
                .andExpect(jsonPath("$.interfaces.rest").value("http://localhost:8000/v1"));
    }
}
