package org.distributed.agentmesh.controller;

import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import org.distributed.agentmesh.discovery.DnsLink;
import org.distributed.agentmesh.discovery.RegistryLink;
import org.distributed.agentmesh.gossip.GossipEngine;
import org.distributed.agentmesh.gossip.GossipStats;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import lombok.extern.slf4j.Slf4j;

@Slf4j
@SpringBootTest
@AutoConfigureMockMvc
@ActiveProfiles("test")
class GossipManagementControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockitoBean
    private GossipEngine gossipEngine;

    @MockitoBean
    private RegistryLink registryLink;

    @MockitoBean
    private DnsLink dnsLink;

    @Test
    void testStartWhenAlreadyRunning() throws Exception {
        when(gossipEngine.start()).thenReturn(false);

        mockMvc.perform(post("/gossip/start"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.code").value("0301"));
    }

    @Test
    void testStopWhenNotRunning() throws Exception {
        when(gossipEngine.stop()).thenReturn(false);

        mockMvc.perform(post("/gossip/stop"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.code").value("0302"));
    }

    @Test
    void testStartAndStop() throws Exception {
        when(gossipEngine.start()).thenReturn(true);
        when(gossipEngine.stop()).thenReturn(true);

        mockMvc.perform(post("/gossip/start"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.code").value("0000"))
                .andExpect(jsonPath("$.data").value("Gossip protocol started"));
        mockMvc.perform(post("/gossip/stop"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.code").value("0000"));
    }

    @Test
    void testStats() throws Exception {
        when(gossipEngine.stats()).thenReturn(GossipStats.builder().running(true).knownPeers(4).roundsCompleted(2).build());

        mockMvc.perform(get("/gossip/stats"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.running").value(true))
                .andExpect(jsonPath("$.known_peers").value(4))
                .andExpect(jsonPath("$.rounds_completed").value(2));
    }

    @Test
    void testRoundFailureIsReported() throws Exception {
        when(gossipEngine.runRound()).thenThrow(new IllegalStateException("exchange pool shut down"));

        mockMvc.perform(post("/gossip/round"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.code").value("9999"))
                .andExpect(jsonPath("$.message").value("Failed to run gossip round: exchange pool shut down"));
    }
}
