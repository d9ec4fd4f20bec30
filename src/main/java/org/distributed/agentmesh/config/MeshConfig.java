package org.distributed.agentmesh.config;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Random;

import org.distributed.agentmesh.discovery.DiscoveryCache;
import org.distributed.agentmesh.discovery.DnsLink;
import org.distributed.agentmesh.discovery.DnsQuery;
import org.distributed.agentmesh.discovery.JndiDnsQuery;
import org.distributed.agentmesh.discovery.RegistryLink;
import org.distributed.agentmesh.discovery.RestRegistryLink;
import org.distributed.agentmesh.gossip.GossipEngine;
import org.distributed.agentmesh.heartbeat.RegistrationService;
import org.distributed.agentmesh.peer.PeerClient;
import org.distributed.agentmesh.peer.PeerSelectionPolicy;
import org.distributed.agentmesh.peer.PeerTable;
import org.distributed.agentmesh.peer.RecentlySeenSelectionPolicy;
import org.distributed.agentmesh.peer.RestPeerClient;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.http.converter.StringHttpMessageConverter;
import org.springframework.http.converter.json.MappingJackson2HttpMessageConverter;
import org.springframework.web.client.RestTemplate;

import com.fasterxml.jackson.databind.ObjectMapper;

import lombok.extern.slf4j.Slf4j;

/**
 * Wires the discovery, peer and gossip components. Each outbound client gets
 * its own RestTemplate so that its timeout matches the call it makes.
 */
@Slf4j
@Configuration
public class MeshConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public RegistryLink registryLink(AgentProperties agentProperties, DiscoveryProperties discoveryProperties,
                                     RegistrationProperties registrationProperties, ObjectMapper objectMapper) {
        RestTemplate restTemplate = restTemplate(objectMapper,
                discoveryProperties.getRegistryConnectTimeout(), discoveryProperties.getRegistryTimeout());
        RestTemplate heartbeatTemplate = restTemplate(objectMapper,
                discoveryProperties.getRegistryConnectTimeout(), registrationProperties.getHeartbeatTimeout());
        log.info("[Registry] Using registry at {}", agentProperties.getRegistryUrl());
        return new RestRegistryLink(restTemplate, heartbeatTemplate, agentProperties.getRegistryUrl());
    }

    @Bean
    public DnsQuery dnsQuery(AgentProperties agentProperties, DiscoveryProperties discoveryProperties) {
        return new JndiDnsQuery(agentProperties.getDnsServer(), agentProperties.getDnsPort(),
                (int) discoveryProperties.getRegistryConnectTimeout().toMillis());
    }

    @Bean
    public DnsLink dnsLink(DnsQuery dnsQuery) {
        return new DnsLink(dnsQuery);
    }

    @Bean
    public DiscoveryCache discoveryCache(RegistryLink registryLink, DnsLink dnsLink, Clock clock,
                                         DiscoveryProperties discoveryProperties) {
        return new DiscoveryCache(registryLink, dnsLink, clock,
                discoveryProperties.getCacheTtl(), discoveryProperties.getMethods());
    }

    @Bean
    public PeerSelectionPolicy peerSelectionPolicy(GossipProperties gossipProperties) {
        return new RecentlySeenSelectionPolicy(gossipProperties.getUsableWindow());
    }

    @Bean
    public PeerClient peerClient(AgentProperties agentProperties, GossipProperties gossipProperties,
                                 ObjectMapper objectMapper) {
        RestTemplate exchangeTemplate = restTemplate(objectMapper,
                gossipProperties.getConnectTimeout(), gossipProperties.getExchangeTimeout());
        RestTemplate healthTemplate = restTemplate(objectMapper,
                gossipProperties.getConnectTimeout(), gossipProperties.getHealthTimeout());
        return new RestPeerClient(exchangeTemplate, healthTemplate, agentProperties.getId());
    }

    @Bean
    public PeerTable peerTable(AgentProperties agentProperties, Clock clock,
                               PeerSelectionPolicy peerSelectionPolicy, PeerClient peerClient) {
        return new PeerTable(agentProperties.getId(), clock, peerSelectionPolicy, peerClient);
    }

    @Bean(destroyMethod = "shutdown")
    public GossipEngine gossipEngine(AgentProperties agentProperties, PeerTable peerTable,
                                     DiscoveryCache discoveryCache, PeerClient peerClient,
                                     GossipProperties gossipProperties, Clock clock) {
        return new GossipEngine(agentProperties.getId(), peerTable, discoveryCache, peerClient,
                gossipProperties, clock, new Random());
    }

    @Bean
    public RegistrationService registrationService(RegistryLink registryLink, AgentProperties agentProperties,
                                                   RegistrationProperties registrationProperties, Clock clock) {
        return new RegistrationService(registryLink, agentProperties, registrationProperties, clock);
    }

    private static RestTemplate restTemplate(ObjectMapper objectMapper, Duration connectTimeout, Duration readTimeout) {
        SimpleClientHttpRequestFactory factory = new SimpleClientHttpRequestFactory();
        factory.setConnectTimeout((int) connectTimeout.toMillis());
        factory.setReadTimeout((int) readTimeout.toMillis());

        return new RestTemplateBuilder()
                .requestFactory(() -> factory)
                .messageConverters(List.of(
                        new StringHttpMessageConverter(),
                        new MappingJackson2HttpMessageConverter(objectMapper)))
                .build();
    }
}
