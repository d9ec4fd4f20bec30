package org.distributed.agentmesh.discovery;

import java.net.URI;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import org.distributed.agentmesh.common.exception.RegistryException;
import org.distributed.agentmesh.model.AgentQuery;
import org.distributed.agentmesh.model.AgentRecord;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.client.HttpStatusCodeException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;
import org.springframework.web.util.UriComponentsBuilder;

import lombok.extern.slf4j.Slf4j;

/**
 * HTTP client for the central directory.
 * Heartbeats go through their own template so they keep the shorter timeout.
 */
@Slf4j
public class RestRegistryLink implements RegistryLink {

    private static final ParameterizedTypeReference<Map<String, Object>> JSON_OBJECT =
            new ParameterizedTypeReference<>() {};

    private final RestTemplate restTemplate;
    private final RestTemplate heartbeatTemplate;
    private final String baseUrl;

    public RestRegistryLink(RestTemplate restTemplate, RestTemplate heartbeatTemplate, String baseUrl) {
        this.restTemplate = restTemplate;
        this.heartbeatTemplate = heartbeatTemplate;
        this.baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        log.info("[Registry] Initialized registry client with base URL: {}", this.baseUrl);
    }

    @Override
    public Map<String, Object> register(AgentRecord record) {
        log.info("[Registry] Registering agent {} with registry", record.getId());
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        try {
            ResponseEntity<Map<String, Object>> response = restTemplate.exchange(
                    URI.create(baseUrl + "/registerAgent"),
                    HttpMethod.POST,
                    new HttpEntity<>(record, headers),
                    JSON_OBJECT
            );
            log.info("[Registry] Successfully registered agent {} with registry", record.getId());
            return response.getBody() != null ? response.getBody() : Collections.emptyMap();
        } catch (RestClientException e) {
            throw failure("register agent " + record.getId(), e);
        }
    }

    @Override
    public List<AgentRecord> listAgents(AgentQuery query) {
        URI uri = agentsUri(query);
        log.debug("[Registry] Fetching agents from {}", uri);
        try {
            AgentListResponse response = restTemplate.getForObject(uri, AgentListResponse.class);
            if (response == null || response.getAgents() == null) {
                return new ArrayList<>();
            }
            return response.getAgents();
        } catch (RestClientException e) {
            throw failure("fetch agents", e);
        }
    }

    @Override
    public Optional<AgentRecord> getAgent(String agentId) {
        log.debug("[Registry] Fetching agent {} from registry", agentId);
        URI uri = UriComponentsBuilder.fromUriString(baseUrl)
                .path("/agents/{id}")
                .buildAndExpand(agentId)
                .encode()
                .toUri();
        try {
            AgentRecord record = restTemplate.getForObject(uri, AgentRecord.class);
            if (record == null || record.getId() == null) {
                return Optional.empty();
            }
            return Optional.of(record);
        } catch (HttpStatusCodeException e) {
            if (e.getStatusCode().value() == HttpStatus.NOT_FOUND.value()) {
                log.debug("[Registry] Agent {} not found in registry", agentId);
                return Optional.empty();
            }
            throw failure("fetch agent " + agentId, e);
        } catch (RestClientException e) {
            throw failure("fetch agent " + agentId, e);
        }
    }

    @Override
    public HeartbeatStatus heartbeat(String agentId) {
        log.debug("[Registry] Sending heartbeat for agent {}", agentId);
        URI uri = UriComponentsBuilder.fromUriString(baseUrl)
                .path("/agents/{id}/heartbeat")
                .buildAndExpand(agentId)
                .encode()
                .toUri();
        try {
            heartbeatTemplate.exchange(uri, HttpMethod.PUT, HttpEntity.EMPTY, String.class);
            return HeartbeatStatus.OK;
        } catch (HttpStatusCodeException e) {
            if (e.getStatusCode().value() == HttpStatus.NOT_FOUND.value()) {
                log.warn("[Registry] Agent {} not found in registry, it has to register again", agentId);
                return HeartbeatStatus.NOT_FOUND;
            }
            log.error("[Registry] Heartbeat for agent {} failed with status {}", agentId, e.getStatusCode());
            return HeartbeatStatus.ERROR;
        } catch (RestClientException e) {
            log.error("[Registry] Error sending heartbeat for agent {}: {}", agentId, e.getMessage());
            return HeartbeatStatus.ERROR;
        }
    }

    @Override
    public void unregister(String agentId) {
        log.info("[Registry] Unregistering agent {} from registry", agentId);
        URI uri = UriComponentsBuilder.fromUriString(baseUrl)
                .path("/agents/{id}")
                .buildAndExpand(agentId)
                .encode()
                .toUri();
        try {
            restTemplate.exchange(uri, HttpMethod.DELETE, HttpEntity.EMPTY, String.class);
        } catch (RestClientException e) {
            throw failure("unregister agent " + agentId, e);
        }
    }

    URI agentsUri(AgentQuery query) {
        UriComponentsBuilder builder = UriComponentsBuilder.fromUriString(baseUrl).path("/agents");
        if (query.getCapability() != null) {
            builder.queryParam("capability", query.getCapability());
        }
        if (query.getQuery() != null) {
            builder.queryParam("query", query.getQuery());
        }
        if (query.getProtocol() != null) {
            builder.queryParam("protocol", query.getProtocol());
        }
        if (query.getProvider() != null) {
            builder.queryParam("provider", query.getProvider());
        }
        if (query.getLimit() != null) {
            builder.queryParam("limit", query.getLimit());
        }
        if (query.getOffset() != null) {
            builder.queryParam("offset", query.getOffset());
        }
        return builder.encode().build().toUri();
    }

    private RegistryException failure(String action, RestClientException e) {
        if (e instanceof HttpStatusCodeException) {
            HttpStatusCodeException statusException = (HttpStatusCodeException) e;
            log.error("[Registry] Failed to {}: status {}, body {}", action,
                    statusException.getStatusCode(), statusException.getResponseBodyAsString());
            return new RegistryException("Failed to " + action + ": " + e.getMessage(),
                    statusException.getStatusCode().value(), e);
        }
        log.error("[Registry] Failed to {}: {}", action, e.getMessage());
        return new RegistryException("Failed to " + action + ": " + e.getMessage(), e);
    }
}
