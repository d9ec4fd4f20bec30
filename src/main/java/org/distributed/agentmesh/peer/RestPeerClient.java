package org.distributed.agentmesh.peer;

import java.net.URI;
import java.util.ArrayList;
import java.util.List;

import org.distributed.agentmesh.model.PeerAddress;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.client.RestTemplate;

import lombok.extern.slf4j.Slf4j;

/**
 * RestTemplate implementation of {@link PeerClient}. Exchanges and health
 * checks use separate templates because their timeouts differ.
 */
@Slf4j
public class RestPeerClient implements PeerClient {

    public static final String GOSSIP_FROM_HEADER = "X-Gossip-From";

    private final RestTemplate exchangeTemplate;
    private final RestTemplate healthTemplate;
    private final String selfId;

    public RestPeerClient(RestTemplate exchangeTemplate, RestTemplate healthTemplate, String selfId) {
        this.exchangeTemplate = exchangeTemplate;
        this.healthTemplate = healthTemplate;
        this.selfId = selfId;
    }

    @Override
    public List<String> fetchPeers(PeerAddress address, String path) {
        URI url = address.uri(path);
        log.debug("[Gossip] Getting peers from {}", url);
        HttpHeaders headers = new HttpHeaders();
        headers.set(GOSSIP_FROM_HEADER, selfId);
        ResponseEntity<PeerListMessage> response = exchangeTemplate.exchange(
                url,
                HttpMethod.GET,
                new HttpEntity<>(headers),
                PeerListMessage.class
        );
        PeerListMessage body = response.getBody();
        return body == null || body.getPeers() == null ? new ArrayList<>() : body.getPeers();
    }

    @Override
    public PeerExchangeResponse sendPeers(PeerAddress address, String path, List<String> peerIds) {
        URI url = address.uri(path);
        log.debug("[Gossip] Sending {} peers to {}", peerIds.size(), url);
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        headers.set(GOSSIP_FROM_HEADER, selfId);
        ResponseEntity<PeerExchangeResponse> response = exchangeTemplate.exchange(
                url,
                HttpMethod.POST,
                new HttpEntity<>(new PeerListMessage(peerIds), headers),
                PeerExchangeResponse.class
        );
        return response.getBody() != null ? response.getBody() : new PeerExchangeResponse();
    }

    @Override
    public boolean ping(PeerAddress address, String path) {
        ResponseEntity<String> response = healthTemplate.getForEntity(address.uri(path), String.class);
        return response.getStatusCode().is2xxSuccessful();
    }
}
