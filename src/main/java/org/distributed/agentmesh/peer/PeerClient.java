package org.distributed.agentmesh.peer;

import java.util.List;

import org.distributed.agentmesh.model.PeerAddress;

/**
 * Client side of the peer-to-peer contract every node exposes.
 * Implementations signal transport failures and non-2xx answers with
 * {@link org.springframework.web.client.RestClientException}.
 */
public interface PeerClient {

    /**
     * GET {path} on the peer, usually /peers.
     */
    List<String> fetchPeers(PeerAddress address, String path);

    /**
     * POST {"peers": [...]} to {path} on the peer.
     */
    PeerExchangeResponse sendPeers(PeerAddress address, String path, List<String> peerIds);

    /**
     * GET {path} on the peer, usually /health.
     * @return true on a 2xx answer
     */
    boolean ping(PeerAddress address, String path);
}
