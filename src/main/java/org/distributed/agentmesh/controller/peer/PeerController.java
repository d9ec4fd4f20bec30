package org.distributed.agentmesh.controller.peer;

import java.time.Clock;
import java.util.List;
import java.util.Map;

import org.distributed.agentmesh.config.AgentProperties;
import org.distributed.agentmesh.gossip.GossipEngine;
import org.distributed.agentmesh.model.AgentRecord;
import org.distributed.agentmesh.peer.PeerExchangeResponse;
import org.distributed.agentmesh.peer.PeerListMessage;
import org.distributed.agentmesh.peer.PeerTable;
import org.distributed.agentmesh.peer.RestPeerClient;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RestController;

import jakarta.annotation.Resource;
import lombok.extern.slf4j.Slf4j;

/**
 * Peer-to-peer contract every node exposes: peer exchange, liveness and self description.
 */
@Slf4j
@RestController
public class PeerController {

    @Resource
    private PeerTable peerTable;

    @Resource
    private GossipEngine gossipEngine;

    @Resource
    private AgentProperties agentProperties;

    @Resource
    private Clock clock;

    @GetMapping("/peers")
    public ResponseEntity<PeerListMessage> getPeers() {
        List<String> ids = peerTable.ids();
        log.debug("[PeerController] Returning {} peers", ids.size());
        return ResponseEntity.ok(new PeerListMessage(ids));
    }

    /**
     * Accept peer ids pushed by another node during its gossip round.
     * @param message {"peers": [...]}
     * @param sourceId optional sender id
     */
    @PostMapping("/peers")
    public ResponseEntity<?> receivePeers(@RequestBody(required = false) PeerListMessage message,
                                          @RequestHeader(value = RestPeerClient.GOSSIP_FROM_HEADER, required = false) String sourceId) {
        if (message == null || message.getPeers() == null) {
            log.warn("[PeerController] Rejected peer list without peers field");
            return ResponseEntity.badRequest().body(Map.of("error", "Invalid request"));
        }
        try {
            List<String> added = gossipEngine.receivePeers(message.getPeers(), sourceId);
            return ResponseEntity.ok(PeerExchangeResponse.builder()
                    .status("success")
                    .addedPeers(added)
                    .totalPeers(peerTable.size())
                    .build());
        } catch (Exception e) {
            log.error("[PeerController] Error handling peer list: {}", e.getMessage());
            return ResponseEntity.internalServerError().body(Map.of("error", String.valueOf(e.getMessage())));
        }
    }

    @GetMapping("/health")
    public ResponseEntity<Map<String, String>> health() {
        return ResponseEntity.ok(Map.of("status", "ok", "agent_id", agentProperties.getId()));
    }

    @GetMapping("/metadata")
    public ResponseEntity<AgentRecord> metadata() {
        return ResponseEntity.ok(agentProperties.toRecord(clock.instant()));
    }
}
