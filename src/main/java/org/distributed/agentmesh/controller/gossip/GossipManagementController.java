package org.distributed.agentmesh.controller.gossip;

import java.util.List;

import org.distributed.agentmesh.common.response.MeshResponseCode;
import org.distributed.agentmesh.common.response.MeshResponseDto;
import org.distributed.agentmesh.gossip.GossipEngine;
import org.distributed.agentmesh.gossip.GossipRoundResult;
import org.distributed.agentmesh.gossip.GossipStats;
import org.distributed.agentmesh.model.PeerEntry;
import org.distributed.agentmesh.peer.PeerTable;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import jakarta.annotation.Resource;
import lombok.extern.slf4j.Slf4j;

@Slf4j
@RestController
@RequestMapping("/gossip")
public class GossipManagementController {

    @Resource
    private GossipEngine gossipEngine;

    @Resource
    private PeerTable peerTable;

    @GetMapping("/stats")
    public ResponseEntity<GossipStats> stats() {
        return ResponseEntity.ok(gossipEngine.stats());
    }

    /**
     * Current peer table with health and last-seen time
     */
    @GetMapping("/peers")
    public ResponseEntity<MeshResponseDto<List<PeerEntry>>> peers() {
        return ResponseEntity.ok(MeshResponseDto.success(peerTable.all()));
    }

    @PostMapping("/start")
    public ResponseEntity<MeshResponseDto<String>> start() {
        if (!gossipEngine.start()) {
            return ResponseEntity.ok(MeshResponseDto.error(MeshResponseCode.GOSSIP_ALREADY_RUNNING));
        }
        log.info("[GossipManagement] Gossip started via API");
        return ResponseEntity.ok(MeshResponseDto.success("Gossip protocol started"));
    }

    @PostMapping("/stop")
    public ResponseEntity<MeshResponseDto<String>> stop() {
        if (!gossipEngine.stop()) {
            return ResponseEntity.ok(MeshResponseDto.error(MeshResponseCode.GOSSIP_NOT_RUNNING));
        }
        log.info("[GossipManagement] Gossip stopped via API");
        return ResponseEntity.ok(MeshResponseDto.success("Gossip protocol stopped"));
    }

    /**
     * Run one round now, outside the loop's schedule
     */
    @PostMapping("/round")
    public ResponseEntity<MeshResponseDto<GossipRoundResult>> round() {
        try {
            return ResponseEntity.ok(MeshResponseDto.success(gossipEngine.runRound()));
        } catch (Exception e) {
            log.error("[GossipManagement] Error running gossip round: {}", e.getMessage());
            return ResponseEntity.ok(MeshResponseDto.error(MeshResponseCode.UNKNOWN_ERROR.getCode(),
                    "Failed to run gossip round: " + e.getMessage()));
        }
    }
}
