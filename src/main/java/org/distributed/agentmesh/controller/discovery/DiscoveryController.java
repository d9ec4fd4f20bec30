package org.distributed.agentmesh.controller.discovery;

import java.util.List;
import java.util.Map;

import org.distributed.agentmesh.discovery.AgentListResponse;
import org.distributed.agentmesh.discovery.DiscoveryCache;
import org.distributed.agentmesh.model.AgentRecord;
import org.distributed.agentmesh.model.SearchCriteria;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import jakarta.annotation.Resource;
import lombok.extern.slf4j.Slf4j;

/**
 * Lookups through the discovery cache, for operators and collaborating agents.
 */
@Slf4j
@RestController
public class DiscoveryController {

    @Resource
    private DiscoveryCache discoveryCache;

    @GetMapping("/discover")
    public ResponseEntity<?> discover(@RequestParam(value = "capability", required = false) String capability) {
        if (capability == null || capability.isBlank()) {
            return ResponseEntity.badRequest().body(Map.of("error", "Missing capability parameter"));
        }
        List<AgentRecord> agents = discoveryCache.resolveByCapability(capability);
        return ResponseEntity.ok(new AgentListResponse(agents));
    }

    @PostMapping("/search")
    public ResponseEntity<?> search(@RequestBody(required = false) SearchCriteria criteria) {
        if (criteria == null || criteria.isEmpty()) {
            return ResponseEntity.badRequest().body(Map.of("error", "Invalid request"));
        }
        List<AgentRecord> agents = discoveryCache.resolveByCriteria(criteria);
        return ResponseEntity.ok(new AgentListResponse(agents));
    }

    @GetMapping("/resolve/{agentId}")
    public ResponseEntity<?> resolve(@PathVariable("agentId") String agentId) {
        return discoveryCache.resolve(agentId)
                .<ResponseEntity<?>>map(ResponseEntity::ok)
                .orElseGet(() -> {
                    log.info("[DiscoveryController] Agent {} not found", agentId);
                    return ResponseEntity.status(HttpStatus.NOT_FOUND).body(Map.of("error", "Agent not found"));
                });
    }
}
