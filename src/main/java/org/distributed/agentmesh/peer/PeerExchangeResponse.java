package org.distributed.agentmesh.peer;

import java.util.ArrayList;
import java.util.List;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * {"status":"success","added_peers":[...],"total_peers":7}: answer to POST /peers.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class PeerExchangeResponse {
    private String status;

    @Builder.Default
    private List<String> addedPeers = new ArrayList<>();

    private int totalPeers;
}
