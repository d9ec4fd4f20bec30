package org.distributed.agentmesh.peer;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * {"peers": ["agent2.agents.local", ...]}: body of GET /peers responses and POST /peers requests.
 * Peers stays null when the key is missing so the endpoint can reject the request.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class PeerListMessage {
    private List<String> peers;
}
