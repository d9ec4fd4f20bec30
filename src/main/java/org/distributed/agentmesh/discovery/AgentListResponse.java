package org.distributed.agentmesh.discovery;

import java.util.ArrayList;
import java.util.List;

import org.distributed.agentmesh.model.AgentRecord;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * {"agents": [...]} as returned by the directory listing and the /discover and /search routes.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class AgentListResponse {
    private List<AgentRecord> agents = new ArrayList<>();
}
