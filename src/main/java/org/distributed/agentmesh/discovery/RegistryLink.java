package org.distributed.agentmesh.discovery;

import java.util.List;
import java.util.Map;
import java.util.Optional;

import org.distributed.agentmesh.common.exception.RegistryException;
import org.distributed.agentmesh.model.AgentQuery;
import org.distributed.agentmesh.model.AgentRecord;

/**
 * Request/response contract of the central agent directory.
 */
public interface RegistryLink {

    /**
     * POST /registerAgent
     * @param record full record of the registering agent
     * @return the directory's answer (stored record and status)
     * @throws RegistryException when the directory cannot be reached or rejects the record
     */
    Map<String, Object> register(AgentRecord record);

    /**
     * GET /agents with the non-null query fields as parameters.
     * @throws RegistryException when the directory cannot be reached
     */
    List<AgentRecord> listAgents(AgentQuery query);

    /**
     * GET /agents/{id}
     * @return empty when the directory answers 404
     * @throws RegistryException on any other failure
     */
    Optional<AgentRecord> getAgent(String agentId);

    /**
     * PUT /agents/{id}/heartbeat. Never throws.
     */
    HeartbeatStatus heartbeat(String agentId);

    /**
     * DELETE /agents/{id}
     * @throws RegistryException when the directory cannot be reached
     */
    void unregister(String agentId);
}
