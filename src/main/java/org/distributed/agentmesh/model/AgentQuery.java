package org.distributed.agentmesh.model;

import lombok.Builder;
import lombok.Value;

/**
 * Query parameters of the directory's agent listing. Null fields are not sent.
 */
@Value
@Builder
public class AgentQuery {
    String capability;
    String query;
    String protocol;
    String provider;
    Integer limit;
    Integer offset;

    public static AgentQuery all() {
        return AgentQuery.builder().build();
    }

    public static AgentQuery byCapability(String capability) {
        return AgentQuery.builder().capability(capability).build();
    }
}
