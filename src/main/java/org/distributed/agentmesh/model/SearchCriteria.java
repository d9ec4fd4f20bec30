package org.distributed.agentmesh.model;

import java.util.ArrayList;
import java.util.List;

import com.fasterxml.jackson.annotation.JsonIgnore;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Search criteria accepted by {@code POST /search}.
 * Capabilities are AND-matched, the free-text query is OR-matched over
 * name and description.
 */
@Data
@Builder
@AllArgsConstructor
@NoArgsConstructor
public class SearchCriteria {

    @Builder.Default
    private List<String> capabilities = new ArrayList<>();

    private String query;
    private String protocol;
    private String provider;
    private Integer limit;
    private Integer offset;

    @JsonIgnore
    public boolean isEmpty() {
        return (capabilities == null || capabilities.isEmpty())
                && query == null && protocol == null && provider == null
                && limit == null && offset == null;
    }

    public AgentQuery toAgentQuery() {
        return AgentQuery.builder()
                .capability(capabilities == null || capabilities.isEmpty() ? null : capabilities.get(0))
                .query(query)
                .protocol(protocol)
                .provider(provider)
                .limit(limit)
                .offset(offset)
                .build();
    }

    public boolean matches(AgentRecord record) {
        if (capabilities != null) {
            for (String capability : capabilities) {
                if (!record.hasCapability(capability)) {
                    return false;
                }
            }
        }
        if (query != null && !query.isBlank()) {
            String needle = query.toLowerCase();
            String name = record.getName() == null ? "" : record.getName().toLowerCase();
            String description = record.getDescription() == null ? "" : record.getDescription().toLowerCase();
            if (!name.contains(needle) && !description.contains(needle)) {
                return false;
            }
        }
        if (protocol != null && (record.getProtocols() == null || !record.getProtocols().contains(protocol))) {
            return false;
        }
        return provider == null || provider.equals(record.getProvider());
    }
}
