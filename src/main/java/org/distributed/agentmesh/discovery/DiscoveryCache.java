package org.distributed.agentmesh.discovery;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

import org.distributed.agentmesh.model.AgentQuery;
import org.distributed.agentmesh.model.AgentRecord;
import org.distributed.agentmesh.model.Provenance;
import org.distributed.agentmesh.model.SearchCriteria;

import lombok.extern.slf4j.Slf4j;

/**
 * One lookup API over the directory and the name service, with a
 * time-bounded cache in front of both.
 * None of the lookups throw: a failing collaborator degrades to "no result".
 */
@Slf4j
public class DiscoveryCache {

    private final RegistryLink registryLink;
    private final DnsLink dnsLink;
    private final Clock clock;
    private final Duration cacheTtl;
    private final List<DiscoveryMethod> methods;

    // agent id -> record stamped with provenance and cache time
    private final ConcurrentHashMap<String, AgentRecord> cache = new ConcurrentHashMap<>();

    public DiscoveryCache(RegistryLink registryLink, DnsLink dnsLink, Clock clock,
                          Duration cacheTtl, List<DiscoveryMethod> methods) {
        this.registryLink = registryLink;
        this.dnsLink = dnsLink;
        this.clock = clock;
        this.cacheTtl = cacheTtl;
        this.methods = List.copyOf(methods);
    }

    /**
     * Resolve one agent, serving from the cache while the entry is fresh.
     * @param agentId the agent id (domain-like name)
     * @return the record, empty when no discovery method knows the id
     */
    public Optional<AgentRecord> resolve(String agentId) {
        AgentRecord cached = cache.get(agentId);
        if (cached != null && isFresh(cached)) {
            log.debug("[Discovery] Using cached agent info for {}", agentId);
            return Optional.of(cached);
        }
        return lookup(agentId);
    }

    /**
     * The full directory listing, written through the cache.
     */
    public List<AgentRecord> resolveAll() {
        log.info("[Discovery] Listing all agents in registry");
        try {
            List<AgentRecord> found = cacheAll(registryLink.listAgents(AgentQuery.all()));
            log.info("[Discovery] Registry listing returned {} agents", found.size());
            return found;
        } catch (Exception e) {
            log.warn("[Discovery] Failed to list agents via registry: {}", e.getMessage());
            return new ArrayList<>();
        }
    }

    /**
     * Agents advertising one capability. Directory only, the name service
     * cannot enumerate. Every result is written through the cache.
     */
    public List<AgentRecord> resolveByCapability(String capability) {
        log.info("[Discovery] Discovering agents with capability: {}", capability);
        try {
            List<AgentRecord> found = cacheAll(registryLink.listAgents(AgentQuery.byCapability(capability)));
            log.info("[Discovery] Found {} agents with capability {} in registry", found.size(), capability);
            return found;
        } catch (Exception e) {
            log.warn("[Discovery] Failed to discover agents by capability {} via registry: {}", capability, e.getMessage());
            return new ArrayList<>();
        }
    }

    /**
     * Directory search over several criteria. The directory filters on the first
     * capability; the remaining ones are enforced here so the match stays AND.
     */
    public List<AgentRecord> resolveByCriteria(SearchCriteria criteria) {
        log.info("[Discovery] Discovering agents with criteria: {}", criteria);
        try {
            List<AgentRecord> matching = new ArrayList<>();
            for (AgentRecord record : registryLink.listAgents(criteria.toAgentQuery())) {
                if (criteria.matches(record)) {
                    matching.add(record);
                }
            }
            List<AgentRecord> found = cacheAll(matching);
            log.info("[Discovery] Found {} agents matching criteria", found.size());
            return found;
        } catch (Exception e) {
            log.warn("[Discovery] Failed to discover agents by criteria: {}", e.getMessage());
            return new ArrayList<>();
        }
    }

    public void invalidate(String agentId) {
        if (cache.remove(agentId) != null) {
            log.debug("[Discovery] Invalidated cached agent {}", agentId);
        }
    }

    public void clear() {
        log.info("[Discovery] Clearing agent cache");
        cache.clear();
    }

    /**
     * Re-resolve every cached id, ignoring freshness.
     */
    public void refresh() {
        log.info("[Discovery] Refreshing agent cache");
        for (String agentId : new ArrayList<>(cache.keySet())) {
            lookup(agentId);
        }
        log.info("[Discovery] Cache refresh complete, {} agents in cache", cache.size());
    }

    public int size() {
        return cache.size();
    }

    private Optional<AgentRecord> lookup(String agentId) {
        log.info("[Discovery] Discovering agent {}", agentId);
        for (DiscoveryMethod method : methods) {
            Optional<AgentRecord> found = method == DiscoveryMethod.REGISTRY ? fromRegistry(agentId) : fromDns(agentId);
            if (found.isPresent()) {
                Provenance provenance = method == DiscoveryMethod.REGISTRY ? Provenance.REGISTRY : Provenance.DNS;
                AgentRecord stamped = found.get().cachedAs(provenance, clock.instant());
                cache.put(agentId, stamped);
                log.info("[Discovery] Found agent {} via {}", agentId, provenance.getTag());
                return Optional.of(stamped);
            }
        }
        log.error("[Discovery] Agent {} not found via any discovery method", agentId);
        return Optional.empty();
    }

    private Optional<AgentRecord> fromRegistry(String agentId) {
        try {
            return registryLink.getAgent(agentId);
        } catch (Exception e) {
            log.warn("[Discovery] Failed to discover agent {} via registry: {}", agentId, e.getMessage());
            return Optional.empty();
        }
    }

    private Optional<AgentRecord> fromDns(String agentId) {
        try {
            return dnsLink.resolve(agentId);
        } catch (Exception e) {
            log.warn("[Discovery] Failed to discover agent {} via DNS: {}", agentId, e.getMessage());
            return Optional.empty();
        }
    }

    private List<AgentRecord> cacheAll(List<AgentRecord> records) {
        Instant now = clock.instant();
        List<AgentRecord> stamped = new ArrayList<>(records.size());
        for (AgentRecord record : records) {
            if (record.getId() == null) {
                continue;
            }
            AgentRecord cached = record.cachedAs(Provenance.REGISTRY, now);
            cache.put(record.getId(), cached);
            stamped.add(cached);
        }
        return stamped;
    }

    private boolean isFresh(AgentRecord record) {
        return record.getCacheTime() != null
                && Duration.between(record.getCacheTime(), clock.instant()).compareTo(cacheTtl) < 0;
    }
}
