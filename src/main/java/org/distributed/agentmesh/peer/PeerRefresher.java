package org.distributed.agentmesh.peer;

import org.distributed.agentmesh.config.AgentProperties;
import org.distributed.agentmesh.discovery.DiscoveryCache;
import org.distributed.agentmesh.model.AgentRecord;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import jakarta.annotation.Resource;
import lombok.extern.slf4j.Slf4j;

/**
 * Periodically seeds the peer table from the directory: the full listing first,
 * then agents sharing one of this node's capabilities. Both go through the
 * discovery cache, so every record carries its provenance.
 */
@Slf4j
@Component
public class PeerRefresher {

    @Resource
    private DiscoveryCache discoveryCache;

    @Resource
    private PeerTable peerTable;

    @Resource
    private AgentProperties agentProperties;

    @Scheduled(
            initialDelayString = "#{@discoveryProperties.refreshInterval.toMillis()}",
            fixedDelayString = "#{@discoveryProperties.refreshInterval.toMillis()}"
    )
    public void scheduledRefresh() {
        refresh();
    }

    /**
     * @return number of peers inserted or updated
     */
    public int refresh() {
        log.info("[Refresh] Refreshing peers from registry");
        int upserted = 0;
        for (AgentRecord agent : discoveryCache.resolveAll()) {
            if (peerTable.upsert(agent.getId(), agent)) {
                upserted++;
            }
        }

        for (String capability : agentProperties.getCapabilities()) {
            for (AgentRecord agent : discoveryCache.resolveByCapability(capability)) {
                if (peerTable.upsert(agent.getId(), agent)) {
                    upserted++;
                }
            }
        }
        log.info("[Refresh] Peer table now holds {} peers", peerTable.size());
        return upserted;
    }
}
