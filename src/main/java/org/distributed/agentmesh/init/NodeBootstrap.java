package org.distributed.agentmesh.init;

import org.distributed.agentmesh.config.AgentProperties;
import org.distributed.agentmesh.config.GossipProperties;
import org.distributed.agentmesh.gossip.GossipEngine;
import org.distributed.agentmesh.heartbeat.RegistrationService;
import org.distributed.agentmesh.peer.PeerRefresher;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import jakarta.annotation.PreDestroy;
import jakarta.annotation.Resource;
import lombok.extern.slf4j.Slf4j;

/**
 * Joins the mesh once the web server is up and leaves it on shutdown.
 */
@Slf4j
@Component
@ConditionalOnProperty(name = "mesh.bootstrap.enabled", havingValue = "true", matchIfMissing = true)
public class NodeBootstrap implements ApplicationRunner {

    @Resource
    private RegistrationService registrationService;

    @Resource
    private PeerRefresher peerRefresher;

    @Resource
    private GossipEngine gossipEngine;

    @Resource
    private AgentProperties agentProperties;

    @Resource
    private GossipProperties gossipProperties;

    /**
     * Steps:
     * 1. Register with the directory (the registration loop retries on failure)
     * 2. Seed the peer table from the directory
     * 3. Start gossip when enabled
     * */
    @Override
    public void run(ApplicationArguments args) {
        log.info("[Bootstrap] Starting agent {}", agentProperties.getId());
        if (!registrationService.register()) {
            log.warn("[Bootstrap] Initial registration failed, the registration loop will retry");
        }

        int seeded = peerRefresher.refresh();
        log.info("[Bootstrap] Seeded {} peers from registry", seeded);

        if (gossipProperties.isEnabled()) {
            gossipEngine.start();
        } else {
            log.info("[Bootstrap] Gossip disabled by configuration");
        }
    }

    @PreDestroy
    public void leave() {
        log.info("[Bootstrap] Shutting down agent {}", agentProperties.getId());
        gossipEngine.stop();
        registrationService.unregister();
    }
}
