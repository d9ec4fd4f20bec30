package org.distributed.agentmesh.peer;

import java.util.Map;

import org.distributed.agentmesh.model.AgentRecord;
import org.distributed.agentmesh.model.PeerAddress;
import org.springframework.web.util.UriComponents;
import org.springframework.web.util.UriComponentsBuilder;

import lombok.extern.slf4j.Slf4j;

/**
 * Derives where a peer can be reached. Order matters, peer exchange relies on it:
 * 1. explicit port (skipped with a warning when not a valid port) and explicit host
 * 2. host, and port when still missing, from the registered rest interface URL
 * 3. host from the id's leading label: agent1.agents.local => agent1
 * 4. port 8000
 */
@Slf4j
public final class PeerAddressResolver {

    private PeerAddressResolver() {
    }

    public static PeerAddress resolve(String peerId, AgentRecord record) {
        String host = blankToNull(record.getHost());
        Integer port = parsePort(peerId, record.getPort());

        if (host == null) {
            Map<String, String> interfaces = record.getInterfaces();
            String restUrl = interfaces == null ? null : interfaces.get(AgentRecord.REST_INTERFACE);
            if (restUrl != null) {
                try {
                    UriComponents uri = UriComponentsBuilder.fromUriString(restUrl).build();
                    host = blankToNull(uri.getHost());
                    if (port == null && uri.getPort() > 0) {
                        port = uri.getPort();
                        log.debug("[PeerTable] Extracted port {} from REST interface for {}", port, peerId);
                    }
                } catch (IllegalArgumentException e) {
                    log.error("[PeerTable] Error parsing REST interface for {}: {}", peerId, e.getMessage());
                }
            }
        }

        if (host == null && peerId.contains(".")) {
            host = peerId.substring(0, peerId.indexOf('.'));
            log.debug("[PeerTable] Using service name {} from peer id {}", host, peerId);
        }

        if (port == null) {
            port = PeerAddress.DEFAULT_PORT;
            log.debug("[PeerTable] Using default port {} for {}", port, peerId);
        }

        return new PeerAddress(host, port);
    }

    private static Integer parsePort(String peerId, String rawPort) {
        if (rawPort == null || rawPort.isBlank()) {
            return null;
        }
        try {
            int port = Integer.parseInt(rawPort.trim());
            if (port > 0 && port <= 65535) {
                return port;
            }
        } catch (NumberFormatException e) {
            // falls through to the warning below
        }
        log.warn("[PeerTable] Invalid port in peer info for {}: {}", peerId, rawPort);
        return null;
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value;
    }
}
