package org.distributed.agentmesh.model;

import java.net.URI;

import org.springframework.web.util.UriComponentsBuilder;

import lombok.Value;

/**
 * Normalized network location of a peer. Host is null when it could not be
 * derived from the record or the id.
 */
@Value
public class PeerAddress {

    public static final int DEFAULT_PORT = 8000;

    String host;
    int port;

    public boolean isResolvable() {
        return host != null && !host.isBlank();
    }

    // http://agent1:8000 + /peers => http://agent1:8000/peers, path characters are percent-encoded
    public URI uri(String path) {
        String normalized = path.startsWith("/") ? path : "/" + path;
        return UriComponentsBuilder.newInstance()
                .scheme("http")
                .host(host)
                .port(port)
                .path(normalized)
                .encode()
                .build()
                .toUri();
    }

    @Override
    public String toString() {
        return host + ":" + port;
    }
}
