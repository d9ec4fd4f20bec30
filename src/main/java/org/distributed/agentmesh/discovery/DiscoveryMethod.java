package org.distributed.agentmesh.discovery;

public enum DiscoveryMethod {
    REGISTRY,
    DNS
}
