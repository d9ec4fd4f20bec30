package org.distributed.agentmesh.discovery;

/**
 * Outcome of a directory heartbeat.
 */
public enum HeartbeatStatus {
    OK,
    // The directory no longer knows this agent, it has to register again
    NOT_FOUND,
    ERROR
}
