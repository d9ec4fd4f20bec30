package org.distributed.agentmesh.gossip;

import java.time.Instant;

import lombok.Builder;
import lombok.Value;

/**
 * Point-in-time copy of the gossip counters. Counters only grow for the life of the process.
 */
@Value
@Builder
public class GossipStats {
    boolean running;
    int knownPeers;
    long roundsInitiated;
    long roundsCompleted;
    long messagesSent;
    long messagesReceived;
    long peersSent;
    long peersReceived;
    long newPeersDiscovered;
    long stalePeersRemoved;
    long errors;
    Instant lastRoundTime;
    // milliseconds
    Long lastRoundDuration;
}
