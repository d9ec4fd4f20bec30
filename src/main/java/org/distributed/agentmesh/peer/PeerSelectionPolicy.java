package org.distributed.agentmesh.peer;

import java.time.Instant;

import org.distributed.agentmesh.model.PeerEntry;

/**
 * Decides which peers may be picked for gossip and collaboration.
 * Register a different bean to make selection stricter.
 */
public interface PeerSelectionPolicy {

    boolean isUsable(PeerEntry entry, Instant now);

    /**
     * When no peer passes {@link #isUsable}, use the whole table instead of nothing.
     */
    default boolean fallbackToAllWhenNoneUsable() {
        return true;
    }
}
