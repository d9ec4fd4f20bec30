package org.distributed.agentmesh.peer;

import java.time.Duration;
import java.time.Instant;

import org.distributed.agentmesh.model.PeerEntry;
import org.distributed.agentmesh.model.PeerHealth;

/**
 * Default selection: a peer is usable when it is healthy, when its health is
 * unknown but it was seen within the window, or when no health was ever recorded.
 */
public class RecentlySeenSelectionPolicy implements PeerSelectionPolicy {

    public static final Duration DEFAULT_WINDOW = Duration.ofSeconds(300);

    private final Duration window;

    public RecentlySeenSelectionPolicy(Duration window) {
        this.window = window;
    }

    @Override
    public boolean isUsable(PeerEntry entry, Instant now) {
        if (!entry.hasHealthRecord()) {
            return true;
        }
        if (entry.getHealth() == PeerHealth.HEALTHY) {
            return true;
        }
        return entry.getHealth() == PeerHealth.UNKNOWN
                && entry.getLastSeen() != null
                && Duration.between(entry.getLastSeen(), now).compareTo(window) < 0;
    }
}
