package org.distributed.agentmesh.peer;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import org.distributed.agentmesh.model.AgentRecord;
import org.distributed.agentmesh.model.PeerAddress;
import org.distributed.agentmesh.model.PeerEntry;
import org.distributed.agentmesh.model.PeerHealth;
import org.springframework.web.client.RestClientException;

import lombok.extern.slf4j.Slf4j;

/**
 * Known peers of this node with their health, last-seen time and address.
 * The four maps change together under one lock; reads return copies.
 * Network calls never run while the lock is held.
 */
@Slf4j
public class PeerTable {

    public static final String DEFAULT_PING_PATH = "/health";

    private final String selfId;
    private final Clock clock;
    private final PeerSelectionPolicy selectionPolicy;
    private final PeerClient peerClient;

    private final Object lock = new Object();
    private final Map<String, AgentRecord> records = new HashMap<>();
    private final Map<String, PeerAddress> addresses = new HashMap<>();
    private final Map<String, PeerHealth> health = new HashMap<>();
    private final Map<String, Instant> lastSeen = new HashMap<>();

    public PeerTable(String selfId, Clock clock, PeerSelectionPolicy selectionPolicy, PeerClient peerClient) {
        this.selfId = selfId;
        this.clock = clock;
        this.selectionPolicy = selectionPolicy;
        this.peerClient = peerClient;
    }

    public String getSelfId() {
        return selfId;
    }

    /**
     * Insert or replace a peer. The local node is never stored.
     * @return false when the id is blank or the local id
     */
    public boolean upsert(String peerId, AgentRecord record) {
        if (peerId == null || peerId.isBlank() || peerId.equals(selfId)) {
            return false;
        }
        PeerAddress address = PeerAddressResolver.resolve(peerId, record);
        Instant now = clock.instant();
        boolean added;
        synchronized (lock) {
            added = records.put(peerId, record) == null;
            addresses.put(peerId, address);
            lastSeen.put(peerId, now);
            if (added) {
                health.put(peerId, PeerHealth.UNKNOWN);
            }
        }
        if (added) {
            log.info("[PeerTable] Added peer {} at {}", peerId, address);
        } else {
            log.debug("[PeerTable] Updated peer {}", peerId);
        }
        return true;
    }

    /**
     * Insert a peer only when the id is not in the table yet. Check and insert
     * happen under one lock, so of two concurrent callers exactly one wins.
     * @return true when this call added the peer
     */
    public boolean upsertIfAbsent(String peerId, AgentRecord record) {
        if (peerId == null || peerId.isBlank() || peerId.equals(selfId)) {
            return false;
        }
        PeerAddress address = PeerAddressResolver.resolve(peerId, record);
        Instant now = clock.instant();
        synchronized (lock) {
            if (records.containsKey(peerId)) {
                return false;
            }
            records.put(peerId, record);
            addresses.put(peerId, address);
            lastSeen.put(peerId, now);
            health.put(peerId, PeerHealth.UNKNOWN);
        }
        log.info("[PeerTable] Added peer {} at {}", peerId, address);
        return true;
    }

    public boolean remove(String peerId) {
        boolean existed;
        synchronized (lock) {
            existed = records.remove(peerId) != null;
            addresses.remove(peerId);
            health.remove(peerId);
            lastSeen.remove(peerId);
        }
        if (existed) {
            log.info("[PeerTable] Removed peer {}", peerId);
        }
        return existed;
    }

    public Optional<PeerEntry> get(String peerId) {
        synchronized (lock) {
            return Optional.ofNullable(entryOf(peerId));
        }
    }

    public List<PeerEntry> all() {
        synchronized (lock) {
            List<PeerEntry> entries = new ArrayList<>(records.size());
            for (String peerId : records.keySet()) {
                entries.add(entryOf(peerId));
            }
            return entries;
        }
    }

    public List<String> ids() {
        synchronized (lock) {
            return new ArrayList<>(records.keySet());
        }
    }

    public boolean contains(String peerId) {
        synchronized (lock) {
            return records.containsKey(peerId);
        }
    }

    public int size() {
        synchronized (lock) {
            return records.size();
        }
    }

    /**
     * Peers the selection policy accepts. Falls back to the whole table when
     * none qualifies and the policy allows it.
     */
    public List<PeerEntry> usablePeers() {
        List<PeerEntry> entries = all();
        Instant now = clock.instant();
        List<PeerEntry> usable = new ArrayList<>();
        for (PeerEntry entry : entries) {
            if (selectionPolicy.isUsable(entry, now)) {
                usable.add(entry);
            }
        }
        if (usable.isEmpty() && !entries.isEmpty() && selectionPolicy.fallbackToAllWhenNoneUsable()) {
            log.debug("[PeerTable] No usable peers by policy, falling back to all {} peers", entries.size());
            return entries;
        }
        return usable;
    }

    /**
     * Ping the peer's health endpoint and record the outcome.
     * @return healthy on a 2xx answer, unhealthy on failure, unknown when the
     * peer or its host is unknown
     */
    public PeerHealth probe(String peerId) {
        PeerEntry entry = get(peerId).orElse(null);
        if (entry == null) {
            log.warn("[PeerTable] Cannot probe unknown peer {}", peerId);
            return PeerHealth.UNKNOWN;
        }
        if (!entry.getAddress().isResolvable()) {
            log.warn("[PeerTable] Cannot determine host for peer {}", peerId);
            setHealth(peerId, PeerHealth.UNKNOWN);
            return PeerHealth.UNKNOWN;
        }

        PeerHealth outcome;
        try {
            String path = entry.endpointPath(AgentRecord.PING_ENDPOINT, DEFAULT_PING_PATH);
            outcome = peerClient.ping(entry.getAddress(), path) ? PeerHealth.HEALTHY : PeerHealth.UNHEALTHY;
        } catch (RestClientException | IllegalArgumentException | IllegalStateException e) {
            log.warn("[PeerTable] Health check failed for {} at {}: {}", peerId, entry.getAddress(), e.getMessage());
            outcome = PeerHealth.UNHEALTHY;
        }
        setHealth(peerId, outcome);
        return outcome;
    }

    public void markHealthy(String peerId) {
        setHealth(peerId, PeerHealth.HEALTHY);
    }

    /**
     * Record a health outcome; a healthy outcome also counts as a sighting.
     * Unknown ids are ignored.
     */
    public void setHealth(String peerId, PeerHealth outcome) {
        Instant now = clock.instant();
        synchronized (lock) {
            if (!records.containsKey(peerId)) {
                return;
            }
            health.put(peerId, outcome);
            if (outcome == PeerHealth.HEALTHY) {
                lastSeen.put(peerId, now);
            }
        }
        log.debug("[PeerTable] Peer {} is {}", peerId, outcome.getStatus());
    }

    /**
     * Drop every peer not seen for longer than the ttl.
     * @return the evicted ids
     */
    public List<String> evictStale(Duration ttl) {
        Instant now = clock.instant();
        List<String> evicted = new ArrayList<>();
        synchronized (lock) {
            for (Map.Entry<String, Instant> seen : lastSeen.entrySet()) {
                if (Duration.between(seen.getValue(), now).compareTo(ttl) > 0) {
                    evicted.add(seen.getKey());
                }
            }
            for (String peerId : evicted) {
                records.remove(peerId);
                addresses.remove(peerId);
                health.remove(peerId);
                lastSeen.remove(peerId);
            }
        }
        if (!evicted.isEmpty()) {
            log.info("[PeerTable] Removed {} stale peers: {}", evicted.size(), evicted);
        }
        return evicted;
    }

    // caller holds the lock
    private PeerEntry entryOf(String peerId) {
        AgentRecord record = records.get(peerId);
        if (record == null) {
            return null;
        }
        return new PeerEntry(peerId, record, addresses.get(peerId), health.get(peerId), lastSeen.get(peerId));
    }
}
