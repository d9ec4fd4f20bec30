package org.distributed.agentmesh.gossip;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Random;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

import org.distributed.agentmesh.config.GossipProperties;
import org.distributed.agentmesh.discovery.DiscoveryCache;
import org.distributed.agentmesh.model.AgentRecord;
import org.distributed.agentmesh.model.PeerEntry;
import org.distributed.agentmesh.peer.PeerClient;
import org.distributed.agentmesh.peer.PeerExchangeResponse;
import org.distributed.agentmesh.peer.PeerTable;
import org.springframework.web.client.RestClientException;

import lombok.extern.slf4j.Slf4j;

/**
 * Epidemic peer exchange. Each round evicts stale peers, picks up to fanout
 * targets, swaps peer-id lists with them in parallel and resolves the ids it
 * did not know before inserting them into the peer table.
 */
@Slf4j
public class GossipEngine {

    public static final String DEFAULT_PEERS_PATH = "/peers";
    private static final Duration FALLBACK_INTERVAL = Duration.ofSeconds(60);

    private final String selfId;
    private final PeerTable peerTable;
    private final DiscoveryCache discoveryCache;
    private final PeerClient peerClient;
    private final GossipProperties properties;
    private final Clock clock;
    private final Random random;
    private final ExecutorService exchangePool;

    // one round at a time, whether triggered by the loop or by hand
    private final Object roundLock = new Object();

    private volatile boolean running = false;
    // one per loop generation, a stopped loop never sees the signal of its successor
    private CountDownLatch stopSignal;

    private final AtomicLong roundsInitiated = new AtomicLong();
    private final AtomicLong roundsCompleted = new AtomicLong();
    private final AtomicLong messagesSent = new AtomicLong();
    private final AtomicLong messagesReceived = new AtomicLong();
    private final AtomicLong peersSent = new AtomicLong();
    private final AtomicLong peersReceived = new AtomicLong();
    private final AtomicLong newPeersDiscovered = new AtomicLong();
    private final AtomicLong stalePeersRemoved = new AtomicLong();
    private final AtomicLong errors = new AtomicLong();
    private volatile Instant lastRoundTime;
    private volatile Long lastRoundDuration;

    public GossipEngine(String selfId, PeerTable peerTable, DiscoveryCache discoveryCache, PeerClient peerClient,
                        GossipProperties properties, Clock clock, Random random) {
        this.selfId = selfId;
        this.peerTable = peerTable;
        this.discoveryCache = discoveryCache;
        this.peerClient = peerClient;
        this.properties = properties;
        this.clock = clock;
        this.random = random;
        this.exchangePool = Executors.newFixedThreadPool(properties.getMaxConcurrentExchanges(), exchangeThreadFactory());
    }

    /**
     * Start the background loop.
     * @return false when it was already running
     */
    public synchronized boolean start() {
        if (running) {
            log.warn("[Gossip] Gossip protocol already running");
            return false;
        }
        running = true;
        CountDownLatch signal = new CountDownLatch(1);
        stopSignal = signal;
        Thread loopThread = new Thread(() -> loop(signal), "gossip-loop");
        loopThread.setDaemon(true);
        loopThread.start();
        log.info("[Gossip] Started gossip protocol with interval {}s", effectiveInterval().getSeconds());
        return true;
    }

    /**
     * Signal the loop to exit. A round in flight completes, no new round starts.
     * @return false when it was not running
     */
    public synchronized boolean stop() {
        if (!running) {
            log.warn("[Gossip] Gossip protocol not running");
            return false;
        }
        running = false;
        stopSignal.countDown();
        stopSignal = null;
        log.info("[Gossip] Stopped gossip protocol");
        return true;
    }

    public boolean isRunning() {
        return running;
    }

    public void shutdown() {
        if (running) {
            stop();
        }
        exchangePool.shutdownNow();
    }

    public GossipRoundResult runRound() {
        synchronized (roundLock) {
            long startMillis = clock.millis();
            roundsInitiated.incrementAndGet();
            log.info("[Gossip] Starting gossip round");

            List<String> evicted = peerTable.evictStale(properties.getPeerTtl());
            stalePeersRemoved.addAndGet(evicted.size());

            List<PeerEntry> targets = selectTargets();
            if (targets.isEmpty()) {
                log.info("[Gossip] No peers available for gossip");
                return GossipRoundResult.builder()
                        .status(GossipRoundResult.NO_TARGETS)
                        .evicted(evicted)
                        .stats(stats())
                        .build();
            }

            List<String> targetIds = new ArrayList<>();
            List<Future<ExchangeResult>> futures = new ArrayList<>();
            for (PeerEntry target : targets) {
                targetIds.add(target.getId());
                futures.add(exchangePool.submit(() -> exchange(target)));
            }
            log.info("[Gossip] Selected {} targets: {}", targetIds.size(), targetIds);

            List<ExchangeResult> results = new ArrayList<>();
            for (int i = 0; i < futures.size(); i++) {
                ExchangeResult result = await(targetIds.get(i), futures.get(i));
                if (result.isSuccess()) {
                    peerTable.markHealthy(result.getTarget());
                }
                results.add(result);
            }

            long duration = clock.millis() - startMillis;
            roundsCompleted.incrementAndGet();
            lastRoundTime = clock.instant();
            lastRoundDuration = duration;
            log.info("[Gossip] Completed gossip round in {}ms, {} peers known", duration, peerTable.size());

            return GossipRoundResult.builder()
                    .status(GossipRoundResult.COMPLETED)
                    .targets(targetIds)
                    .results(results)
                    .evicted(evicted)
                    .duration(duration)
                    .stats(stats())
                    .build();
        }
    }

    /**
     * Uniform sample of fanout usable peers, topped up with other known peers
     * when too few are usable.
     */
    public List<PeerEntry> selectTargets() {
        int fanout = properties.getFanout();
        List<PeerEntry> targets = sample(peerTable.usablePeers(), fanout);
        if (targets.size() < fanout) {
            Set<String> chosen = new HashSet<>();
            for (PeerEntry target : targets) {
                chosen.add(target.getId());
            }
            List<PeerEntry> others = new ArrayList<>();
            for (PeerEntry entry : peerTable.all()) {
                if (!chosen.contains(entry.getId()) && !entry.getId().equals(selfId)) {
                    others.add(entry);
                }
            }
            targets.addAll(sample(others, fanout - targets.size()));
        }
        return targets;
    }

    /**
     * GET the target's peers, POST a sample of ours, then fold in the ids we did not know.
     * A failure only affects this target.
     */
    public ExchangeResult exchange(PeerEntry target) {
        String targetId = target.getId();
        if (!target.getAddress().isResolvable()) {
            log.warn("[Gossip] Cannot determine host for peer {}", targetId);
            errors.incrementAndGet();
            return ExchangeResult.failed(targetId, "Cannot determine host for peer");
        }
        String path = target.endpointPath(AgentRecord.PEERS_ENDPOINT, DEFAULT_PEERS_PATH);

        try {
            List<String> theirPeers = peerClient.fetchPeers(target.getAddress(), path);
            messagesReceived.incrementAndGet();
            peersReceived.addAndGet(theirPeers.size());

            List<String> candidates = new ArrayList<>();
            for (String peerId : peerTable.ids()) {
                if (!peerId.equals(targetId) && !peerId.equals(selfId)) {
                    candidates.add(peerId);
                }
            }
            List<String> ourPeers = sample(candidates, properties.getMaxPeersToExchange());
            PeerExchangeResponse response = peerClient.sendPeers(target.getAddress(), path, ourPeers);
            messagesSent.incrementAndGet();
            peersSent.addAndGet(ourPeers.size());
            log.debug("[Gossip] Peer {} answered {} with {} total peers",
                    targetId, response.getStatus(), response.getTotalPeers());

            List<String> learned = new ArrayList<>();
            for (String peerId : theirPeers) {
                if (peerId == null || peerId.equals(selfId) || peerId.equals(targetId) || peerTable.contains(peerId)) {
                    continue;
                }
                if (learn(peerId, targetId)) {
                    learned.add(peerId);
                }
            }
            if (!learned.isEmpty()) {
                log.info("[Gossip] Learned {} new peers from {}: {}", learned.size(), targetId, learned);
            }

            return ExchangeResult.builder()
                    .target(targetId)
                    .success(true)
                    .peersSent(ourPeers.size())
                    .peersReceived(theirPeers.size())
                    .newPeers(learned)
                    .build();
        } catch (RestClientException | IllegalArgumentException | IllegalStateException e) {
            errors.incrementAndGet();
            log.error("[Gossip] Error exchanging peers with {} at {}: {}", targetId, target.getAddress(), e.getMessage());
            return ExchangeResult.failed(targetId, e.getMessage());
        }
    }

    /**
     * Inbound side of an exchange: ids pushed to us by another node.
     * @param peerIds ids the sender knows
     * @param sourceId sender id, may be null
     * @return ids that were new to this node
     */
    public List<String> receivePeers(List<String> peerIds, String sourceId) {
        messagesReceived.incrementAndGet();
        peersReceived.addAndGet(peerIds.size());
        String discoveredVia = sourceId != null ? sourceId : "unknown";

        List<String> added = new ArrayList<>();
        for (String peerId : peerIds) {
            if (peerId == null || peerId.isBlank() || peerId.equals(selfId)
                    || peerId.equals(sourceId) || peerTable.contains(peerId)) {
                continue;
            }
            if (learn(peerId, discoveredVia)) {
                added.add(peerId);
            }
        }
        if (!added.isEmpty()) {
            log.info("[Gossip] Received {} new peers from {}: {}", added.size(), discoveredVia, added);
        }
        return added;
    }

    public GossipStats stats() {
        return GossipStats.builder()
                .running(running)
                .knownPeers(peerTable.size())
                .roundsInitiated(roundsInitiated.get())
                .roundsCompleted(roundsCompleted.get())
                .messagesSent(messagesSent.get())
                .messagesReceived(messagesReceived.get())
                .peersSent(peersSent.get())
                .peersReceived(peersReceived.get())
                .newPeersDiscovered(newPeersDiscovered.get())
                .stalePeersRemoved(stalePeersRemoved.get())
                .errors(errors.get())
                .lastRoundTime(lastRoundTime)
                .lastRoundDuration(lastRoundDuration)
                .build();
    }

    /**
     * Resolve and insert a peer id. Parallel exchanges may race on the same id,
     * only the insert that wins is counted.
     * @return true when this call added the peer
     */
    private boolean learn(String peerId, String discoveredVia) {
        Optional<AgentRecord> resolved = discoveryCache.resolve(peerId);
        AgentRecord record;
        if (resolved.isPresent()) {
            record = resolved.get();
        } else {
            log.warn("[Gossip] Could not resolve peer {}, keeping a placeholder", peerId);
            record = AgentRecord.placeholder(peerId, discoveredVia);
        }
        if (!peerTable.upsertIfAbsent(peerId, record)) {
            return false;
        }
        newPeersDiscovered.incrementAndGet();
        return true;
    }

    private ExchangeResult await(String targetId, Future<ExchangeResult> future) {
        try {
            return future.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            future.cancel(true);
            errors.incrementAndGet();
            return ExchangeResult.failed(targetId, "interrupted");
        } catch (ExecutionException e) {
            errors.incrementAndGet();
            log.error("[Gossip] Unexpected error exchanging peers with {}: {}", targetId, e.getCause().getMessage());
            return ExchangeResult.failed(targetId, String.valueOf(e.getCause().getMessage()));
        }
    }

    private void loop(CountDownLatch signal) {
        log.info("[Gossip] Gossip loop started");
        while (signal.getCount() > 0) {
            try {
                runRound();
            } catch (RuntimeException e) {
                errors.incrementAndGet();
                log.error("[Gossip] Error in gossip loop: {}", e.getMessage(), e);
            }
            try {
                if (signal.await(effectiveInterval().getSeconds(), TimeUnit.SECONDS)) {
                    break;
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            }
        }
        log.info("[Gossip] Gossip loop exited");
    }

    private Duration effectiveInterval() {
        Duration interval = properties.getInterval();
        return interval == null || interval.getSeconds() < 1 ? FALLBACK_INTERVAL : interval;
    }

    private <T> List<T> sample(List<T> population, int size) {
        List<T> copy = new ArrayList<>(population);
        if (size >= copy.size()) {
            return copy;
        }
        Collections.shuffle(copy, random);
        return new ArrayList<>(copy.subList(0, Math.max(size, 0)));
    }

    private static ThreadFactory exchangeThreadFactory() {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, "gossip-exchange-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
