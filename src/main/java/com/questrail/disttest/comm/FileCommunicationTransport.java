package com.questrail.disttest.comm;

import com.questrail.disttest.config.HarnessConfig;
import com.questrail.disttest.config.RendezvousDescriptor;
import com.questrail.disttest.error.RendezvousException;
import com.questrail.disttest.store.FileStore;
import com.questrail.disttest.store.RendezvousStore;
import com.questrail.disttest.time.MonotonicClock;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * FileCommunicationTransport
 * =============================================================================
 * {@link CommunicationTransport} whose rendezvous point is the shared file
 * named by the descriptor. The file itself is the {@link FileStore}.
 *
 * <h2>Init protocol</h2>
 * <pre>
 *   pg/claim/&lt;rank&gt;   counter, must be 1 (a second claim means two processes share a rank)
 *   pg/rank/&lt;rank&gt;    "&lt;worldSize&gt;|&lt;transportKind&gt;"
 * </pre>
 * Each participant claims its rank, publishes its entry and waits until the
 * entries of all ranks are present. It then checks that every peer agrees on
 * world size and transport kind. A participant that fails after claiming
 * removes its entry and releases its claim before rethrowing, so its absence
 * is visible to late peers and the same rank can retry on the same file.
 *
 * <h2>Close protocol</h2>
 * Each participant increments {@code pg/closed}; the one that brings it to
 * {@code worldSize} deletes the file so the path can be reused.
 *
 * <h2>Live contexts</h2>
 * Contexts stay registered by descriptor until closed, so that the RPC layer
 * can verify it is being layered on a live context.
 */
public final class FileCommunicationTransport implements CommunicationTransport
{
    private static final Logger log = LoggerFactory.getLogger(FileCommunicationTransport.class);

    static final String CLAIM_PREFIX = "pg/claim/";
    static final String RANK_PREFIX = "pg/rank/";
    static final String CLOSED_KEY = "pg/closed";
    static final String BARRIER_PREFIX = "pg/barrier/";

    private final MonotonicClock clock;
    private final Duration rendezvousTimeout;
    private final Duration pollInterval;

    private final ConcurrentHashMap<RendezvousDescriptor, FileCommunicationContext> live = new ConcurrentHashMap<>();

    public FileCommunicationTransport(HarnessConfig config, MonotonicClock clock)
    {
        this(clock, config.rendezvousTimeout(), config.pollInterval());
    }

    public FileCommunicationTransport(MonotonicClock clock, Duration rendezvousTimeout, Duration pollInterval)
    {
        this.clock = Objects.requireNonNull(clock, "clock");
        this.rendezvousTimeout = Objects.requireNonNull(rendezvousTimeout, "rendezvousTimeout");
        this.pollInterval = Objects.requireNonNull(pollInterval, "pollInterval");
    }

    @Override
    public CommunicationContext initCommunicationContext(String descriptor, String transportKind)
    {
        Objects.requireNonNull(transportKind, "transportKind");
        RendezvousDescriptor parsed = RendezvousDescriptor.parse(descriptor);

        Path file = Paths.get(parsed.path()).toAbsolutePath();
        Path parent = file.getParent();
        if (parent == null || !Files.isDirectory(parent)) {
            throw new RendezvousException("Rendezvous file " + file + " is unreachable: no directory " + parent);
        }
        if (live.containsKey(parsed)) {
            throw new RendezvousException("Communication context already initialized for " + parsed);
        }

        FileStore store = new FileStore(file, clock, pollInterval);
        int rank = parsed.rank();
        int worldSize = parsed.worldSize();

        long claims = store.add(CLAIM_PREFIX + rank, 1);
        if (claims != 1) {
            store.add(CLAIM_PREFIX + rank, -1);
            throw new RendezvousException("Rank " + rank + " was claimed " + claims
                    + " times in " + file + "; duplicate rank or a stale rendezvous file");
        }

        try {
            store.set(RANK_PREFIX + rank, encode(worldSize, transportKind));
            log.debug("Rank {} of {} waiting for peers at {}", rank, worldSize, file);

            List<String> expected = new ArrayList<>(worldSize);
            for (int r = 0; r < worldSize; r++) {
                expected.add(RANK_PREFIX + r);
            }
            store.await(expected, rendezvousTimeout);
            verifyPeers(store, expected, worldSize, transportKind);
        } catch (RuntimeException e) {
            withdraw(store, rank, e);
            throw e;
        }

        FileCommunicationContext context = new FileCommunicationContext(parsed, transportKind, store);
        if (live.putIfAbsent(parsed, context) != null) {
            throw new RendezvousException("Communication context already initialized for " + parsed);
        }
        log.info("Communication context up: rank {} of {} via '{}' at {}", rank, worldSize, transportKind, file);
        return context;
    }

    /**
     * The live context for {@code descriptor}, if this transport initialized
     * one and it has not been closed.
     */
    public Optional<CommunicationContext> activeContext(String descriptor)
    {
        return Optional.ofNullable(live.get(RendezvousDescriptor.parse(descriptor)));
    }

    /**
     * Take back this rank's entry and claim after a failed attempt, so that a
     * retry on the same file starts from a clean slate for this rank.
     */
    private static void withdraw(RendezvousStore store, int rank, RuntimeException failure)
    {
        try {
            store.remove(RANK_PREFIX + rank);
            store.add(CLAIM_PREFIX + rank, -1);
            log.debug("Rank {} withdrew its rendezvous entry", rank);
        } catch (RuntimeException cleanup) {
            failure.addSuppressed(cleanup);
        }
    }

    private static void verifyPeers(RendezvousStore store, List<String> keys, int worldSize, String transportKind)
    {
        Map<String, String> disagreements = new HashMap<>();
        for (String key : keys) {
            String entry = new String(store.tryGet(key).orElseThrow(
                    () -> new RendezvousException("Peer entry " + key + " vanished")), StandardCharsets.UTF_8);
            if (!entry.equals(new String(encode(worldSize, transportKind), StandardCharsets.UTF_8))) {
                disagreements.put(key, entry);
            }
        }
        if (!disagreements.isEmpty()) {
            throw new RendezvousException("Peers disagree with worldSize=" + worldSize
                    + " transportKind=" + transportKind + ": " + disagreements);
        }
    }

    private static byte[] encode(int worldSize, String transportKind) {
        return (worldSize + "|" + transportKind).getBytes(StandardCharsets.UTF_8);
    }

    // -------------------------------------------------------------------------
    // Context
    // -------------------------------------------------------------------------

    private final class FileCommunicationContext implements CommunicationContext
    {
        private final RendezvousDescriptor descriptor;
        private final String transportKind;
        private final FileStore store;
        private final Map<String, Integer> barrierGenerations = new HashMap<>();
        private volatile boolean closed;

        private FileCommunicationContext(RendezvousDescriptor descriptor, String transportKind, FileStore store) {
            this.descriptor = descriptor;
            this.transportKind = transportKind;
            this.store = store;
        }

        @Override
        public RendezvousDescriptor descriptor() {
            return descriptor;
        }

        @Override
        public String transportKind() {
            return transportKind;
        }

        @Override
        public RendezvousStore store() {
            return store;
        }

        @Override
        public void barrier(String name, Duration timeout)
        {
            Objects.requireNonNull(name, "name");
            if (closed) {
                throw new IllegalStateException("Communication context is closed: " + descriptor);
            }
            int generation;
            synchronized (barrierGenerations) {
                generation = barrierGenerations.merge(name, 1, Integer::sum);
            }
            String key = BARRIER_PREFIX + name + "/" + generation;
            store.add(key, 1);
            store.awaitCount(key, descriptor.worldSize(), timeout);
        }

        @Override
        public boolean isClosed() {
            return closed;
        }

        @Override
        public synchronized void close()
        {
            if (closed) {
                return;
            }
            closed = true;
            live.remove(descriptor, this);

            long left = store.add(CLOSED_KEY, 1);
            if (left >= descriptor.worldSize()) {
                store.delete();
            }
            log.info("Communication context closed: rank {} of {} ({} left)",
                    descriptor.rank(), descriptor.worldSize(), left);
        }

        @Override
        public String toString() {
            return "FileCommunicationContext[" + descriptor + ", closed=" + closed + "]";
        }
    }
}
