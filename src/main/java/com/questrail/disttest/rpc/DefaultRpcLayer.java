package com.questrail.disttest.rpc;

import com.questrail.disttest.comm.CommunicationContext;
import com.questrail.disttest.config.HarnessConfig;
import com.questrail.disttest.config.RendezvousDescriptor;
import com.questrail.disttest.config.RpcBackend;
import com.questrail.disttest.error.BackendMismatchException;
import com.questrail.disttest.error.ConfigurationException;
import com.questrail.disttest.error.RendezvousException;
import com.questrail.disttest.error.TeardownException;
import com.questrail.disttest.rpc.datagram.DatagramHandshake;
import com.questrail.disttest.store.RendezvousStore;
import com.questrail.disttest.time.MonotonicClock;
import com.questrail.disttest.transport.DatagramEndpoint;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.InetSocketAddress;
import java.net.SocketAddress;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * DefaultRpcLayer
 * =============================================================================
 * {@link RpcLayer} that keeps its membership in the store of the live
 * communication context for the same descriptor.
 *
 * <h2>Init</h2>
 * <pre>
 *   rpc/worker/&lt;rank&gt;   "&lt;name&gt;|&lt;backend&gt;|&lt;host:port or empty&gt;"
 * </pre>
 * <ol>
 *   <li>Resolve the live communication context; none means the caller skipped
 *       communication init.</li>
 *   <li>{@code DATAGRAM} only: bind a UDP endpoint.</li>
 *   <li>Publish this worker's entry and wait for every rank's entry.</li>
 *   <li>Reject backend disagreement and duplicate names.</li>
 *   <li>{@code DATAGRAM} only: HELLO/ACK with every peer.</li>
 * </ol>
 *
 * <h2>Close</h2>
 * A collective join ({@code rpc/join} barrier on the communication context)
 * so no worker releases its context while peers may still address it, then
 * local shutdown. The endpoint is stopped even when the join fails.
 */
public final class DefaultRpcLayer implements RpcLayer
{
    private static final Logger log = LoggerFactory.getLogger(DefaultRpcLayer.class);

    static final String WORKER_PREFIX = "rpc/worker/";
    static final String JOIN_BARRIER = "rpc/join";

    private final Function<String, Optional<CommunicationContext>> liveContexts;
    private final Function<InetSocketAddress, DatagramEndpoint> endpointFactory;
    private final Supplier<InetSocketAddress> bindAddress;
    private final MonotonicClock clock;
    private final Duration rendezvousTimeout;
    private final Duration joinTimeout;
    private final Duration retryInterval;

    private final Map<RendezvousDescriptor, DefaultRpcContext> open = new ConcurrentHashMap<>();

    /**
     * @param liveContexts    resolves the live communication context for a descriptor
     * @param endpointFactory creates the UDP endpoint used by the {@code DATAGRAM} backend
     * @param bindAddress     local address the {@code DATAGRAM} backend binds, port 0 for ephemeral
     */
    public DefaultRpcLayer(HarnessConfig config,
                           MonotonicClock clock,
                           Function<String, Optional<CommunicationContext>> liveContexts,
                           Function<InetSocketAddress, DatagramEndpoint> endpointFactory,
                           Supplier<InetSocketAddress> bindAddress)
    {
        Objects.requireNonNull(config, "config");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.liveContexts = Objects.requireNonNull(liveContexts, "liveContexts");
        this.endpointFactory = Objects.requireNonNull(endpointFactory, "endpointFactory");
        this.bindAddress = Objects.requireNonNull(bindAddress, "bindAddress");
        this.rendezvousTimeout = config.rendezvousTimeout();
        this.joinTimeout = config.joinTimeout();
        this.retryInterval = config.pollInterval().multipliedBy(5);
    }

    @Override
    public RpcContext initRpcContext(String selfName, RpcBackend backend, int selfRank, String descriptor)
    {
        Objects.requireNonNull(backend, "backend");
        validateName(selfName);

        RendezvousDescriptor parsed = RendezvousDescriptor.parse(descriptor);
        if (parsed.rank() != selfRank) {
            throw new RendezvousException("selfRank " + selfRank + " does not match descriptor " + parsed);
        }
        CommunicationContext comm = liveContexts.apply(descriptor)
                .filter(c -> !c.isClosed())
                .orElseThrow(() -> new RendezvousException(
                        "No live communication context for " + parsed + "; initialize it before the RPC context"));
        if (open.containsKey(parsed)) {
            throw new RendezvousException("RPC context already initialized for " + parsed);
        }

        DatagramHandshake handshake = null;
        try {
            InetSocketAddress local = null;
            if (backend == RpcBackend.DATAGRAM) {
                handshake = new DatagramHandshake(endpointFactory.apply(bindAddress.get()), selfRank, clock, retryInterval);
                local = toInet(handshake.start(rendezvousTimeout));
            }

            RendezvousStore store = comm.store();
            store.set(WORKER_PREFIX + selfRank, encode(selfName, backend, local));

            List<String> keys = new ArrayList<>(parsed.worldSize());
            for (int r = 0; r < parsed.worldSize(); r++) {
                keys.add(WORKER_PREFIX + r);
            }
            store.await(keys, rendezvousTimeout);

            Map<Integer, Entry> entries = readEntries(store, parsed.worldSize());
            verifyAgreement(entries);

            if (handshake != null) {
                Map<Integer, InetSocketAddress> peers = new HashMap<>();
                entries.forEach((rank, e) -> peers.put(rank, e.info().address()));
                handshake.greet(peers, rendezvousTimeout);
            }

            List<WorkerInfo> workers = new ArrayList<>();
            entries.values().forEach(e -> workers.add(e.info()));
            DefaultRpcContext context = new DefaultRpcContext(
                    selfName, selfRank, backend, parsed, comm, List.copyOf(workers), handshake);
            if (open.putIfAbsent(parsed, context) != null) {
                throw new RendezvousException("RPC context already initialized for " + parsed);
            }
            log.info("RPC context up: {} (rank {} of {}) backend {}", selfName, selfRank, parsed.worldSize(), backend);
            return context;
        } catch (RuntimeException e) {
            if (handshake != null) {
                handshake.stop();
            }
            throw e;
        }
    }

    @Override
    public void closeRpcContext(RpcContext context)
    {
        Objects.requireNonNull(context, "context");
        if (!(context instanceof DefaultRpcContext ctx) || !open.remove(ctx.descriptor(), ctx)) {
            throw new TeardownException("RPC context " + context.selfName() + " for " + context.descriptor()
                    + " is not open in this layer (already closed or never opened)");
        }
        ctx.closed = true;

        try {
            if (ctx.communication.isClosed()) {
                throw new TeardownException("Communication context closed before RPC join for " + ctx.descriptor());
            }
            ctx.communication.barrier(JOIN_BARRIER, joinTimeout);
            log.info("RPC context joined: {} (rank {})", ctx.selfName(), ctx.selfRank());
        } catch (RendezvousException e) {
            throw new TeardownException("RPC join failed for " + ctx.selfName() + ": " + e.getMessage(), e);
        } finally {
            if (ctx.handshake != null) {
                ctx.handshake.stop();
            }
        }
    }

    // -------------------------------------------------------------------------
    // Membership entries
    // -------------------------------------------------------------------------

    private record Entry(WorkerInfo info, RpcBackend backend) {}

    private static void validateName(String selfName)
    {
        if (selfName == null || selfName.isBlank()) {
            throw new ConfigurationException("RPC worker name must not be blank");
        }
        if (selfName.indexOf('|') >= 0) {
            throw new ConfigurationException("RPC worker name must not contain '|': " + selfName);
        }
    }

    private static byte[] encode(String name, RpcBackend backend, InetSocketAddress address)
    {
        String addr = address == null ? "" : address.getHostString() + ":" + address.getPort();
        return (name + "|" + backend.name() + "|" + addr).getBytes(StandardCharsets.UTF_8);
    }

    private static Map<Integer, Entry> readEntries(RendezvousStore store, int worldSize)
    {
        Map<String, byte[]> raw = store.entriesWithPrefix(WORKER_PREFIX);
        Map<Integer, Entry> entries = new TreeMap<>();
        for (int rank = 0; rank < worldSize; rank++) {
            byte[] value = raw.get(WORKER_PREFIX + rank);
            if (value == null) {
                throw new RendezvousException("RPC entry for rank " + rank + " vanished");
            }
            entries.put(rank, decode(rank, new String(value, StandardCharsets.UTF_8)));
        }
        return entries;
    }

    private static Entry decode(int rank, String text)
    {
        String[] parts = text.split("\\|", -1);
        if (parts.length != 3) {
            throw new RendezvousException("Malformed RPC entry for rank " + rank + ": " + text);
        }
        RpcBackend backend;
        try {
            backend = RpcBackend.valueOf(parts[1]);
        } catch (IllegalArgumentException e) {
            throw new RendezvousException("Unknown backend in RPC entry for rank " + rank + ": " + text, e);
        }
        InetSocketAddress address = null;
        if (!parts[2].isEmpty()) {
            int colon = parts[2].lastIndexOf(':');
            if (colon <= 0) {
                throw new RendezvousException("Malformed address in RPC entry for rank " + rank + ": " + text);
            }
            try {
                address = new InetSocketAddress(parts[2].substring(0, colon),
                        Integer.parseInt(parts[2].substring(colon + 1)));
            } catch (IllegalArgumentException e) {
                throw new RendezvousException("Malformed address in RPC entry for rank " + rank + ": " + text, e);
            }
        }
        return new Entry(new WorkerInfo(parts[0], rank, address), backend);
    }

    private static void verifyAgreement(Map<Integer, Entry> entries)
    {
        Map<Integer, RpcBackend> backends = new TreeMap<>();
        entries.forEach((rank, e) -> backends.put(rank, e.backend()));
        if (backends.values().stream().distinct().count() > 1) {
            throw new BackendMismatchException(backends);
        }

        Map<String, Integer> byName = new LinkedHashMap<>();
        for (Entry e : entries.values()) {
            Integer previous = byName.putIfAbsent(e.info().name(), e.info().rank());
            if (previous != null) {
                throw new RendezvousException("Worker name '" + e.info().name() + "' is used by ranks "
                        + previous + " and " + e.info().rank());
            }
        }
    }

    private static InetSocketAddress toInet(SocketAddress address)
    {
        if (address instanceof InetSocketAddress inet) {
            return inet;
        }
        throw new RendezvousException("Datagram endpoint bound to a non-IP address: " + address);
    }

    // -------------------------------------------------------------------------
    // Context
    // -------------------------------------------------------------------------

    private static final class DefaultRpcContext implements RpcContext
    {
        private final String selfName;
        private final int selfRank;
        private final RpcBackend backend;
        private final RendezvousDescriptor descriptor;
        private final CommunicationContext communication;
        private final List<WorkerInfo> workers;
        private final DatagramHandshake handshake;
        private volatile boolean closed;

        private DefaultRpcContext(String selfName, int selfRank, RpcBackend backend,
                                  RendezvousDescriptor descriptor, CommunicationContext communication,
                                  List<WorkerInfo> workers, DatagramHandshake handshake) {
            this.selfName = selfName;
            this.selfRank = selfRank;
            this.backend = backend;
            this.descriptor = descriptor;
            this.communication = communication;
            this.workers = workers;
            this.handshake = handshake;
        }

        @Override public String selfName() { return selfName; }
        @Override public int selfRank() { return selfRank; }
        @Override public RpcBackend backend() { return backend; }
        @Override public RendezvousDescriptor descriptor() { return descriptor; }
        @Override public List<WorkerInfo> workers() { return Collections.unmodifiableList(workers); }
        @Override public boolean isClosed() { return closed; }

        @Override
        public Optional<WorkerInfo> workerInfo(String name) {
            return workers.stream().filter(w -> w.name().equals(name)).findFirst();
        }

        @Override
        public String toString() {
            return "RpcContext[" + selfName + ", " + backend + ", " + descriptor + ", closed=" + closed + "]";
        }
    }
}
