package com.questrail.disttest.rpc.datagram;

import com.questrail.disttest.error.RendezvousException;
import com.questrail.disttest.time.MonotonicClock;
import com.questrail.disttest.transport.DatagramEndpoint;
import com.questrail.disttest.transport.DatagramEndpointListener;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.SocketAddress;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;

/**
 * DatagramHandshake
 * =============================================================================
 * Reachability check run by the {@code DATAGRAM} RPC backend once every
 * worker has published its UDP address.
 *
 * <h2>Wire format</h2>
 * UTF-8 text, one message per datagram:
 * <pre>
 *   HELLO &lt;senderRank&gt;
 *   ACK &lt;senderRank&gt;
 * </pre>
 *
 * <h2>Behavior</h2>
 * <ul>
 *   <li>Every inbound {@code HELLO} is answered with an {@code ACK}, for as
 *       long as the endpoint runs, so a peer whose ACK was lost can resend.</li>
 *   <li>{@link #greet(Map, Duration)} resends {@code HELLO} to every peer that
 *       has not acknowledged yet, once per retry interval, until all have or the
 *       deadline passes.</li>
 *   <li>Malformed datagrams are dropped.</li>
 * </ul>
 *
 * <p>All state touched from the endpoint's callback thread is concurrent; the
 * waiting thread is woken through this object's monitor.</p>
 */
public final class DatagramHandshake
{
    private static final Logger log = LoggerFactory.getLogger(DatagramHandshake.class);

    static final String HELLO = "HELLO";
    static final String ACK = "ACK";

    private final DatagramEndpoint endpoint;
    private final int selfRank;
    private final MonotonicClock clock;
    private final Duration retryInterval;

    private final Set<Integer> helloFrom = ConcurrentHashMap.newKeySet();
    private final Set<Integer> ackedBy = ConcurrentHashMap.newKeySet();

    private boolean up;
    private Throwable downCause;

    public DatagramHandshake(DatagramEndpoint endpoint, int selfRank, MonotonicClock clock, Duration retryInterval)
    {
        this.endpoint = Objects.requireNonNull(endpoint, "endpoint");
        this.selfRank = selfRank;
        this.clock = Objects.requireNonNull(clock, "clock");
        this.retryInterval = Objects.requireNonNull(retryInterval, "retryInterval");
        this.endpoint.setListener(new Listener());
    }

    /**
     * Start the endpoint and wait until it is bound.
     *
     * @return the address peers should send to
     */
    public SocketAddress start(Duration timeout)
    {
        endpoint.start();

        long deadline = clock.deadlineAfter(timeout);
        synchronized (this) {
            while (!up) {
                if (downCause != null) {
                    throw new RendezvousException("Datagram endpoint for rank " + selfRank + " failed to bind", downCause);
                }
                long remaining = deadline - clock.nowNanos();
                if (remaining <= 0) {
                    throw new RendezvousException("Datagram endpoint for rank " + selfRank
                            + " did not come up within " + timeout.toMillis() + " ms");
                }
                waitNanos(remaining);
            }
        }
        return endpoint.localAddress().orElseThrow(
                () -> new RendezvousException("Datagram endpoint for rank " + selfRank + " has no local address"));
    }

    /**
     * Exchange HELLO/ACK with every peer.
     *
     * @param peers UDP address by rank; an entry for this worker's own rank is ignored
     * @throws RendezvousException naming the ranks that never acknowledged
     */
    public void greet(Map<Integer, ? extends SocketAddress> peers, Duration timeout)
    {
        long deadline = clock.deadlineAfter(timeout);
        byte[] hello = encode(HELLO, selfRank);

        while (true) {
            Set<Integer> missing = missing(peers);
            if (missing.isEmpty()) {
                log.debug("Rank {} reached all {} peers", selfRank, peers.size() - (peers.containsKey(selfRank) ? 1 : 0));
                return;
            }
            long remaining = deadline - clock.nowNanos();
            if (remaining <= 0) {
                throw new RendezvousException("Rank " + selfRank + " could not reach ranks " + missing
                        + " over UDP within " + timeout.toMillis() + " ms");
            }
            for (Integer rank : missing) {
                endpoint.send(peers.get(rank), hello);
            }
            synchronized (this) {
                if (!missing(peers).isEmpty()) {
                    waitNanos(Math.min(remaining, retryInterval.toNanos()));
                }
            }
        }
    }

    public Set<Integer> helloReceivedFrom() {
        return Set.copyOf(helloFrom);
    }

    public Set<Integer> acknowledgedBy() {
        return Set.copyOf(ackedBy);
    }

    public void stop() {
        endpoint.stop();
    }

    private Set<Integer> missing(Map<Integer, ? extends SocketAddress> peers)
    {
        Set<Integer> missing = new TreeSet<>(peers.keySet());
        missing.remove(selfRank);
        missing.removeAll(ackedBy);
        return missing;
    }

    private void waitNanos(long nanos)
    {
        try {
            long millis = Math.max(1L, nanos / 1_000_000L);
            wait(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RendezvousException("Interrupted during datagram handshake of rank " + selfRank, e);
        }
    }

    static byte[] encode(String verb, int rank) {
        return (verb + " " + rank).getBytes(StandardCharsets.UTF_8);
    }

    static Optional<Message> decode(byte[] payload)
    {
        String text = new String(payload, StandardCharsets.UTF_8);
        int space = text.indexOf(' ');
        if (space <= 0) {
            return Optional.empty();
        }
        String verb = text.substring(0, space);
        if (!HELLO.equals(verb) && !ACK.equals(verb)) {
            return Optional.empty();
        }
        try {
            int rank = Integer.parseInt(text.substring(space + 1));
            return rank < 0 ? Optional.empty() : Optional.of(new Message(verb, rank));
        } catch (NumberFormatException e) {
            return Optional.empty();
        }
    }

    record Message(String verb, int rank) {}

    private final class Listener implements DatagramEndpointListener
    {
        @Override
        public void onTransportUp()
        {
            synchronized (DatagramHandshake.this) {
                up = true;
                DatagramHandshake.this.notifyAll();
            }
        }

        @Override
        public void onTransportDown(Throwable cause)
        {
            synchronized (DatagramHandshake.this) {
                if (cause != null) {
                    log.warn("Datagram endpoint for rank {} went down", selfRank, cause);
                    downCause = cause;
                }
                up = false;
                DatagramHandshake.this.notifyAll();
            }
        }

        @Override
        public void onDatagram(SocketAddress remote, byte[] payload)
        {
            Optional<Message> decoded = decode(payload);
            if (decoded.isEmpty()) {
                log.debug("Rank {} dropped malformed datagram from {}", selfRank, remote);
                return;
            }
            Message message = decoded.get();
            if (HELLO.equals(message.verb())) {
                helloFrom.add(message.rank());
                endpoint.send(remote, encode(ACK, selfRank));
            }
            else {
                ackedBy.add(message.rank());
                synchronized (DatagramHandshake.this) {
                    DatagramHandshake.this.notifyAll();
                }
            }
        }
    }
}
