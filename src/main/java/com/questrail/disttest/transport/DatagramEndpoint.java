package com.questrail.disttest.transport;

import java.net.SocketAddress;
import java.util.Optional;

/**
 * DatagramEndpoint
 * -----------------------------------------------------------------------------
 * Minimal port for a datagram-based transport (UDP-style).
 *
 * <p>The endpoint only moves bytes. Message meaning, retries and deadlines
 * belong to the layer that owns the listener.</p>
 *
 * <p>Implementations may be backed by Netty, java.nio, or a test double.</p>
 */
public interface DatagramEndpoint
{
    /**
     * Start the endpoint and begin receiving datagrams.
     *
     * <p>On successful activation, the endpoint MUST notify its listener via
     * {@link DatagramEndpointListener#onTransportUp()} exactly once per transition.</p>
     */
    void start();

    /**
     * Stop the endpoint and release all transport resources.
     *
     * <p>The listener is notified via
     * {@link DatagramEndpointListener#onTransportDown(Throwable)}.</p>
     */
    void stop();

    /**
     * Send a datagram to the specified remote endpoint. Sends issued before the
     * transport is up are dropped.
     */
    void send(SocketAddress remote, byte[] payload);

    /**
     * Address peers should send to, once the transport is up.
     */
    Optional<SocketAddress> localAddress();

    /**
     * Register the listener that receives inbound datagrams and lifecycle events.
     *
     * <p>This must be called before {@link #start()}.</p>
     */
    void setListener(DatagramEndpointListener listener);
}
