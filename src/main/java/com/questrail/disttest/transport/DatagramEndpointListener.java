package com.questrail.disttest.transport;

import java.net.SocketAddress;

/**
 * Callback sink for {@link DatagramEndpoint}.
 *
 * <p>Callbacks are delivered serially by each implementation. Netty endpoints
 * deliver them on the channel's event loop, never on the caller's thread.</p>
 */
public interface DatagramEndpointListener
{
    void onTransportUp();

    /**
     * @param cause an exception or diagnostic cause; {@code null} for orderly shutdown
     */
    void onTransportDown(Throwable cause);

    /**
     * Called when a datagram is received. The payload is a full datagram,
     * already copied out of any framework buffer.
     */
    void onDatagram(SocketAddress remote, byte[] payload);
}
