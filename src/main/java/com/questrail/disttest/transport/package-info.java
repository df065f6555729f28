/**
 * Datagram Transport Ports
 * =============================================================================
 *
 * <p>Framework-agnostic boundary between a concrete networking implementation
 * (Netty UDP, or a test double) and the RPC reachability handshake.</p>
 *
 * <p>Everything above the adapter sees only raw {@code byte[]} payloads,
 * {@link java.net.SocketAddress} peers and up/down notifications. Netty types
 * stay inside {@code transport.udp.netty}.</p>
 */
package com.questrail.disttest.transport;
