package com.questrail.disttest.comm;

/**
 * Consumed port: brings up the communication context every participant
 * shares.
 *
 * <p>Initialization is a blocking collective operation. It returns only once
 * all {@code world_size} participants named by the descriptor have arrived,
 * or fails when the rendezvous timeout elapses.</p>
 */
public interface CommunicationTransport
{
    /**
     * @param descriptor    rendezvous URL, {@code file://<path>?rank=<r>&world_size=<n>}
     * @param transportKind transport identifier every participant must agree on
     * @throws com.questrail.disttest.error.RendezvousException on timeout, a
     *         malformed or unreachable descriptor, or peer disagreement
     */
    CommunicationContext initCommunicationContext(String descriptor, String transportKind);
}
