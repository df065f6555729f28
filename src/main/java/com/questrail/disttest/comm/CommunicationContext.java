package com.questrail.disttest.comm;

import com.questrail.disttest.config.RendezvousDescriptor;
import com.questrail.disttest.store.RendezvousStore;

import java.time.Duration;

/**
 * Live transport session shared by every participant of one rendezvous.
 *
 * <p>The RPC layer is built on top of it and assumes it stays open until the
 * RPC context has been closed.</p>
 */
public interface CommunicationContext extends AutoCloseable
{
    RendezvousDescriptor descriptor();

    String transportKind();

    /**
     * Store shared with every peer of this context.
     */
    RendezvousStore store();

    /**
     * Collective barrier: blocks until all {@code worldSize} participants have
     * entered the barrier with the same name the same number of times.
     *
     * @throws com.questrail.disttest.error.RendezvousException on timeout
     */
    void barrier(String name, Duration timeout);

    boolean isClosed();

    /**
     * Leave the rendezvous. Calling this more than once has no further effect.
     */
    @Override
    void close();
}
