package com.questrail.disttest.error;

/**
 * Peers failed to arrive within the rendezvous timeout, the descriptor was
 * malformed or unreachable, or the shared store could not be used.
 *
 * <p>Fatal to the current test invocation. The harness does not retry; a
 * runner may retry the whole test.</p>
 */
public class RendezvousException extends DistributedTestException
{
    public RendezvousException(String message) {
        super(message);
    }

    public RendezvousException(String message, Throwable cause) {
        super(message, cause);
    }
}
