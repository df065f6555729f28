package com.questrail.disttest.error;

/**
 * Base type for every failure raised while bringing a distributed test
 * runtime up or down.
 *
 * <p>Subclasses classify <em>where</em> the failure happened so that a
 * runner can report exactly one outcome per test invocation:</p>
 * <ul>
 *   <li>{@link ConfigurationException} - invalid local inputs, no I/O performed</li>
 *   <li>{@link RendezvousException} - peers did not meet, or the descriptor was unusable</li>
 *   <li>{@link BackendMismatchException} - participants disagree on the RPC backend</li>
 *   <li>{@link TeardownException} - releasing the RPC context failed</li>
 * </ul>
 */
public abstract class DistributedTestException extends RuntimeException
{
    protected DistributedTestException(String message) {
        super(message);
    }

    protected DistributedTestException(String message, Throwable cause) {
        super(message, cause);
    }
}
