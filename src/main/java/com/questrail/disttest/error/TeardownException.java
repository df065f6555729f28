package com.questrail.disttest.error;

/**
 * Releasing an RPC context failed, or the context was already closed or
 * never opened by the layer asked to close it.
 *
 * <p>Never replaces a primary test-body failure; in that case it is attached
 * to the primary failure as a suppressed exception.</p>
 */
public final class TeardownException extends DistributedTestException
{
    public TeardownException(String message) {
        super(message);
    }

    public TeardownException(String message, Throwable cause) {
        super(message, cause);
    }
}
