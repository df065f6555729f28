package com.questrail.disttest.time;

import java.time.Duration;

/**
 * MonotonicClock
 * =============================================================================
 * Time source for rendezvous deadlines.
 *
 * <h2>Binding invariant</h2>
 * All timeout logic (store waits, barriers, handshake deadlines) MUST use a
 * monotonic time source. Wall-clock time is permitted only for observability.
 */
public interface MonotonicClock
{
    /**
     * Returns a monotonically increasing tick value in nanoseconds.
     * Values are only meaningful for elapsed time computations.
     */
    long nowNanos();

    /**
     * Longest wait a deadline can express. Half the tick range keeps
     * {@code now - deadline} comparisons free of wrap-around.
     */
    long MAX_WAIT_NANOS = Long.MAX_VALUE / 2;

    /**
     * Deadline tick {@code timeout} from now. Timeouts beyond
     * {@link #MAX_WAIT_NANOS} are clamped to it.
     */
    default long deadlineAfter(Duration timeout)
    {
        long nanos = timeout.compareTo(Duration.ofNanos(MAX_WAIT_NANOS)) >= 0
                ? MAX_WAIT_NANOS
                : timeout.toNanos();
        return nowNanos() + nanos;
    }
}
