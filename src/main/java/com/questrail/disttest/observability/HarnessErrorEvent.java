package com.questrail.disttest.observability;

import java.time.Instant;

/**
 * Record representing a failure inside the harness lifecycle.
 *
 * @param suppressed {@code true} when the failure was attached to a primary
 *                   test-body failure instead of being surfaced
 */
public record HarnessErrorEvent(
    Instant timestamp,
    int rank,
    String message,
    Throwable cause,
    boolean suppressed
) {
}
