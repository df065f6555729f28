package com.questrail.disttest.observability;

import java.time.Instant;

/**
 * A harness phase transition for one rank.
 */
public record HarnessLifecycleEvent(
    Instant timestamp,
    Phase phase,
    int rank,
    int worldSize,
    String descriptor
) {
    public enum Phase {
        COMMUNICATION_INIT_STARTED,
        COMMUNICATION_READY,
        RPC_INIT_STARTED,
        RPC_READY,
        BODY_STARTED,
        BODY_PASSED,
        BODY_FAILED,
        RPC_CLOSED,
        COMMUNICATION_CLOSED
    }
}
