package com.questrail.disttest.api;

import com.questrail.disttest.error.ConfigurationException;

/**
 * Rank and world size assigned to this process by the multi-process runner.
 *
 * <p>Never computed by the harness. Immutable for one test invocation.</p>
 */
public record TestIdentity(int rank, int worldSize)
{
    public TestIdentity {
        if (worldSize < 1) {
            throw new ConfigurationException("worldSize must be >= 1, was " + worldSize);
        }
        if (rank < 0 || rank >= worldSize) {
            throw new ConfigurationException(
                    "rank must satisfy 0 <= rank < worldSize, was rank=" + rank + " worldSize=" + worldSize);
        }
    }

    public static TestIdentity single() {
        return new TestIdentity(0, 1);
    }

    /**
     * Participant name used by the RPC layer.
     */
    public String workerName() {
        return "worker" + rank;
    }
}
