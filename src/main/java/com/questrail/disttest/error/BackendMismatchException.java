package com.questrail.disttest.error;

import com.questrail.disttest.config.RpcBackend;

import java.util.Map;

/**
 * Participants resolved different {@link RpcBackend} values.
 */
public final class BackendMismatchException extends DistributedTestException
{
    private final Map<Integer, RpcBackend> backendsByRank;

    public BackendMismatchException(Map<Integer, RpcBackend> backendsByRank) {
        super("Workers disagree on RPC backend: " + backendsByRank);
        this.backendsByRank = Map.copyOf(backendsByRank);
    }

    public Map<Integer, RpcBackend> backendsByRank() {
        return backendsByRank;
    }
}
