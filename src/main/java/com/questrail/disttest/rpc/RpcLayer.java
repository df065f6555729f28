package com.questrail.disttest.rpc;

import com.questrail.disttest.config.RpcBackend;

/**
 * Consumed port: creates and releases RPC contexts.
 */
public interface RpcLayer
{
    /**
     * Blocking collective initialization. Must only be called once a
     * communication context for the same descriptor is live.
     *
     * @throws com.questrail.disttest.error.RendezvousException if peers do not
     *         arrive in time, no communication context is live, or names collide
     * @throws com.questrail.disttest.error.BackendMismatchException if peers
     *         resolved a different backend
     */
    RpcContext initRpcContext(String selfName, RpcBackend backend, int selfRank, String descriptor);

    /**
     * Join all peers, then release the context. A context can be closed once;
     * a second call fails without touching any other state.
     *
     * @throws com.questrail.disttest.error.TeardownException if the context is
     *         already closed, was not opened by this layer, or the join fails
     */
    void closeRpcContext(RpcContext context);
}
