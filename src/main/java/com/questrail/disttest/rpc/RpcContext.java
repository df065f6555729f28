package com.questrail.disttest.rpc;

import com.questrail.disttest.config.RendezvousDescriptor;
import com.questrail.disttest.config.RpcBackend;

import java.util.List;
import java.util.Optional;

/**
 * Messaging session layered on a live communication context and addressed by
 * participant name.
 *
 * <p>Owned by whoever initialized it; released only through
 * {@link RpcLayer#closeRpcContext(RpcContext)}.</p>
 */
public interface RpcContext
{
    String selfName();

    int selfRank();

    RpcBackend backend();

    RendezvousDescriptor descriptor();

    /**
     * All participants, ordered by rank.
     */
    List<WorkerInfo> workers();

    Optional<WorkerInfo> workerInfo(String name);

    boolean isClosed();
}
