package com.questrail.disttest.api;

import com.questrail.disttest.comm.CommunicationContext;
import com.questrail.disttest.config.RendezvousDescriptor;
import com.questrail.disttest.rpc.RpcContext;

/**
 * The distributed state a test body runs against.
 *
 * <p>Owned by the harness for exactly one invocation and handed to the body
 * explicitly; there is no ambient global runtime. Both contexts are closed by
 * the harness once the body returns, so a body must not retain this object.</p>
 */
public interface DistributedRuntime
{
    RendezvousDescriptor descriptor();

    CommunicationContext communication();

    RpcContext rpc();

    default int rank() {
        return descriptor().rank();
    }

    default int worldSize() {
        return descriptor().worldSize();
    }

    default String selfName() {
        return rpc().selfName();
    }
}
