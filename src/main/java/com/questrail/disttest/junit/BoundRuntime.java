package com.questrail.disttest.junit;

import com.questrail.disttest.api.DistributedRuntime;
import com.questrail.disttest.comm.CommunicationContext;
import com.questrail.disttest.config.RendezvousDescriptor;
import com.questrail.disttest.rpc.RpcContext;

/**
 * Parameters are resolved before the test method is intercepted, so the
 * extension hands out this delegate and binds the real runtime around the
 * invocation.
 */
final class BoundRuntime implements DistributedRuntime
{
    private volatile DistributedRuntime delegate;

    void bind(DistributedRuntime runtime) {
        this.delegate = runtime;
    }

    void unbind() {
        this.delegate = null;
    }

    private DistributedRuntime delegate()
    {
        DistributedRuntime d = delegate;
        if (d == null) {
            throw new IllegalStateException("Distributed runtime is only available while the test method runs");
        }
        return d;
    }

    @Override
    public RendezvousDescriptor descriptor() {
        return delegate().descriptor();
    }

    @Override
    public CommunicationContext communication() {
        return delegate().communication();
    }

    @Override
    public RpcContext rpc() {
        return delegate().rpc();
    }
}
