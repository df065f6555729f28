package com.questrail.disttest.harness;

import com.questrail.disttest.api.DistributedRuntime;
import com.questrail.disttest.comm.CommunicationContext;
import com.questrail.disttest.config.RendezvousDescriptor;
import com.questrail.disttest.rpc.RpcContext;

import java.util.Objects;

/**
 * The single owned runtime object the harness creates per invocation and
 * passes to the test body.
 */
public record DistributedRuntimeHandle(
    RendezvousDescriptor descriptor,
    CommunicationContext communication,
    RpcContext rpc
) implements DistributedRuntime {
    public DistributedRuntimeHandle {
        Objects.requireNonNull(descriptor, "descriptor");
        Objects.requireNonNull(communication, "communication");
        Objects.requireNonNull(rpc, "rpc");
    }
}
