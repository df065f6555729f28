package com.questrail.disttest.harness;

import com.questrail.disttest.comm.FileCommunicationTransport;
import com.questrail.disttest.config.HarnessConfig;
import com.questrail.disttest.observability.HarnessObservabilitySink;
import com.questrail.disttest.observability.Slf4jHarnessObservabilitySink;
import com.questrail.disttest.rpc.DefaultRpcLayer;
import com.questrail.disttest.time.MonotonicClock;
import com.questrail.disttest.time.SystemMonotonicClock;
import com.questrail.disttest.transport.udp.netty.NettyUdpDatagramEndpoint;

import java.net.InetAddress;
import java.net.InetSocketAddress;

/**
 * DistributedTestHarnessFactory
 * -----------------------------------------------------------------------------
 * Centralized construction point for rendezvous harnesses.
 *
 * <p>Keeps wiring decisions in one place so that runners and tests never bind
 * to a concrete transport or RPC layer. Create one harness per process.</p>
 */
public final class DistributedTestHarnessFactory
{
    private DistributedTestHarnessFactory() {}

    /**
     * Harness configured from {@code RPC_BACKEND} and the other environment
     * overrides, read once here.
     */
    public static RendezvousHarness fromEnvironment()
    {
        return newFileHarness(HarnessConfig.fromSystemEnvironment());
    }

    public static RendezvousHarness newFileHarness(HarnessConfig config)
    {
        return newFileHarness(config, new Slf4jHarnessObservabilitySink());
    }

    /**
     * File-backed communication transport plus the default RPC layer; the
     * {@code DATAGRAM} backend binds Netty UDP endpoints on loopback.
     */
    public static RendezvousHarness newFileHarness(HarnessConfig config, HarnessObservabilitySink sink)
    {
        MonotonicClock clock = SystemMonotonicClock.INSTANCE;
        FileCommunicationTransport transport = new FileCommunicationTransport(config, clock);
        DefaultRpcLayer rpcLayer = new DefaultRpcLayer(
                config,
                clock,
                transport::activeContext,
                NettyUdpDatagramEndpoint::new,
                () -> new InetSocketAddress(InetAddress.getLoopbackAddress(), 0));
        return new RendezvousHarness(config, transport, rpcLayer, sink);
    }
}
