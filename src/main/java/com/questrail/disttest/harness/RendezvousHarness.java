package com.questrail.disttest.harness;

import com.questrail.disttest.api.TestBody;
import com.questrail.disttest.api.TestContext;
import com.questrail.disttest.api.TestIdentity;
import com.questrail.disttest.comm.CommunicationContext;
import com.questrail.disttest.comm.CommunicationTransport;
import com.questrail.disttest.config.HarnessConfig;
import com.questrail.disttest.config.RendezvousDescriptor;
import com.questrail.disttest.error.ConfigurationException;
import com.questrail.disttest.error.DistributedTestException;
import com.questrail.disttest.error.RendezvousException;
import com.questrail.disttest.error.TeardownException;
import com.questrail.disttest.observability.HarnessErrorEvent;
import com.questrail.disttest.observability.HarnessLifecycleEvent;
import com.questrail.disttest.observability.HarnessLifecycleEvent.Phase;
import com.questrail.disttest.observability.HarnessObservabilitySink;
import com.questrail.disttest.rpc.RpcContext;
import com.questrail.disttest.rpc.RpcLayer;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * RendezvousHarness
 * =============================================================================
 * Wraps a test body so that every invocation runs inside a freshly
 * established distributed runtime shared by all participating processes.
 *
 * <h2>Per-invocation sequence</h2>
 * <pre>
 *   validate identity and rendezvous file         (ConfigurationException, no I/O)
 *     → descriptor file://&lt;path&gt;?rank=&lt;r&gt;&amp;world_size=&lt;n&gt;
 *       → CommunicationTransport.initCommunicationContext   (collective)
 *         → RpcLayer.initRpcContext("worker" + rank, ...)    (collective)
 *           → test body
 *         → RpcLayer.closeRpcContext       always, exactly once
 *       → CommunicationContext.close       always
 * </pre>
 *
 * <h2>Outcome</h2>
 * Exactly one outcome per invocation:
 * <ul>
 *   <li>init failure: thrown as is; the body never runs and no RPC teardown is
 *       attempted. If the RPC context failed, the communication context that
 *       was already up is closed.</li>
 *   <li>body failure: thrown as is after teardown; teardown failures are
 *       attached as suppressed exceptions.</li>
 *   <li>body success with teardown failure: {@link TeardownException}.</li>
 * </ul>
 *
 * <h2>Ownership</h2>
 * One harness instance stands for one process's distributed runtime. The
 * contexts it creates are process-wide singletons for the duration of the
 * call, so overlapping invocations on the same instance are rejected.
 */
public final class RendezvousHarness
{
    private final HarnessConfig config;
    private final CommunicationTransport transport;
    private final RpcLayer rpcLayer;
    private final HarnessObservabilitySink sink;

    private final AtomicBoolean active = new AtomicBoolean();

    public RendezvousHarness(HarnessConfig config,
                             CommunicationTransport transport,
                             RpcLayer rpcLayer,
                             HarnessObservabilitySink sink)
    {
        this.config = Objects.requireNonNull(config, "config");
        this.transport = Objects.requireNonNull(transport, "transport");
        this.rpcLayer = Objects.requireNonNull(rpcLayer, "rpcLayer");
        this.sink = Objects.requireNonNull(sink, "sink");
    }

    public HarnessConfig config() {
        return config;
    }

    /**
     * Returns a body of the same shape that performs the full lifecycle around
     * {@code body} each time it is run.
     */
    public <R> TestBody<R> wrap(TestBody<R> body)
    {
        Objects.requireNonNull(body, "body");
        return context -> run(context, body);
    }

    /**
     * Convenience entry point for runners that hold raw values.
     *
     * @throws ConfigurationException if {@code 0 <= rank < worldSize} does not
     *         hold; no transport call is made
     */
    public <R> R run(int rank, int worldSize, Path rendezvousFile, TestBody<R> body) throws Exception
    {
        return run(TestContext.of(new TestIdentity(rank, worldSize), rendezvousFile), body);
    }

    public <R> R run(TestContext context, TestBody<R> body) throws Exception
    {
        Objects.requireNonNull(context, "context");
        Objects.requireNonNull(body, "body");

        RendezvousDescriptor descriptor = describe(context);

        if (!active.compareAndSet(false, true)) {
            throw new IllegalStateException("A distributed test is already running on this harness; "
                    + "run one test per process at a time");
        }
        try {
            return runExclusive(context, descriptor, body);
        } finally {
            active.set(false);
        }
    }

    private <R> R runExclusive(TestContext context, RendezvousDescriptor descriptor, TestBody<R> body) throws Exception
    {
        String url = descriptor.toUrl();
        int rank = descriptor.rank();

        emit(Phase.COMMUNICATION_INIT_STARTED, descriptor);
        CommunicationContext comm;
        try {
            comm = transport.initCommunicationContext(url, config.transportKind());
        } catch (RuntimeException e) {
            throw initFailure(rank, "Communication context init failed", e);
        }
        emit(Phase.COMMUNICATION_READY, descriptor);

        emit(Phase.RPC_INIT_STARTED, descriptor);
        RpcContext rpc;
        try {
            rpc = rpcLayer.initRpcContext(context.identity().workerName(), config.backend(), rank, url);
        } catch (RuntimeException e) {
            DistributedTestException failure = initFailure(rank, "RPC context init failed", e);
            closeCommunication(comm, descriptor, failure);
            throw failure;
        }
        emit(Phase.RPC_READY, descriptor);

        DistributedRuntimeHandle handle = new DistributedRuntimeHandle(descriptor, comm, rpc);
        R result;
        try {
            emit(Phase.BODY_STARTED, descriptor);
            result = body.run(context.withRuntime(handle));
        } catch (Throwable primary) {
            emit(Phase.BODY_FAILED, descriptor);
            teardown(handle, primary);
            throw primary;
        }
        emit(Phase.BODY_PASSED, descriptor);

        teardown(handle, null);
        return result;
    }

    // -------------------------------------------------------------------------
    // Validation
    // -------------------------------------------------------------------------

    private static RendezvousDescriptor describe(TestContext context)
    {
        Path file = context.rendezvousFile();
        if (!file.isAbsolute()) {
            throw new ConfigurationException("Rendezvous file must be an absolute path visible to every rank: " + file);
        }
        String path = file.toString();
        if (path.indexOf('?') >= 0 || path.indexOf('&') >= 0) {
            throw new ConfigurationException("Rendezvous file path must not contain '?' or '&': " + file);
        }
        Path parent = file.getParent();
        if (parent == null || !Files.isDirectory(parent)) {
            throw new ConfigurationException("Rendezvous file directory does not exist: " + parent);
        }
        return new RendezvousDescriptor(path, context.rank(), context.worldSize());
    }

    // -------------------------------------------------------------------------
    // Teardown
    // -------------------------------------------------------------------------

    /**
     * Close RPC then communication. With a primary failure, teardown problems
     * are attached to it; otherwise the first one is thrown.
     */
    private void teardown(DistributedRuntimeHandle handle, Throwable primary)
    {
        RendezvousDescriptor descriptor = handle.descriptor();
        TeardownException failure = null;

        try {
            rpcLayer.closeRpcContext(handle.rpc());
            emit(Phase.RPC_CLOSED, descriptor);
        } catch (RuntimeException e) {
            failure = e instanceof TeardownException t
                    ? t
                    : new TeardownException("RPC context close failed: " + e.getMessage(), e);
        }

        try {
            handle.communication().close();
            emit(Phase.COMMUNICATION_CLOSED, descriptor);
        } catch (RuntimeException e) {
            if (failure == null) {
                failure = new TeardownException("Communication context close failed: " + e.getMessage(), e);
            }
            else {
                failure.addSuppressed(e);
            }
        }

        if (failure == null) {
            return;
        }
        if (primary != null) {
            sink.onError(new HarnessErrorEvent(Instant.now(), descriptor.rank(), failure.getMessage(), failure, true));
            primary.addSuppressed(failure);
            return;
        }
        sink.onError(new HarnessErrorEvent(Instant.now(), descriptor.rank(), failure.getMessage(), failure, false));
        throw failure;
    }

    private void closeCommunication(CommunicationContext comm, RendezvousDescriptor descriptor, Throwable primary)
    {
        try {
            comm.close();
            emit(Phase.COMMUNICATION_CLOSED, descriptor);
        } catch (RuntimeException e) {
            sink.onError(new HarnessErrorEvent(Instant.now(), descriptor.rank(),
                    "Communication context close failed after RPC init failure", e, true));
            primary.addSuppressed(e);
        }
    }

    private DistributedTestException initFailure(int rank, String message, RuntimeException cause)
    {
        DistributedTestException failure = cause instanceof DistributedTestException d
                ? d
                : new RendezvousException(message + ": " + cause.getMessage(), cause);
        sink.onError(new HarnessErrorEvent(Instant.now(), rank, message, failure, false));
        return failure;
    }

    private void emit(Phase phase, RendezvousDescriptor descriptor)
    {
        sink.onLifecycle(new HarnessLifecycleEvent(
                Instant.now(), phase, descriptor.rank(), descriptor.worldSize(), descriptor.toUrl()));
    }
}
