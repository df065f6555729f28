package com.questrail.disttest.api;

import java.nio.file.Path;
import java.util.Objects;
import java.util.Optional;

/**
 * Per-invocation input supplied by the runner: identity plus the shared
 * rendezvous file every participant can reach.
 *
 * <p>The runner builds a context without a runtime. The harness passes the
 * body a copy that also carries the initialized {@link DistributedRuntime}.</p>
 */
public final class TestContext
{
    private final TestIdentity identity;
    private final Path rendezvousFile;
    private final DistributedRuntime runtime;

    private TestContext(TestIdentity identity, Path rendezvousFile, DistributedRuntime runtime) {
        this.identity = Objects.requireNonNull(identity, "identity");
        this.rendezvousFile = Objects.requireNonNull(rendezvousFile, "rendezvousFile");
        this.runtime = runtime;
    }

    public static TestContext of(TestIdentity identity, Path rendezvousFile) {
        return new TestContext(identity, rendezvousFile, null);
    }

    public static TestContext of(int rank, int worldSize, Path rendezvousFile) {
        return of(new TestIdentity(rank, worldSize), rendezvousFile);
    }

    public TestContext withRuntime(DistributedRuntime runtime) {
        return new TestContext(identity, rendezvousFile, Objects.requireNonNull(runtime, "runtime"));
    }

    public TestIdentity identity() {
        return identity;
    }

    public int rank() {
        return identity.rank();
    }

    public int worldSize() {
        return identity.worldSize();
    }

    /**
     * Same value as {@link #rank()}; kept for bodies that address peers by worker id.
     */
    public int workerId() {
        return identity.rank();
    }

    public Path rendezvousFile() {
        return rendezvousFile;
    }

    public Optional<DistributedRuntime> runtimeIfInitialized() {
        return Optional.ofNullable(runtime);
    }

    /**
     * @throws IllegalStateException when called outside a harness invocation
     */
    public DistributedRuntime runtime() {
        if (runtime == null) {
            throw new IllegalStateException("Distributed runtime is not initialized for " + this);
        }
        return runtime;
    }

    @Override
    public String toString() {
        return "TestContext[rank=" + rank() + ", worldSize=" + worldSize()
                + ", rendezvousFile=" + rendezvousFile + ", initialized=" + (runtime != null) + "]";
    }
}
