package com.questrail.disttest.harness;

import com.questrail.disttest.config.HarnessConfig;
import com.questrail.disttest.config.RpcBackend;
import com.questrail.disttest.error.BackendMismatchException;
import com.questrail.disttest.error.RendezvousException;
import com.questrail.disttest.observability.NullObservabilitySink;
import com.questrail.disttest.observability.RecordingObservabilitySink;
import com.questrail.disttest.rpc.WorkerInfo;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Two workers, each with its own harness as a separate process would have,
 * meeting on one rendezvous file.
 */
class TwoWorkerRendezvousTest {

    @TempDir
    Path dir;

    private final ExecutorService pool = Executors.newFixedThreadPool(2);

    @AfterEach
    void shutdownPool() {
        pool.shutdownNow();
    }

    private static HarnessConfig config(RpcBackend backend) {
        return HarnessConfig.builder()
                .withBackend(backend)
                .withRendezvousTimeout(Duration.ofSeconds(20))
                .withJoinTimeout(Duration.ofSeconds(20))
                .withPollInterval(Duration.ofMillis(5))
                .build();
    }

    @ParameterizedTest
    @EnumSource(RpcBackend.class)
    void bothRanksRunTheBodyAndTearDown(RpcBackend backend) throws Exception {
        Path file = dir.resolve("rdzv-" + backend);
        Set<Integer> ranSeen = ConcurrentHashMap.newKeySet();

        List<Future<List<String>>> ranks = new ArrayList<>();
        for (int r = 0; r < 2; r++) {
            int rank = r;
            ranks.add(pool.submit(() -> DistributedTestHarnessFactory
                    .newFileHarness(config(backend), new RecordingObservabilitySink())
                    .run(rank, 2, file, ctx -> {
                        ranSeen.add(ctx.rank());
                        assertEquals(backend, ctx.runtime().rpc().backend());
                        return workerNames(ctx.runtime().rpc().workers());
                    })));
        }

        for (Future<List<String>> rank : ranks) {
            assertEquals(List.of("worker0", "worker1"), rank.get(60, TimeUnit.SECONDS));
        }
        assertEquals(Set.of(0, 1), ranSeen);
        assertFalse(Files.exists(file), "rendezvous file is removed once both workers leave");
    }

    @Test
    void backendDisagreementFailsBeforeEitherBodyRuns() {
        Path file = dir.resolve("mixed");
        Set<Integer> ranSeen = ConcurrentHashMap.newKeySet();

        Future<Boolean> r0 = pool.submit(() -> DistributedTestHarnessFactory
                .newFileHarness(config(RpcBackend.PROCESS_GROUP), NullObservabilitySink.INSTANCE)
                .run(0, 2, file, ctx -> ranSeen.add(0)));
        Future<Boolean> r1 = pool.submit(() -> DistributedTestHarnessFactory
                .newFileHarness(config(RpcBackend.DATAGRAM), NullObservabilitySink.INSTANCE)
                .run(1, 2, file, ctx -> ranSeen.add(1)));

        for (Future<Boolean> rank : List.of(r0, r1)) {
            ExecutionException e = assertThrows(ExecutionException.class, () -> rank.get(60, TimeUnit.SECONDS));
            assertInstanceOf(BackendMismatchException.class, e.getCause());
        }
        assertTrue(ranSeen.isEmpty());
    }

    @Test
    void runAfterATimedOutAttemptOnTheSamePathSucceeds() throws Exception {
        Path file = dir.resolve("retried");
        HarnessConfig impatient = HarnessConfig.builder()
                .withRendezvousTimeout(Duration.ofMillis(200))
                .withPollInterval(Duration.ofMillis(5))
                .build();

        assertThrows(RendezvousException.class, () -> DistributedTestHarnessFactory
                .newFileHarness(impatient, NullObservabilitySink.INSTANCE)
                .run(0, 2, file, ctx -> null));

        Future<Integer> r0 = pool.submit(() -> DistributedTestHarnessFactory
                .newFileHarness(config(RpcBackend.PROCESS_GROUP), NullObservabilitySink.INSTANCE)
                .run(0, 2, file, ctx -> ctx.rank()));
        Future<Integer> r1 = pool.submit(() -> DistributedTestHarnessFactory
                .newFileHarness(config(RpcBackend.PROCESS_GROUP), NullObservabilitySink.INSTANCE)
                .run(1, 2, file, ctx -> ctx.rank()));

        assertEquals(0, r0.get(60, TimeUnit.SECONDS));
        assertEquals(1, r1.get(60, TimeUnit.SECONDS));
        assertFalse(Files.exists(file));
    }

    @Test
    void unboundedTimeoutsFromTheEnvironmentStillRun() throws Exception {
        HarnessConfig config = HarnessConfig.fromEnvironment(Map.of(
                HarnessConfig.ENV_RENDEZVOUS_TIMEOUT_MS, Long.toString(Long.MAX_VALUE),
                HarnessConfig.ENV_JOIN_TIMEOUT_MS, Long.toString(Long.MAX_VALUE)));

        String name = DistributedTestHarnessFactory.newFileHarness(config, NullObservabilitySink.INSTANCE)
                .run(0, 1, dir.resolve("patient"), ctx -> ctx.runtime().selfName());

        assertEquals("worker0", name);
    }

    private static List<String> workerNames(List<WorkerInfo> workers) {
        List<String> names = new ArrayList<>();
        for (WorkerInfo worker : workers) {
            names.add(worker.name());
        }
        return names;
    }
}
