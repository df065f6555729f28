package com.questrail.disttest.rpc;

import com.questrail.disttest.comm.CommunicationContext;
import com.questrail.disttest.comm.FileCommunicationTransport;
import com.questrail.disttest.config.HarnessConfig;
import com.questrail.disttest.config.RendezvousDescriptor;
import com.questrail.disttest.config.RpcBackend;
import com.questrail.disttest.error.BackendMismatchException;
import com.questrail.disttest.error.ConfigurationException;
import com.questrail.disttest.error.RendezvousException;
import com.questrail.disttest.error.TeardownException;
import com.questrail.disttest.time.SystemMonotonicClock;
import com.questrail.disttest.transport.FakeDatagramEndpoint;
import com.questrail.disttest.transport.udp.netty.NettyUdpDatagramEndpoint;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

import static org.junit.jupiter.api.Assertions.*;

class DefaultRpcLayerTest {

    private static final HarnessConfig CONFIG = HarnessConfig.builder()
            .withRendezvousTimeout(Duration.ofSeconds(10))
            .withJoinTimeout(Duration.ofSeconds(10))
            .withPollInterval(Duration.ofMillis(5))
            .build();

    @TempDir
    Path dir;

    private final ExecutorService pool = Executors.newCachedThreadPool();

    @AfterEach
    void shutdownPool() {
        pool.shutdownNow();
    }

    private <T> CompletableFuture<T> supplyOnPool(Supplier<T> task) {
        return CompletableFuture.supplyAsync(task, pool);
    }

    private CompletableFuture<Void> runOnPool(Runnable task) {
        return CompletableFuture.runAsync(task, pool);
    }

    /**
     * One process's stack: its own transport and RPC layer on a shared file.
     */
    private static final class Worker {
        final FileCommunicationTransport transport =
                new FileCommunicationTransport(CONFIG, SystemMonotonicClock.INSTANCE);
        final DefaultRpcLayer rpc = new DefaultRpcLayer(CONFIG, SystemMonotonicClock.INSTANCE,
                transport::activeContext,
                NettyUdpDatagramEndpoint::new,
                () -> new InetSocketAddress(InetAddress.getLoopbackAddress(), 0));
    }

    private String url(String name, int rank, int worldSize) {
        return new RendezvousDescriptor(dir.resolve(name).toString(), rank, worldSize).toUrl();
    }

    @Test
    void rpcInitWithoutCommunicationContextFails() {
        Worker worker = new Worker();

        assertThrows(RendezvousException.class,
                () -> worker.rpc.initRpcContext("worker0", RpcBackend.PROCESS_GROUP, 0, url("none", 0, 1)));
    }

    @Test
    void invalidNamesAndMismatchedRanksAreRejectedBeforeAnyStoreAccess() {
        Worker worker = new Worker();

        assertThrows(ConfigurationException.class,
                () -> worker.rpc.initRpcContext(" ", RpcBackend.PROCESS_GROUP, 0, url("n", 0, 1)));
        assertThrows(ConfigurationException.class,
                () -> worker.rpc.initRpcContext("a|b", RpcBackend.PROCESS_GROUP, 0, url("n", 0, 1)));
        assertThrows(RendezvousException.class,
                () -> worker.rpc.initRpcContext("worker1", RpcBackend.PROCESS_GROUP, 1, url("n", 0, 2)));
    }

    @Test
    void singleWorkerLifecycle() {
        Worker worker = new Worker();
        String url = url("solo", 0, 1);
        CommunicationContext comm = worker.transport.initCommunicationContext(url, "file");

        RpcContext rpc = worker.rpc.initRpcContext("worker0", RpcBackend.PROCESS_GROUP, 0, url);

        assertEquals("worker0", rpc.selfName());
        assertEquals(List.of(new WorkerInfo("worker0", 0, null)), rpc.workers());
        assertTrue(rpc.workerInfo("worker0").isPresent());
        assertTrue(rpc.workerInfo("worker0").get().datagramAddress().isEmpty());

        worker.rpc.closeRpcContext(rpc);
        assertTrue(rpc.isClosed());
        assertThrows(TeardownException.class, () -> worker.rpc.closeRpcContext(rpc));
        comm.close();
    }

    @Test
    void closeAfterCommunicationContextIsGoneFails() {
        Worker worker = new Worker();
        String url = url("early", 0, 1);
        CommunicationContext comm = worker.transport.initCommunicationContext(url, "file");
        RpcContext rpc = worker.rpc.initRpcContext("worker0", RpcBackend.PROCESS_GROUP, 0, url);

        comm.close();

        assertThrows(TeardownException.class, () -> worker.rpc.closeRpcContext(rpc));
    }

    @Test
    void backendDisagreementIsReportedOnEveryRank() throws Exception {
        List<CompletableFuture<RpcContext>> ranks = List.of(
                initAsync(new Worker(), "mixed", 0, RpcBackend.PROCESS_GROUP, "worker0"),
                initAsync(new Worker(), "mixed", 1, RpcBackend.DATAGRAM, "worker1"));

        for (CompletableFuture<RpcContext> rank : ranks) {
            ExecutionException e = assertThrows(ExecutionException.class, () -> rank.get(30, TimeUnit.SECONDS));
            BackendMismatchException mismatch = assertInstanceOf(BackendMismatchException.class, e.getCause());
            assertEquals(Map.of(0, RpcBackend.PROCESS_GROUP, 1, RpcBackend.DATAGRAM), mismatch.backendsByRank());
        }
    }

    @Test
    void duplicateWorkerNamesAreRejected() {
        List<CompletableFuture<RpcContext>> ranks = List.of(
                initAsync(new Worker(), "names", 0, RpcBackend.PROCESS_GROUP, "same"),
                initAsync(new Worker(), "names", 1, RpcBackend.PROCESS_GROUP, "same"));

        for (CompletableFuture<RpcContext> rank : ranks) {
            ExecutionException e = assertThrows(ExecutionException.class, () -> rank.get(30, TimeUnit.SECONDS));
            assertInstanceOf(RendezvousException.class, e.getCause());
        }
    }

    @Test
    void datagramBackendPublishesAndGreetsOverLoopback() throws Exception {
        Worker w0 = new Worker();
        Worker w1 = new Worker();
        CompletableFuture<RpcContext> r0 = initAsync(w0, "udp", 0, RpcBackend.DATAGRAM, "worker0");
        CompletableFuture<RpcContext> r1 = initAsync(w1, "udp", 1, RpcBackend.DATAGRAM, "worker1");

        RpcContext c0 = r0.get(30, TimeUnit.SECONDS);
        RpcContext c1 = r1.get(30, TimeUnit.SECONDS);

        assertEquals(2, c0.workers().size());
        assertTrue(c0.workerInfo("worker1").flatMap(WorkerInfo::datagramAddress).isPresent());
        assertEquals(c0.workers(), c1.workers());

        CompletableFuture<Void> close0 = runOnPool(() -> w0.rpc.closeRpcContext(c0));
        w1.rpc.closeRpcContext(c1);
        close0.get(30, TimeUnit.SECONDS);
    }

    @Test
    void datagramBindFailureStopsTheEndpoint() {
        FileCommunicationTransport transport = new FileCommunicationTransport(CONFIG, SystemMonotonicClock.INSTANCE);
        FakeDatagramEndpoint endpoint = new FakeDatagramEndpoint(new InetSocketAddress("127.0.0.1", 1), true);
        DefaultRpcLayer layer = new DefaultRpcLayer(CONFIG, SystemMonotonicClock.INSTANCE,
                transport::activeContext, address -> endpoint,
                () -> new InetSocketAddress(InetAddress.getLoopbackAddress(), 0));
        String url = url("bind", 0, 1);
        CommunicationContext comm = transport.initCommunicationContext(url, "file");

        assertThrows(RendezvousException.class,
                () -> layer.initRpcContext("worker0", RpcBackend.DATAGRAM, 0, url));
        assertEquals(1, endpoint.stopCalls());
        comm.close();
    }

    private CompletableFuture<RpcContext> initAsync(Worker worker, String file, int rank,
                                                    RpcBackend backend, String name) {
        String url = url(file, rank, 2);
        return supplyOnPool(() -> {
            worker.transport.initCommunicationContext(url, "file");
            return worker.rpc.initRpcContext(name, backend, rank, url);
        });
    }

    @Test
    void concurrentInitOfOneDescriptorOpensExactlyOneContext() throws Exception {
        Worker worker = new Worker();
        String url = url("racing", 0, 1);
        CommunicationContext comm = worker.transport.initCommunicationContext(url, "file");
        CountDownLatch go = new CountDownLatch(1);

        List<CompletableFuture<RpcContext>> attempts = new ArrayList<>();
        for (int i = 0; i < 4; i++) {
            attempts.add(supplyOnPool(() -> {
                awaitQuietly(go);
                return worker.rpc.initRpcContext("worker0", RpcBackend.PROCESS_GROUP, 0, url);
            }));
        }
        go.countDown();

        List<RpcContext> opened = new ArrayList<>();
        for (CompletableFuture<RpcContext> attempt : attempts) {
            try {
                opened.add(attempt.get(30, TimeUnit.SECONDS));
            } catch (ExecutionException e) {
                assertInstanceOf(RendezvousException.class, e.getCause());
            }
        }
        assertEquals(1, opened.size());

        worker.rpc.closeRpcContext(opened.get(0));
        comm.close();
    }

    private static void awaitQuietly(CountDownLatch latch) {
        try {
            latch.await();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException(e);
        }
    }
}
