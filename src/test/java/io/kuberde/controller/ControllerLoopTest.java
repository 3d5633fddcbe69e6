package io.kuberde.controller;

import io.kuberde.MutableClock;
import io.kuberde.config.ControllerConfig;
import io.kuberde.model.RouteKind;
import io.kuberde.observability.AuditLogger;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

final class ControllerLoopTest {
    private final MutableClock clock = new MutableClock(ReconcilerTest.START);
    private final InMemoryClusterClient cluster = new InMemoryClusterClient();
    private final InMemoryRelayApi relay = new InMemoryRelayApi();
    private final ExecutorService workers = Executors.newFixedThreadPool(2);
    private Path tempDir;
    private ControllerLoop loop;

    @BeforeEach
    void setUp() throws IOException {
        tempDir = Files.createTempDirectory("kuberde-loop-test");
        ControllerConfig config = ReconcilerTest.testConfig(tempDir);
        Reconciler reconciler = new Reconciler(cluster, relay, new StatusWriter(cluster, 3, config.statusBackoff()),
                new WorkloadValidator(config.defaultTtl()), config,
                new AuditLogger(config.auditFile(), "controller", config.auditSigningSecret(), clock), clock);
        loop = new ControllerLoop(cluster, reconciler, ReconcilerTest.NAMESPACE, workers);
    }

    @AfterEach
    void tearDown() throws IOException {
        workers.shutdownNow();
        ReconcilerTest.deleteRecursively(tempDir);
    }

    @Test
    void failingWorkloadDoesNotStopTheOthers() throws Exception {
        cluster.put(ReconcilerTest.workload("8h", ReconcilerTest.ideServices()));
        AgentWorkload template = ReconcilerTest.workload("8h", List.of(new AgentWorkload.ServiceDecl("ide", 3000, "http", null)));
        cluster.put(new AgentWorkload(ReconcilerTest.NAMESPACE, "build", "uid-2", "1", 1L, template.creationTimestamp(),
                null, List.of(), template.spec(), null));
        relay.failRegistration(RouteKind.HTTP, "ide.user-alice-build");

        Assertions.assertFalse(loop.ready());
        Assertions.assertEquals(1, loop.runOnce());
        Assertions.assertTrue(loop.ready());
        Assertions.assertEquals(1L, loop.ticks());
        Assertions.assertEquals(1L, loop.failures());
        Assertions.assertNotNull(relay.route(RouteKind.TCP, "30022"));
        Assertions.assertNull(relay.route(RouteKind.HTTP, "ide.user-alice-build"));
    }

    @Test
    void listingFailureKeepsTheLoopAliveAndUnready() {
        cluster.failListing(new ClusterApiException(503, "api server unavailable"));
        loop.tick();
        loop.tick();
        Assertions.assertFalse(loop.ready());
        Assertions.assertEquals(0L, loop.ticks());
    }

    @Test
    void emptyNamespaceIsReady() throws Exception {
        Assertions.assertEquals(0, loop.runOnce());
        Assertions.assertTrue(loop.ready());
    }
}
