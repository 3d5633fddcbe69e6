package io.kuberde.controller;

import io.kuberde.MutableClock;
import io.kuberde.config.ControllerConfig;
import io.kuberde.model.RouteKind;
import io.kuberde.observability.AuditLogger;
import io.kuberde.util.Hashing;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.stream.Stream;

final class ReconcilerTest {
    static final String NAMESPACE = "kuberde";
    static final String IDENTITY = "user-alice-dev";
    static final Instant START = Instant.parse("2025-03-01T10:00:00Z");
    static final Instant CREATED = START.minus(Duration.ofMinutes(10));

    private final MutableClock clock = new MutableClock(START);
    private final InMemoryClusterClient cluster = new InMemoryClusterClient();
    private final InMemoryRelayApi relay = new InMemoryRelayApi();
    private Path tempDir;
    private Reconciler reconciler;

    @BeforeEach
    void setUp() throws IOException {
        tempDir = Files.createTempDirectory("kuberde-reconciler-test");
        ControllerConfig config = testConfig(tempDir);
        reconciler = new Reconciler(
                cluster,
                relay,
                new StatusWriter(cluster, 3, config.statusBackoff()),
                new WorkloadValidator(config.defaultTtl()),
                config,
                new AuditLogger(config.auditFile(), "controller", config.auditSigningSecret(), clock),
                clock
        );
    }

    @AfterEach
    void tearDown() throws IOException {
        deleteRecursively(tempDir);
    }

    @Test
    void newWorkloadGetsFinalizerDeploymentAndRoutes() throws Exception {
        cluster.put(workload("8h", ideServices()));
        Reconciler.Outcome outcome = reconciler.reconcile(current());

        Assertions.assertEquals(WorkloadPhase.RECONCILING, outcome.phase());
        Assertions.assertEquals(List.of(
                "finalizer added",
                "deployment created",
                "route tcp:30022 registered",
                "route http:ide.user-alice-dev registered"
        ), outcome.actions());
        Assertions.assertEquals(1, cluster.deployment(NAMESPACE, IDENTITY).replicas());
        Assertions.assertEquals("user-alice-dev-ssh", relay.route(RouteKind.TCP, "30022").agentId());
        Assertions.assertEquals("user-alice-dev-ide", relay.route(RouteKind.HTTP, "ide.user-alice-dev").agentId());

        AgentWorkload stored = current();
        Assertions.assertTrue(stored.hasFinalizer(Reconciler.FINALIZER));
        Assertions.assertEquals(WorkloadPhase.RECONCILING, stored.status().phase());
        Assertions.assertEquals(List.of("tcp:30022", "http:ide.user-alice-dev"), stored.status().routes());
        Assertions.assertEquals(CREATED, stored.status().lastActivity());
        Assertions.assertEquals(1L, stored.status().observedGeneration());
    }

    @Test
    void steadyStatePassIssuesNoChanges() throws Exception {
        cluster.put(workload("8h", ideServices()));
        reconciler.reconcile(current());
        relay.online(IDENTITY, START);
        Reconciler.Outcome ready = reconciler.reconcile(current());
        Assertions.assertEquals(WorkloadPhase.READY, ready.phase());

        cluster.clearCalls();
        relay.clearCalls();
        Reconciler.Outcome again = reconciler.reconcile(current());
        Assertions.assertEquals(WorkloadPhase.READY, again.phase());
        Assertions.assertTrue(again.actions().isEmpty());
        Assertions.assertTrue(relay.calls().isEmpty());
        Assertions.assertTrue(cluster.calls().isEmpty());
    }

    @Test
    void reportedActivityMovesLastActivityForward() throws Exception {
        cluster.put(workload("8h", ideServices()));
        Instant seen = START.minusSeconds(5);
        relay.online(IDENTITY, seen);
        reconciler.reconcile(current());
        Assertions.assertEquals(seen, current().status().lastActivity());

        relay.online(IDENTITY, START.minus(Duration.ofHours(1)));
        reconciler.reconcile(current());
        Assertions.assertEquals(seen, current().status().lastActivity());
    }

    @Test
    void idleWorkloadParksRoutesBeforeScalingToZero() throws Exception {
        cluster.put(workload("1h", ideServices()));
        reconciler.reconcile(current());
        relay.clearCalls();
        cluster.clearCalls();

        clock.advance(Duration.ofHours(2));
        Reconciler.Outcome outcome = reconciler.reconcile(current());

        Assertions.assertEquals(WorkloadPhase.IDLE, outcome.phase());
        Assertions.assertEquals(List.of("park tcp:30022", "park http:ide.user-alice-dev"), relay.calls());
        Assertions.assertEquals(0, cluster.deployment(NAMESPACE, IDENTITY).replicas());
        Assertions.assertTrue(outcome.actions().contains("scaled to 0"));
        Assertions.assertTrue(relay.route(RouteKind.TCP, "30022").parked());
        Assertions.assertEquals(0, current().status().replicas());

        relay.clearCalls();
        Assertions.assertEquals(WorkloadPhase.IDLE, reconciler.reconcile(current()).phase());
        Assertions.assertTrue(relay.calls().isEmpty());
    }

    @Test
    void wakeScalesUpAndReactivatesParkedRoutes() throws Exception {
        cluster.put(workload("1h", ideServices()));
        reconciler.reconcile(current());
        clock.advance(Duration.ofHours(2));
        reconciler.reconcile(current());
        relay.clearCalls();

        Reconciler.Outcome outcome = reconciler.wake(current());
        Assertions.assertEquals(WorkloadPhase.RECONCILING, outcome.phase());
        Assertions.assertEquals(1, cluster.deployment(NAMESPACE, IDENTITY).replicas());
        Assertions.assertFalse(relay.route(RouteKind.TCP, "30022").parked());
        Assertions.assertFalse(relay.route(RouteKind.HTTP, "ide.user-alice-dev").parked());
        Assertions.assertEquals(clock.instant(), current().status().lastActivity());

        Assertions.assertEquals(WorkloadPhase.RECONCILING, reconciler.reconcile(current()).phase());
        Assertions.assertEquals(1, cluster.deployment(NAMESPACE, IDENTITY).replicas());
    }

    @Test
    void zeroTtlNeverIdles() throws Exception {
        cluster.put(workload("0", ideServices()));
        reconciler.reconcile(current());
        clock.advance(Duration.ofDays(30));
        Assertions.assertEquals(WorkloadPhase.RECONCILING, reconciler.reconcile(current()).phase());
        Assertions.assertEquals(1, cluster.deployment(NAMESPACE, IDENTITY).replicas());
    }

    @Test
    void invalidWorkloadIsMarkedErrorOnce() throws Exception {
        AgentWorkload invalid = workload("8h", ideServices());
        invalid = new AgentWorkload(NAMESPACE, "dev", "uid-1", "1", 1L, CREATED, null, List.of(),
                new AgentWorkload.Spec("", invalid.spec().serverUrl(), invalid.spec().services(), invalid.spec().workloadContainer(),
                        "8h", "alice-agent-credentials"), null);
        cluster.put(invalid);

        Reconciler.Outcome outcome = reconciler.reconcile(current());
        Assertions.assertEquals(WorkloadPhase.ERROR, outcome.phase());
        Assertions.assertTrue(outcome.message().contains("spec.owner is required"), outcome.message());
        Assertions.assertNull(cluster.deployment(NAMESPACE, "dev"));
        Assertions.assertEquals(0, relay.size());
        Assertions.assertEquals(WorkloadPhase.ERROR, current().status().phase());

        cluster.clearCalls();
        reconciler.reconcile(current());
        Assertions.assertTrue(cluster.calls().isEmpty());
    }

    @Test
    void deletionRemovesRoutesDeploymentAndFinalizer() throws Exception {
        cluster.put(workload("8h", ideServices()));
        reconciler.reconcile(current());
        cluster.markDeleting(NAMESPACE, "dev", START);

        Reconciler.Outcome outcome = reconciler.reconcile(current());
        Assertions.assertEquals(WorkloadPhase.DELETED, outcome.phase());
        Assertions.assertEquals(0, relay.size());
        Assertions.assertNull(cluster.deployment(NAMESPACE, IDENTITY));
        Assertions.assertNull(cluster.get(NAMESPACE, "dev"));
        Assertions.assertTrue(outcome.actions().contains("deployment deleted"));
    }

    @Test
    void conflictingRouteMarksErrorButKeepsOtherRoutes() throws Exception {
        relay.heldByOtherAgent(RouteKind.TCP, "30022");
        cluster.put(workload("8h", ideServices()));

        Reconciler.Outcome outcome = reconciler.reconcile(current());
        Assertions.assertEquals(WorkloadPhase.ERROR, outcome.phase());
        Assertions.assertEquals("route conflict: tcp:30022", outcome.message());
        Assertions.assertNotNull(relay.route(RouteKind.HTTP, "ide.user-alice-dev"));
        Assertions.assertEquals("user-mallory-box-held", relay.route(RouteKind.TCP, "30022").agentId());
        Assertions.assertEquals(1, cluster.deployment(NAMESPACE, IDENTITY).replicas());
    }

    @Test
    void workloadsCollidingOnOnePortDoNotTradeIt() throws Exception {
        cluster.put(workload("8h", ideServices()));
        AgentWorkload box = new AgentWorkload(NAMESPACE, "box", "uid-2", "1", 1L, CREATED, null, List.of(),
                new AgentWorkload.Spec(
                        "bob",
                        "wss://relay.example.com/ws",
                        List.of(new AgentWorkload.ServiceDecl("ssh", 22, "tcp", 30022)),
                        new AgentWorkload.Container("ghcr.io/acme/ide:1.4", List.of(), List.of(), List.of(), List.of()),
                        "8h",
                        "bob-agent-credentials"
                ),
                null);
        cluster.put(box);

        Assertions.assertEquals(WorkloadPhase.RECONCILING, reconciler.reconcile(current()).phase());
        Reconciler.Outcome blocked = reconciler.reconcile(cluster.get(NAMESPACE, "box"));
        Assertions.assertEquals(WorkloadPhase.ERROR, blocked.phase());
        Assertions.assertEquals("route conflict: tcp:30022", blocked.message());

        relay.clearCalls();
        for (int pass = 0; pass < 3; pass++) {
            reconciler.reconcile(current());
            Assertions.assertEquals(WorkloadPhase.ERROR, reconciler.reconcile(cluster.get(NAMESPACE, "box")).phase());
        }
        Assertions.assertEquals("user-alice-dev-ssh", relay.route(RouteKind.TCP, "30022").agentId());
        Assertions.assertFalse(relay.calls().contains("register tcp:30022 -> user-alice-dev-ssh/ssh"), relay.calls().toString());
        Assertions.assertFalse(relay.calls().contains("register tcp:30022 -> user-bob-box-ssh/ssh"), relay.calls().toString());
        Assertions.assertEquals(WorkloadPhase.ERROR, cluster.get(NAMESPACE, "box").status().phase());
        Assertions.assertEquals(List.of("tcp:30022"), current().status().routes());
    }

    @Test
    void removedServiceLosesItsRouteAndReplacesDeployment() throws Exception {
        cluster.put(workload("8h", ideServices()));
        reconciler.reconcile(current());
        AgentWorkload before = current();
        AgentWorkload.Spec spec = before.spec();
        cluster.put(new AgentWorkload(NAMESPACE, "dev", before.uid(), before.resourceVersion(), 2L, CREATED, null,
                before.finalizers(),
                new AgentWorkload.Spec(spec.owner(), spec.serverUrl(), List.of(spec.services().get(0)), spec.workloadContainer(),
                        spec.ttl(), spec.authSecret()),
                before.status()));

        Reconciler.Outcome outcome = reconciler.reconcile(current());
        Assertions.assertTrue(outcome.actions().contains("deployment replaced"), outcome.actions().toString());
        Assertions.assertTrue(outcome.actions().contains("route http:ide.user-alice-dev removed"), outcome.actions().toString());
        Assertions.assertEquals(1, relay.size());
        Assertions.assertEquals(List.of("tcp:30022"), current().status().routes());
        Assertions.assertEquals(2L, current().status().observedGeneration());
    }

    @Test
    void passOnAStaleListedCopyDoesNotUndoAWake() throws Exception {
        cluster.put(workload("1h", ideServices()));
        reconciler.reconcile(current());
        clock.advance(Duration.ofHours(2));
        reconciler.reconcile(current());
        AgentWorkload listedBeforeWake = current();

        reconciler.wake(current());
        Reconciler.Outcome outcome = reconciler.reconcile(listedBeforeWake);
        Assertions.assertEquals(WorkloadPhase.RECONCILING, outcome.phase());
        Assertions.assertEquals(1, cluster.deployment(NAMESPACE, IDENTITY).replicas());
        Assertions.assertFalse(relay.route(RouteKind.TCP, "30022").parked());
    }

    @Test
    void leftoverHttpRouteUnderIdentityIsRemoved() throws Exception {
        relay.seed(new RelayApi.ObservedRoute(RouteKind.HTTP, "old.user-alice-dev", "user-alice-dev-old", "old", false));
        cluster.put(workload("8h", ideServices()));
        Reconciler.Outcome outcome = reconciler.reconcile(current());
        Assertions.assertTrue(outcome.actions().contains("route http:old.user-alice-dev removed"), outcome.actions().toString());
        Assertions.assertNull(relay.route(RouteKind.HTTP, "old.user-alice-dev"));
    }

    @Test
    void tcpServiceWithoutExternalPortGetsStableHashedPort() throws Exception {
        cluster.put(workload("8h", List.of(new AgentWorkload.ServiceDecl("db", 5432, "tcp", null))));
        reconciler.reconcile(current());
        int expected = 30000 + (int) Hashing.stableBucket("user-alice-dev-db", 2768);
        Assertions.assertEquals("user-alice-dev-db", relay.route(RouteKind.TCP, Integer.toString(expected)).agentId());
        Assertions.assertEquals(List.of("tcp:" + expected), current().status().routes());
    }

    @Test
    void unreachableRelayKeepsRecordedActivity() throws Exception {
        cluster.put(workload("8h", ideServices()));
        reconciler.reconcile(current());
        relay.failActivity(new IOException("relay down"));
        clock.advance(Duration.ofMinutes(5));

        Assertions.assertEquals(WorkloadPhase.RECONCILING, reconciler.reconcile(current()).phase());
        Assertions.assertEquals(CREATED, current().status().lastActivity());
    }

    @Test
    void idleCheckHonoursTtlBoundary() {
        Assertions.assertTrue(Reconciler.isIdle(Duration.ofHours(1), START, START.plus(Duration.ofHours(1))));
        Assertions.assertFalse(Reconciler.isIdle(Duration.ofHours(1), START, START.plus(Duration.ofMinutes(59))));
        Assertions.assertFalse(Reconciler.isIdle(Duration.ZERO, START, START.plus(Duration.ofDays(365))));
    }

    private AgentWorkload current() {
        return cluster.get(NAMESPACE, "dev");
    }

    static List<AgentWorkload.ServiceDecl> ideServices() {
        return List.of(
                new AgentWorkload.ServiceDecl("ssh", 22, "tcp", 30022),
                new AgentWorkload.ServiceDecl("ide", 3000, "http", null)
        );
    }

    static AgentWorkload workload(String ttl, List<AgentWorkload.ServiceDecl> services) {
        return new AgentWorkload(NAMESPACE, "dev", "uid-1", "1", 1L, CREATED, null, List.of(),
                new AgentWorkload.Spec(
                        "alice",
                        "wss://relay.example.com/ws",
                        services,
                        new AgentWorkload.Container("ghcr.io/acme/ide:1.4", List.of(), List.of(), List.of(3000),
                                List.of(new AgentWorkload.EnvVar("EDITOR", "vim"))),
                        ttl,
                        "alice-agent-credentials"
                ),
                null);
    }

    static ControllerConfig testConfig(Path dataRoot) {
        return new ControllerConfig(
                NAMESPACE,
                "http://relay.test:8090",
                "127.0.0.1",
                0,
                Duration.ofMillis(100),
                2,
                30000,
                2768,
                "kuberde/agent:test",
                Duration.ofHours(8),
                dataRoot,
                "test-secret"
        );
    }

    static void deleteRecursively(Path root) throws IOException {
        if (root == null || !Files.exists(root)) {
            return;
        }
        try (Stream<Path> walk = Files.walk(root)) {
            for (Path path : walk.sorted((a, b) -> Integer.compare(b.getNameCount(), a.getNameCount())).toList()) {
                Files.deleteIfExists(path);
            }
        }
    }
}
