package io.kuberde.controller;

import io.kuberde.config.ControllerConfig;
import io.kuberde.model.RouteKind;
import io.kuberde.model.ServiceSpec;
import io.kuberde.observability.AuditLogger;
import io.kuberde.util.Hashing;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.UnaryOperator;

/**
 * Drives one {@code RDEAgent} toward its desired state: deployment, relay routes, idle handling
 * and status. Passes for the same workload never overlap; each pass only issues the changes the
 * observed state needs.
 */
public final class Reconciler {
    public static final String FINALIZER = "kuberde.io/routes";

    private final ClusterClient cluster;
    private final RelayApi relay;
    private final StatusWriter statusWriter;
    private final WorkloadValidator validator;
    private final ControllerConfig config;
    private final AuditLogger audit;
    private final Clock clock;
    private final Map<String, ReentrantLock> locks = new ConcurrentHashMap<>();

    public Reconciler(
            ClusterClient cluster,
            RelayApi relay,
            StatusWriter statusWriter,
            WorkloadValidator validator,
            ControllerConfig config,
            AuditLogger audit,
            Clock clock
    ) {
        this.cluster = cluster;
        this.relay = relay;
        this.statusWriter = statusWriter;
        this.validator = validator;
        this.config = config;
        this.audit = audit;
        this.clock = clock;
    }

    public Outcome reconcile(AgentWorkload workload) throws IOException, InterruptedException {
        ReentrantLock lock = locks.computeIfAbsent(workload.displayName(), k -> new ReentrantLock());
        lock.lockInterruptibly();
        try {
            // The listed copy may predate a wake that ran while this pass was queued.
            Optional<AgentWorkload> fresh = cluster.getWorkload(workload.namespace(), workload.name());
            if (fresh.isEmpty()) {
                forget(workload);
                return new Outcome(WorkloadPhase.DELETED, "workload no longer exists", List.of());
            }
            AgentWorkload current = fresh.get();
            if (current.deleting()) {
                return finalizeWorkload(current);
            }
            return reconcileLive(current, false);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Marks the workload active now and reconciles it, which scales it back up and re-activates
     * its parked routes.
     */
    public Outcome wake(AgentWorkload workload) throws IOException, InterruptedException {
        ReentrantLock lock = locks.computeIfAbsent(workload.displayName(), k -> new ReentrantLock());
        lock.lockInterruptibly();
        try {
            Instant now = clock.instant();
            Optional<AgentWorkload> fresh = statusWriter.update(workload,
                    status -> status.withLastActivity(now).withPhase(WorkloadPhase.RECONCILING, "scale-up requested"));
            if (fresh.isEmpty()) {
                return new Outcome(WorkloadPhase.DELETED, "workload no longer exists", List.of());
            }
            return reconcileLive(fresh.get(), true);
        } finally {
            lock.unlock();
        }
    }

    public void forget(AgentWorkload workload) {
        locks.remove(workload.displayName());
    }

    private Outcome reconcileLive(AgentWorkload workload, boolean woken) throws IOException, InterruptedException {
        WorkloadValidator.Validated validated;
        try {
            validated = validator.validate(workload);
        } catch (InvalidResourceException e) {
            writeStatus(workload, status -> status.withPhase(WorkloadPhase.ERROR, e.getMessage())
                    .withObserved(workload.generation(), status.replicas(), status.routes()));
            if (workload.status().phase() != WorkloadPhase.ERROR || !workload.status().message().equals(e.getMessage())) {
                audit.log(AuditLogger.AuditEvent.of("workload.invalid", "controller", workload.displayName(), "error", null,
                        Map.of("problems", e.problems())));
                System.err.println("WARN workload " + workload.displayName() + " is invalid: " + e.getMessage());
            }
            return new Outcome(WorkloadPhase.ERROR, e.getMessage(), List.of());
        }

        AgentWorkload current = workload;
        List<String> actions = new ArrayList<>();
        if (!current.hasFinalizer(FINALIZER)) {
            List<String> finalizers = new ArrayList<>(current.finalizers());
            finalizers.add(FINALIZER);
            current = cluster.updateFinalizers(current, finalizers);
            actions.add("finalizer added");
        }

        String identity = validated.identity().value();
        Instant now = clock.instant();
        Instant lastActivity = current.status().lastActivity();
        if (lastActivity == null) {
            lastActivity = current.creationTimestamp() == null ? now : current.creationTimestamp();
        }
        boolean online = false;
        try {
            Optional<RelayApi.AgentActivity> activity = relay.agentActivity(identity);
            if (activity.isPresent() && activity.get().online()) {
                online = true;
                Instant reported = activity.get().lastActivity();
                if (reported != null && reported.isAfter(lastActivity)) {
                    lastActivity = reported;
                }
            }
        } catch (IOException e) {
            System.err.println("WARN activity of " + identity + " unavailable, keeping " + lastActivity + ": " + e.getMessage());
        }

        boolean idle = !woken && isIdle(validated.ttl(), lastActivity, now);
        int replicas = idle ? 0 : 1;
        List<DesiredRoute> desired = desiredRoutes(validated);
        List<String> conflicts = new ArrayList<>();
        if (idle) {
            // Routes are parked before the pods go away so new traffic triggers a scale-up.
            syncRoutes(current, identity, desired, true, actions, conflicts);
            ensureDeployment(validated, replicas, actions);
        } else {
            ensureDeployment(validated, replicas, actions);
            syncRoutes(current, identity, desired, false, actions, conflicts);
        }

        WorkloadPhase phase;
        String message;
        if (!conflicts.isEmpty()) {
            phase = WorkloadPhase.ERROR;
            message = "route conflict: " + String.join(", ", conflicts);
        } else if (idle) {
            phase = WorkloadPhase.IDLE;
            message = "no activity since " + lastActivity;
        } else if (online) {
            phase = WorkloadPhase.READY;
            message = "";
        } else {
            phase = WorkloadPhase.RECONCILING;
            message = "waiting for agent " + identity;
        }
        List<String> routeKeys = new ArrayList<>();
        for (DesiredRoute route : desired) {
            routeKeys.add(route.routeKey());
        }
        Instant activity = lastActivity;
        WorkloadPhase previous = current.status().phase();
        writeStatus(current, status -> status.withPhase(phase, message)
                .withLastActivity(activity)
                .withObserved(workload.generation(), replicas, routeKeys));
        if (previous != phase || !actions.isEmpty()) {
            Map<String, Object> details = new LinkedHashMap<>();
            details.put("from", previous.wireName());
            details.put("actions", actions);
            details.put("lastActivity", activity.toString());
            audit.log(AuditLogger.AuditEvent.of("workload.reconciled", "controller", identity, phase.wireName(), null, details));
            System.out.println("workload " + current.displayName() + " (" + identity + ") " + previous.wireName() + " -> "
                    + phase.wireName() + (actions.isEmpty() ? "" : " " + actions));
        }
        return new Outcome(phase, message, actions);
    }

    private Outcome finalizeWorkload(AgentWorkload workload) throws IOException, InterruptedException {
        if (!workload.hasFinalizer(FINALIZER)) {
            return new Outcome(WorkloadPhase.DELETED, "", List.of());
        }
        Optional<AgentWorkload> terminating = statusWriter.update(workload,
                status -> status.withPhase(WorkloadPhase.TERMINATING, "removing routes"));
        if (terminating.isEmpty()) {
            forget(workload);
            return new Outcome(WorkloadPhase.DELETED, "", List.of());
        }
        AgentWorkload current = terminating.get();
        List<String> actions = new ArrayList<>();
        String identity = workload.identityOrNull();
        Set<String> managed = new LinkedHashSet<>(workload.status().routes());
        if (identity != null) {
            for (RelayApi.ObservedRoute route : relay.listRoutes(identity + "-")) {
                if (managed.contains(route.routeKey()) || ownsHttpKey(identity, route)) {
                    relay.deregister(route.kind(), route.key(), false);
                    actions.add("route " + route.routeKey() + " removed");
                }
            }
            cluster.deleteDeployment(workload.namespace(), identity);
            actions.add("deployment deleted");
        }
        List<String> finalizers = new ArrayList<>(current.finalizers());
        finalizers.remove(FINALIZER);
        cluster.updateFinalizers(current, finalizers);
        forget(workload);
        audit.log(AuditLogger.AuditEvent.of("workload.deleted", "controller", identity == null ? workload.displayName() : identity,
                "ok", null, Map.of("actions", actions)));
        System.out.println("workload " + workload.displayName() + " finalized " + actions);
        return new Outcome(WorkloadPhase.DELETED, "", actions);
    }

    private void ensureDeployment(WorkloadValidator.Validated validated, int replicas, List<String> actions)
            throws ClusterApiException {
        DeploymentModel desired = DeploymentModel.desired(validated, config.agentImage(), replicas);
        Optional<ClusterClient.ObservedDeployment> existing = cluster.getDeployment(desired.namespace(), desired.name());
        if (existing.isEmpty()) {
            cluster.applyDeployment(desired, null);
            actions.add("deployment created");
        } else if (!desired.specHash().equals(existing.get().specHash())) {
            cluster.applyDeployment(desired, existing.get());
            actions.add("deployment replaced");
        } else if (existing.get().replicas() != replicas) {
            cluster.scaleDeployment(desired.namespace(), desired.name(), replicas);
            actions.add("scaled to " + replicas);
        }
    }

    private void syncRoutes(
            AgentWorkload workload,
            String identity,
            List<DesiredRoute> desired,
            boolean park,
            List<String> actions,
            List<String> conflicts
    ) throws IOException {
        Map<String, RelayApi.ObservedRoute> observed = new LinkedHashMap<>();
        for (RelayApi.ObservedRoute route : relay.listRoutes(identity + "-")) {
            observed.put(route.routeKey(), route);
        }
        Set<String> wanted = new LinkedHashSet<>();
        for (DesiredRoute route : desired) {
            wanted.add(route.routeKey());
            RelayApi.ObservedRoute seen = observed.get(route.routeKey());
            boolean sameTarget = seen != null && seen.agentId().equals(route.agentId()) && seen.service().equals(route.service());
            boolean needsRegister = !sameTarget || (seen.parked() && !park);
            if (needsRegister) {
                try {
                    relay.register(route.kind(), route.key(), route.agentId(), route.service());
                    actions.add("route " + route.routeKey() + " registered");
                } catch (RelayApiException e) {
                    if (!e.conflict()) {
                        throw e;
                    }
                    conflicts.add(route.routeKey());
                    continue;
                }
            }
            if (park && (needsRegister || !seen.parked())) {
                relay.deregister(route.kind(), route.key(), true);
                actions.add("route " + route.routeKey() + " parked");
            }
        }
        Set<String> managed = new LinkedHashSet<>(workload.status().routes());
        for (RelayApi.ObservedRoute route : observed.values()) {
            if (wanted.contains(route.routeKey())) {
                continue;
            }
            if (managed.contains(route.routeKey()) || ownsHttpKey(identity, route)) {
                relay.deregister(route.kind(), route.key(), false);
                actions.add("route " + route.routeKey() + " removed");
            }
        }
    }

    List<DesiredRoute> desiredRoutes(WorkloadValidator.Validated validated) {
        String identity = validated.identity().value();
        List<DesiredRoute> out = new ArrayList<>();
        for (ServiceSpec service : validated.services().specs()) {
            String target = validated.serviceIdentity(service.name());
            if (service.isHttp()) {
                out.add(new DesiredRoute(RouteKind.HTTP, service.name() + "." + identity, target, service.name()));
            } else {
                int port = service.externalPort() != null
                        ? service.externalPort()
                        : config.tcpPortBase() + (int) Hashing.stableBucket(target, config.tcpPortRange());
                out.add(new DesiredRoute(RouteKind.TCP, Integer.toString(port), target, service.name()));
            }
        }
        return out;
    }

    static boolean isIdle(Duration ttl, Instant lastActivity, Instant now) {
        if (ttl == null || ttl.isZero()) {
            return false;
        }
        return !now.isBefore(lastActivity.plus(ttl));
    }

    private void writeStatus(AgentWorkload workload, UnaryOperator<AgentWorkload.Status> change)
            throws ClusterApiException, InterruptedException {
        statusWriter.update(workload, change);
    }

    private static boolean ownsHttpKey(String identity, RelayApi.ObservedRoute route) {
        return route.kind() == RouteKind.HTTP && route.key().endsWith("." + identity);
    }

    record DesiredRoute(RouteKind kind, String key, String agentId, String service) {
        String routeKey() {
            return kind.wireName() + ":" + key;
        }
    }

    public record Outcome(WorkloadPhase phase, String message, List<String> actions) {
    }
}
