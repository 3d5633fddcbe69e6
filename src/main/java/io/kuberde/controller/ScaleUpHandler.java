package io.kuberde.controller;

import com.sun.net.httpserver.HttpExchange;
import io.kuberde.auth.AuthException;
import io.kuberde.auth.Authorizer;
import io.kuberde.auth.TokenVerifier;
import io.kuberde.auth.VerifiedToken;
import io.kuberde.observability.AuditLogger;
import io.kuberde.util.HttpExchanges;

import java.io.IOException;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;

/**
 * {@code POST /hooks/scale-up}: the relay saw traffic for a parked route. Requests are keyed by
 * workload identity; a duplicate while a scale-up is running, or for a workload that is not idle,
 * is acknowledged without doing anything.
 */
public final class ScaleUpHandler {
    private final ClusterClient cluster;
    private final Reconciler reconciler;
    private final TokenVerifier verifier;
    private final Authorizer authorizer;
    private final String namespace;
    private final ExecutorService executor;
    private final AuditLogger audit;
    private final Set<String> inFlight = ConcurrentHashMap.newKeySet();

    public ScaleUpHandler(
            ClusterClient cluster,
            Reconciler reconciler,
            TokenVerifier verifier,
            Authorizer authorizer,
            String namespace,
            ExecutorService executor,
            AuditLogger audit
    ) {
        this.cluster = cluster;
        this.reconciler = reconciler;
        this.verifier = verifier;
        this.authorizer = authorizer;
        this.namespace = namespace;
        this.executor = executor;
        this.audit = audit;
    }

    public void handle(HttpExchange exchange) throws IOException {
        if (!HttpExchanges.allowMethods(exchange, "POST")) {
            return;
        }
        String bearer = HttpExchanges.extractBearer(exchange);
        if (bearer == null) {
            HttpExchanges.writeJson(exchange, Map.of("error", "missing_token"), 401);
            return;
        }
        VerifiedToken token;
        try {
            token = verifier.verify(bearer);
        } catch (AuthException e) {
            HttpExchanges.writeJson(exchange, Map.of("error", e.errorCode()), 401);
            return;
        }
        if (!authorizer.isSystem(token)) {
            HttpExchanges.writeJson(exchange, Map.of("error", "forbidden", "reason", "system credential required"), 403);
            return;
        }
        Map<String, String> params;
        try {
            params = HttpExchanges.parseParams(exchange);
        } catch (IOException e) {
            HttpExchanges.writeJson(exchange, Map.of("error", "invalid_request", "message", String.valueOf(e.getMessage())), 400);
            return;
        }
        String agentId = params.getOrDefault("agentID", "").trim();
        if (agentId.isEmpty()) {
            HttpExchanges.writeJson(exchange, Map.of("error", "invalid_request", "message", "agentID is required"), 400);
            return;
        }
        Result result;
        try {
            result = request(agentId, token.principal());
        } catch (IOException e) {
            System.err.println("WARN scale-up for " + agentId + " not accepted: " + e.getMessage());
            HttpExchanges.writeJson(exchange, Map.of("error", "unavailable", "message", String.valueOf(e.getMessage())), 503);
            return;
        }
        switch (result.status()) {
            case NOT_FOUND -> HttpExchanges.writeJson(exchange, Map.of("error", "not_found", "agentID", agentId), 404);
            case SCALING -> HttpExchanges.writeJson(exchange, Map.of("status", "scaling", "workload", result.identity()), 202);
            case ALREADY_ACTIVE -> HttpExchanges.writeJson(exchange,
                    Map.of("status", "already_active", "workload", result.identity()), 202);
        }
    }

    /**
     * Resolves the workload behind {@code agentId} (a workload or service identity) and starts a
     * scale-up when it is idle.
     */
    Result request(String agentId, String requestedBy) throws IOException {
        Optional<AgentWorkload> match = findWorkload(agentId);
        if (match.isEmpty()) {
            return new Result(Status.NOT_FOUND, null);
        }
        AgentWorkload workload = match.get();
        String identity = workload.identityOrNull();
        if (workload.status().phase() != WorkloadPhase.IDLE || !inFlight.add(identity)) {
            return new Result(Status.ALREADY_ACTIVE, identity);
        }
        audit.log(AuditLogger.AuditEvent.of("scale_up.requested", requestedBy, identity, "accepted", null,
                Map.of("agentID", agentId)));
        System.out.println("scale-up requested for " + identity + " by " + requestedBy);
        try {
            executor.execute(() -> wake(workload, identity));
        } catch (RejectedExecutionException e) {
            inFlight.remove(identity);
            throw new IOException("controller is shutting down", e);
        }
        return new Result(Status.SCALING, identity);
    }

    boolean inFlight(String identity) {
        return inFlight.contains(identity);
    }

    private void wake(AgentWorkload workload, String identity) {
        try {
            Reconciler.Outcome outcome = reconciler.wake(workload);
            audit.log(AuditLogger.AuditEvent.of("scale_up.completed", "controller", identity, outcome.phase().wireName(), null,
                    Map.of("actions", outcome.actions())));
        } catch (IOException e) {
            System.err.println("WARN scale-up of " + identity + " failed: " + e.getMessage());
            audit.log(AuditLogger.AuditEvent.of("scale_up.completed", "controller", identity, "failed", null,
                    Map.of("error", String.valueOf(e.getMessage()))));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } finally {
            inFlight.remove(identity);
        }
    }

    /**
     * Longest workload identity that equals {@code agentId} or prefixes it as {@code identity-service}.
     */
    private Optional<AgentWorkload> findWorkload(String agentId) throws ClusterApiException {
        List<AgentWorkload> workloads = cluster.listWorkloads(namespace);
        AgentWorkload best = null;
        int bestLength = -1;
        for (AgentWorkload workload : workloads) {
            if (workload.deleting()) {
                continue;
            }
            String identity = workload.identityOrNull();
            if (identity == null) {
                continue;
            }
            boolean matches = agentId.equals(identity) || agentId.startsWith(identity + "-");
            if (matches && identity.length() > bestLength) {
                best = workload;
                bestLength = identity.length();
            }
        }
        return Optional.ofNullable(best);
    }

    enum Status {
        SCALING,
        ALREADY_ACTIVE,
        NOT_FOUND
    }

    record Result(Status status, String identity) {
    }
}
