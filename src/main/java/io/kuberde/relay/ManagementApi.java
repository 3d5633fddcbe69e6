package io.kuberde.relay;

import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import io.kuberde.auth.AuthException;
import io.kuberde.auth.Authorizer;
import io.kuberde.auth.TokenVerifier;
import io.kuberde.auth.VerifiedToken;
import io.kuberde.model.RouteEntry;
import io.kuberde.model.RouteKind;
import io.kuberde.observability.AuditLogger;
import io.kuberde.observability.PrometheusFormatter;
import io.kuberde.observability.TraceContextUtil;
import io.kuberde.util.HttpExchanges;

import java.io.IOException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.function.BooleanSupplier;

/**
 * Route registration, agent stats, probes and metrics on the relay's management port.
 */
public final class ManagementApi {
    public static final String REASON_IDLE = "idle";

    private final RoutingTable routes;
    private final SessionRegistry sessions;
    private final TcpPortManager tcpPorts;
    private final TokenVerifier verifier;
    private final Authorizer authorizer;
    private final RelayMetrics metrics;
    private final AuditLogger audit;
    private final boolean openProbes;
    private final BooleanSupplier ready;

    public ManagementApi(
            RoutingTable routes,
            SessionRegistry sessions,
            TcpPortManager tcpPorts,
            TokenVerifier verifier,
            Authorizer authorizer,
            RelayMetrics metrics,
            AuditLogger audit,
            boolean openProbes,
            BooleanSupplier ready
    ) {
        this.routes = routes;
        this.sessions = sessions;
        this.tcpPorts = tcpPorts;
        this.verifier = verifier;
        this.authorizer = authorizer;
        this.metrics = metrics;
        this.audit = audit;
        this.openProbes = openProbes;
        this.ready = ready;
    }

    public void register(HttpServer server) {
        server.createContext("/mgmt/services/tcp", exchange -> handleRoute(exchange, RouteKind.TCP));
        server.createContext("/mgmt/services/http", exchange -> handleRoute(exchange, RouteKind.HTTP));
        server.createContext("/mgmt/services", this::handleListRoutes);
        server.createContext("/mgmt/agents/", this::handleAgent);
        server.createContext("/healthz", this::handleHealth);
        server.createContext("/readyz", this::handleReady);
        server.createContext("/metrics", this::handleMetrics);
    }

    void handleRoute(HttpExchange exchange, RouteKind kind) throws IOException {
        if (!HttpExchanges.allowMethods(exchange, "POST", "DELETE")) {
            return;
        }
        VerifiedToken token = authenticate(exchange);
        if (token == null) {
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
        if ("POST".equalsIgnoreCase(exchange.getRequestMethod())) {
            registerRoute(exchange, kind, token, params);
        } else {
            removeRoute(exchange, kind, token, params);
        }
    }

    private void registerRoute(HttpExchange exchange, RouteKind kind, VerifiedToken token, Map<String, String> params)
            throws IOException {
        String agentId = params.get("agentID");
        String service = params.get("service");
        String rawKey = kind == RouteKind.TCP ? params.get("port") : params.get("hostnamePrefix");
        if (agentId == null || agentId.isBlank() || !authorizer.canActOn(token, agentId)) {
            HttpExchanges.writeJson(exchange, Map.of("error", "forbidden", "agentID", agentId == null ? "" : agentId), 403);
            return;
        }
        String traceId = TraceContextUtil.newTraceId();
        RoutingTable.Registration registration;
        try {
            registration = routes.register(kind, rawKey, agentId, service, token.principal());
        } catch (IllegalArgumentException e) {
            HttpExchanges.writeJson(exchange, Map.of("error", "invalid_key", "message", e.getMessage()), 400);
            return;
        } catch (RouteConflictException e) {
            audit.log(AuditLogger.AuditEvent.of("route.register", token.principal(), describe(kind, rawKey), "conflict", traceId,
                    Map.of("agentID", agentId, "boundTo", e.existing().agentId())));
            HttpExchanges.writeJson(exchange, Map.of(
                    "error", "route_conflict",
                    "key", e.existing().key(),
                    "agentID", e.existing().agentId()
            ), 409);
            return;
        }
        RouteEntry entry = registration.entry();
        if (kind == RouteKind.TCP) {
            try {
                tcpPorts.open(Integer.parseInt(entry.key()));
            } catch (IOException e) {
                routes.deregister(kind, entry.key());
                System.err.println("WARN cannot listen on route port " + entry.key() + ": " + e.getMessage());
                HttpExchanges.writeJson(exchange, Map.of("error", "listen_failed", "port", entry.key()), 500);
                return;
            }
        }
        if (registration.outcome() != RoutingTable.Outcome.UNCHANGED) {
            audit.log(AuditLogger.AuditEvent.of("route.register", token.principal(), describe(kind, entry.key()),
                    registration.outcome().name().toLowerCase(Locale.ROOT), traceId,
                    Map.of("agentID", entry.agentId(), "service", entry.service())));
            System.out.println("route " + describe(kind, entry.key()) + " -> " + entry.agentId() + "/" + entry.service()
                    + " (" + registration.outcome().name().toLowerCase(Locale.ROOT) + ")");
        }
        Map<String, Object> body = routeJson(entry, false);
        body.put("status", registration.outcome().name().toLowerCase(Locale.ROOT));
        HttpExchanges.writeJson(exchange, body, 200);
    }

    private void removeRoute(HttpExchange exchange, RouteKind kind, VerifiedToken token, Map<String, String> params)
            throws IOException {
        String rawKey = kind == RouteKind.TCP ? params.get("port") : params.get("hostnamePrefix");
        String key;
        try {
            key = routes.normalizeKey(kind, rawKey);
        } catch (IllegalArgumentException e) {
            HttpExchanges.writeJson(exchange, Map.of("error", "invalid_key", "message", e.getMessage()), 400);
            return;
        }
        Optional<RouteEntry> existing = routes.find(kind, key).or(() -> routes.findParked(kind, key));
        if (existing.isEmpty()) {
            HttpExchanges.writeJson(exchange, Map.of("error", "not_found", "key", key), 404);
            return;
        }
        if (!authorizer.canActOn(token, existing.get().agentId())) {
            HttpExchanges.writeJson(exchange, Map.of("error", "forbidden", "agentID", existing.get().agentId()), 403);
            return;
        }
        boolean idle = REASON_IDLE.equalsIgnoreCase(params.getOrDefault("reason", ""));
        String traceId = TraceContextUtil.newTraceId();
        if (idle) {
            routes.park(kind, key);
        } else {
            routes.deregister(kind, key);
            if (kind == RouteKind.TCP) {
                tcpPorts.close(Integer.parseInt(key));
            }
        }
        String action = idle ? "parked" : "deregistered";
        audit.log(AuditLogger.AuditEvent.of("route.remove", token.principal(), describe(kind, key), action, traceId,
                Map.of("agentID", existing.get().agentId())));
        System.out.println("route " + describe(kind, key) + " " + action);
        HttpExchanges.writeJson(exchange, Map.of("status", action, "kind", kind.wireName(), "key", key), 200);
    }

    void handleListRoutes(HttpExchange exchange) throws IOException {
        if (!"/mgmt/services".equals(exchange.getRequestURI().getPath())) {
            HttpExchanges.writeJson(exchange, Map.of("error", "not_found"), 404);
            return;
        }
        if (!HttpExchanges.allowMethods(exchange, "GET")) {
            return;
        }
        VerifiedToken token = authenticate(exchange);
        if (token == null) {
            return;
        }
        String prefix = HttpExchanges.parseQuery(exchange.getRequestURI()).getOrDefault("agentPrefix", "");
        boolean allowed = token.isAdmin() || (!prefix.isBlank() && authorizer.canActOn(token, prefix));
        if (!allowed) {
            HttpExchanges.writeJson(exchange, Map.of("error", "forbidden", "agentPrefix", prefix), 403);
            return;
        }
        List<Map<String, Object>> out = new ArrayList<>();
        for (RouteEntry entry : routes.listByPrefix(prefix)) {
            out.add(routeJson(entry, false));
        }
        for (RouteEntry entry : routes.parkedByPrefix(prefix)) {
            out.add(routeJson(entry, true));
        }
        HttpExchanges.writeJson(exchange, Map.of("routes", out), 200);
    }

    void handleAgent(HttpExchange exchange) throws IOException {
        if (!HttpExchanges.allowMethods(exchange, "GET")) {
            return;
        }
        VerifiedToken token = authenticate(exchange);
        if (token == null) {
            return;
        }
        String identity = exchange.getRequestURI().getPath().substring("/mgmt/agents/".length());
        if (identity.isBlank() || identity.contains("/")) {
            HttpExchanges.writeJson(exchange, Map.of("error", "not_found"), 404);
            return;
        }
        if (!authorizer.canActOn(token, identity)) {
            HttpExchanges.writeJson(exchange, Map.of("error", "forbidden", "agentID", identity), 403);
            return;
        }
        Optional<AgentStats> stats = sessions.stats(identity);
        if (stats.isEmpty()) {
            HttpExchanges.writeJson(exchange, Map.of("error", "not_found", "agentID", identity), 404);
            return;
        }
        Map<String, Object> body = stats.get().toMap();
        body.put("online", sessions.hasLiveSession(identity));
        HttpExchanges.writeJson(exchange, body, 200);
    }

    void handleHealth(HttpExchange exchange) throws IOException {
        if (!HttpExchanges.allowMethods(exchange, "GET")) {
            return;
        }
        if (!openProbes && authenticate(exchange) == null) {
            return;
        }
        HttpExchanges.writeJson(exchange, Map.of("status", "ok", "time", Instant.now().toString()), 200);
    }

    void handleReady(HttpExchange exchange) throws IOException {
        if (!HttpExchanges.allowMethods(exchange, "GET")) {
            return;
        }
        if (!openProbes && authenticate(exchange) == null) {
            return;
        }
        if (!ready.getAsBoolean()) {
            HttpExchanges.writeJson(exchange, Map.of("status", "starting"), 503);
            return;
        }
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", "ready");
        body.put("sessions", sessions.liveCount());
        body.put("routes", routes.size());
        HttpExchanges.writeJson(exchange, body, 200);
    }

    void handleMetrics(HttpExchange exchange) throws IOException {
        if (!HttpExchanges.allowMethods(exchange, "GET")) {
            return;
        }
        if (!openProbes && authenticate(exchange) == null) {
            return;
        }
        HttpExchanges.writeText(exchange, "text/plain; version=0.0.4; charset=utf-8", PrometheusFormatter.format(metrics), 200);
    }

    /**
     * Verified caller, or {@code null} after a 401 answer was written.
     */
    private VerifiedToken authenticate(HttpExchange exchange) throws IOException {
        String bearer = HttpExchanges.extractBearer(exchange);
        if (bearer == null) {
            HttpExchanges.writeJson(exchange, Map.of("error", "missing_token"), 401);
            return null;
        }
        try {
            return verifier.verify(bearer);
        } catch (AuthException e) {
            metrics.authFailure();
            audit.log(AuditLogger.AuditEvent.of("mgmt.auth", "anonymous", exchange.getRequestURI().getPath(), e.errorCode()));
            HttpExchanges.writeJson(exchange, Map.of("error", e.errorCode()), 401);
            return null;
        }
    }

    private static Map<String, Object> routeJson(RouteEntry entry, boolean parked) {
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("kind", entry.kind().wireName());
        out.put("key", entry.key());
        out.put("agentID", entry.agentId());
        out.put("service", entry.service());
        out.put("registeredBy", entry.registeredBy());
        out.put("registeredAt", Instant.ofEpochMilli(entry.registeredAtMs()).toString());
        out.put("parked", parked);
        return out;
    }

    private static String describe(RouteKind kind, String key) {
        return kind.wireName() + ":" + key;
    }
}
