package io.kuberde.relay;

import io.kuberde.auth.AuthException;
import io.kuberde.auth.AuthHttpHandlers;
import io.kuberde.auth.Authorizer;
import io.kuberde.auth.TokenVerifier;
import io.kuberde.auth.VerifiedToken;
import io.kuberde.config.RelayConfig;
import io.kuberde.model.AgentIdentity;
import io.kuberde.model.RouteEntry;
import io.kuberde.mux.MuxStream;
import io.kuberde.observability.AuditLogger;
import io.kuberde.observability.TraceContextUtil;
import io.kuberde.tunnel.Bridge;
import io.kuberde.tunnel.HttpHead;
import io.kuberde.tunnel.Preamble;
import io.kuberde.tunnel.TunnelHandshake;
import io.kuberde.util.HttpExchanges;

import java.io.IOException;
import java.io.OutputStream;
import java.net.Socket;
import java.net.SocketTimeoutException;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ExecutorService;

/**
 * Turns one accepted user connection into one tunnel stream: resolve the route, find the agent's
 * session, open a stream, send the preamble and bridge. Every failure closes only this connection.
 */
public final class InboundRouter {
    private final RelayConfig config;
    private final RoutingTable routes;
    private final SessionRegistry sessions;
    private final RelayMetrics metrics;
    private final ScaleUpNotifier notifier;
    private final TokenVerifier verifier;
    private final Authorizer authorizer;
    private final AuditLogger audit;
    private final ExecutorService bridgeExecutor;

    public InboundRouter(
            RelayConfig config,
            RoutingTable routes,
            SessionRegistry sessions,
            RelayMetrics metrics,
            ScaleUpNotifier notifier,
            TokenVerifier verifier,
            Authorizer authorizer,
            AuditLogger audit,
            ExecutorService bridgeExecutor
    ) {
        this.config = config;
        this.routes = routes;
        this.sessions = sessions;
        this.metrics = metrics;
        this.notifier = notifier;
        this.verifier = verifier;
        this.authorizer = authorizer;
        this.audit = audit;
        this.bridgeExecutor = bridgeExecutor;
    }

    public void handleTcp(Socket socket, int port) {
        String traceId = TraceContextUtil.newTraceId();
        try (socket) {
            RoutingTable.Resolution resolution = routes.resolvePort(port)
                    .orElseThrow(() -> new RelayException(RelayException.Reason.NO_ROUTE, "no route for port " + port));
            MuxStream stream = openTarget(resolution, traceId);
            bridge(socket, stream, resolution.entry(), traceId, null);
        } catch (RelayException e) {
            reject(e, "tcp:" + port, traceId);
        } catch (IOException e) {
            System.err.println("WARN tcp connection on port " + port + " failed: " + e.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    public void handleHttp(Socket socket) {
        String traceId = TraceContextUtil.newTraceId();
        try (socket) {
            String host = null;
            try {
                socket.setSoTimeout((int) config.headReadTimeout().toMillis());
                HttpHead head;
                try {
                    head = HttpHead.read(socket.getInputStream(), config.maxHeadBytes());
                } catch (SocketTimeoutException e) {
                    throw new RelayException(RelayException.Reason.TIMEOUT, "request head not received in time", e);
                }
                if (head == null) {
                    respond(socket, 400, "Bad Request", "malformed request\n", null);
                    return;
                }
                host = head.header("Host");
                Optional<RoutingTable.Resolution> resolved = routes.resolveHost(host, config.agentDomain(), sessions::hasLiveSession);
                if (resolved.isEmpty()) {
                    throw new RelayException(RelayException.Reason.NO_ROUTE, "no route for host " + host);
                }
                RoutingTable.Resolution resolution = resolved.get();
                if (config.requireBrowserSession() && !admitBrowser(socket, head, host, resolution.entry(), traceId)) {
                    return;
                }
                socket.setSoTimeout(0);
                MuxStream stream = openTarget(resolution, traceId);
                bridge(socket, stream, resolution.entry(), traceId, head.raw());
            } catch (RelayException e) {
                reject(e, "http:" + (host == null ? "-" : host), traceId);
                switch (e.reason()) {
                    case NO_ROUTE -> respond(socket, 404, "Not Found", "no route\n", null);
                    case AGENT_UNAVAILABLE -> respond(socket, 503, "Service Unavailable", "agent unavailable\n", "5");
                    case TIMEOUT -> respond(socket, 408, "Request Timeout", "request timeout\n", null);
                }
            }
        } catch (IOException e) {
            System.err.println("WARN http connection failed: " + e.getMessage() + " trace=" + TraceContextUtil.shortId(traceId));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    /**
     * Serves an upgrade of {@code /connect/{identity}} handed over by the tunnel listener: the
     * caller must own the identity or be an admin, and the identity must be a service of a
     * connected agent. Answers {@code 101} and bridges, or an error status and closes.
     */
    public void handleConnect(Socket socket, TunnelHandshake.UpgradeRequest request, String traceId) {
        String target = request.connectTarget();
        String resource = "connect:" + target;
        try (socket) {
            OutputStream out = socket.getOutputStream();
            if (!"GET".equalsIgnoreCase(request.method()) || !request.upgradesTo(TunnelHandshake.CONNECT_PROTOCOL)) {
                TunnelHandshake.reject(out, 400, "upgrade_required");
                return;
            }
            if (!AgentIdentity.isValidIdentity(target)) {
                TunnelHandshake.reject(out, 400, "invalid_agent_id");
                return;
            }
            if (request.bearerToken() == null) {
                metrics.authFailure();
                TunnelHandshake.reject(out, 401, "missing_token");
                return;
            }
            VerifiedToken token;
            try {
                token = verifier.verify(request.bearerToken());
            } catch (AuthException e) {
                metrics.authFailure();
                audit.log(AuditLogger.AuditEvent.of("connect.auth", "anonymous", target, e.errorCode(), traceId, Map.of()));
                TunnelHandshake.reject(out, 401, e.errorCode());
                return;
            }
            if (!authorizer.canActOn(token, target)) {
                audit.log(AuditLogger.AuditEvent.of("connect.auth", token.principal(), target, "forbidden", traceId, Map.of()));
                TunnelHandshake.reject(out, 403, "forbidden");
                return;
            }
            String owner = AgentIdentity.ownerOf(target);
            if (token.isAdmin() && owner != null && !owner.equals(token.username()) && !owner.equals(token.subjectId())) {
                audit.log(AuditLogger.AuditEvent.of("connect.admin", token.principal(), target, "ok", traceId,
                        Map.of("owner", owner)));
            }
            ConnectTarget resolved;
            MuxStream stream;
            try {
                resolved = resolveConnect(target, traceId);
                stream = openStream(resolved.session(), target, resolved.service());
            } catch (RelayException e) {
                reject(e, resource, traceId);
                switch (e.reason()) {
                    case NO_ROUTE -> TunnelHandshake.reject(out, 404, e.reason().code());
                    case AGENT_UNAVAILABLE, TIMEOUT -> TunnelHandshake.reject(out, 503, e.reason().code());
                }
                return;
            }
            TunnelHandshake.accept(out, TunnelHandshake.CONNECT_PROTOCOL);
            socket.setSoTimeout(0);
            System.out.println("connect " + target + " by " + token.principal() + " trace=" + TraceContextUtil.shortId(traceId));
            bridge(socket, stream, target, resolved.service(), resource, token.principal(), traceId, null);
        } catch (IOException e) {
            System.err.println("WARN connect to " + target + " failed: " + e.getMessage() + " trace=" + TraceContextUtil.shortId(traceId));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    /**
     * Finds the session serving {@code target}. A workload identity resolves only when its agent
     * declares exactly one service. Without a session, an idle workload gets a scale-up signal.
     */
    ConnectTarget resolveConnect(String target, String traceId) throws RelayException {
        Optional<AgentSession> found = sessions.find(target);
        if (found.isPresent()) {
            AgentSession session = found.get();
            if (!session.identity().equals(target)) {
                return new ConnectTarget(session, target.substring(session.identity().length() + 1));
            }
            if (session.aliases().size() == 1) {
                String alias = session.aliases().get(0);
                return new ConnectTarget(session, alias.substring(target.length() + 1));
            }
            throw new RelayException(RelayException.Reason.NO_ROUTE,
                    target + " serves " + session.aliases().size() + " services; connect to one of " + session.aliases());
        }
        for (RouteEntry parked : routes.parkedByPrefix(target)) {
            if (parked.agentId().equals(target) || parked.agentId().startsWith(target + "-")) {
                if (notifier != null) {
                    notifier.signal(parked, traceId);
                }
                throw new RelayException(RelayException.Reason.AGENT_UNAVAILABLE, "workload " + parked.agentId() + " is idle");
            }
        }
        throw new RelayException(RelayException.Reason.NO_ROUTE, "agent " + target + " is not connected");
    }

    private boolean admitBrowser(Socket socket, HttpHead head, String host, RouteEntry entry, String traceId) throws IOException {
        String cookie = HttpExchanges.cookieValue(head.header("Cookie"), AuthHttpHandlers.SESSION_COOKIE);
        if (cookie == null) {
            redirectToLogin(socket, head, host);
            return false;
        }
        VerifiedToken token;
        try {
            token = verifier.verify(cookie);
        } catch (AuthException e) {
            metrics.authFailure();
            audit.log(AuditLogger.AuditEvent.of("inbound.auth", "anonymous", entry.agentId(), e.errorCode(), traceId, Map.of()));
            redirectToLogin(socket, head, host);
            return false;
        }
        if (!authorizer.canActOn(token, entry.agentId())) {
            audit.log(AuditLogger.AuditEvent.of("inbound.auth", token.principal(), entry.agentId(), "forbidden", traceId, Map.of()));
            respond(socket, 403, "Forbidden", "forbidden\n", null);
            return false;
        }
        return true;
    }

    private void redirectToLogin(Socket socket, HttpHead head, String host) throws IOException {
        String proto = head.header("X-Forwarded-Proto");
        String scheme = proto != null && !proto.isBlank() ? proto.trim() : (config.tlsEnabled() ? "https" : "http");
        String returnUrl = scheme + "://" + host + head.target();
        String location = config.loginUrl()
                + (config.loginUrl().contains("?") ? "&" : "?")
                + "return_url=" + URLEncoder.encode(returnUrl, StandardCharsets.UTF_8);
        byte[] wire = HttpHead.toWire("HTTP/1.1 302 Found", List.of(
                new HttpHead.Header("Location", location),
                new HttpHead.Header("Content-Length", "0"),
                new HttpHead.Header("Connection", "close")
        ));
        OutputStream out = socket.getOutputStream();
        out.write(wire);
        out.flush();
    }

    /**
     * Opens a stream to the agent serving {@code resolution} and writes the service preamble.
     */
    MuxStream openTarget(RoutingTable.Resolution resolution, String traceId) throws RelayException {
        RouteEntry entry = resolution.entry();
        if (resolution.parked()) {
            if (notifier != null) {
                notifier.signal(entry, traceId);
            }
            throw new RelayException(RelayException.Reason.AGENT_UNAVAILABLE, "workload " + entry.agentId() + " is idle");
        }
        AgentSession session = sessions.find(entry.agentId())
                .orElseThrow(() -> new RelayException(RelayException.Reason.AGENT_UNAVAILABLE, "agent " + entry.agentId() + " is not connected"));
        return openStream(session, entry.agentId(), entry.service());
    }

    private static MuxStream openStream(AgentSession session, String agentId, String service) throws RelayException {
        MuxStream stream;
        try {
            stream = session.openStream();
        } catch (IOException e) {
            throw new RelayException(RelayException.Reason.AGENT_UNAVAILABLE, "cannot open stream to " + agentId, e);
        }
        try {
            Preamble.write(stream.getOutputStream(), service);
        } catch (IOException e) {
            stream.reset();
            throw new RelayException(RelayException.Reason.AGENT_UNAVAILABLE, "preamble to " + agentId + " failed", e);
        }
        return stream;
    }

    private void bridge(Socket socket, MuxStream stream, RouteEntry entry, String traceId, byte[] replay)
            throws IOException, InterruptedException {
        bridge(socket, stream, entry.agentId(), entry.service(), entry.kind().wireName() + ":" + entry.key(), "anonymous",
                traceId, replay);
    }

    private void bridge(
            Socket socket,
            MuxStream stream,
            String agentId,
            String service,
            String resource,
            String actor,
            String traceId,
            byte[] replay
    ) throws IOException, InterruptedException {
        AgentStats stats = sessions.statsFor(agentId);
        stats.streamOpened();
        metrics.streamOpened();
        try {
            if (replay != null) {
                OutputStream out = stream.getOutputStream();
                out.write(replay);
                out.flush();
            }
            Bridge bridge = new Bridge(socket, stream, (direction, bytes) -> {
                if (direction == Bridge.Direction.TO_STREAM) {
                    stats.addTraffic(bytes, 0);
                    metrics.addBytes(bytes, 0);
                } else {
                    stats.addTraffic(0, bytes);
                    metrics.addBytes(0, bytes);
                }
            });
            Bridge.Result result = bridge.run(bridgeExecutor);
            Map<String, Object> details = new LinkedHashMap<>();
            details.put("service", service);
            details.put("key", resource);
            details.put("bytesIn", result.bytesToStream());
            details.put("bytesOut", result.bytesToSocket());
            if (!result.clean()) {
                details.put("error", String.valueOf(result.failure().getMessage()));
            }
            audit.log(AuditLogger.AuditEvent.of("inbound.bridged", actor, agentId,
                    result.clean() ? "closed" : "aborted", traceId, details));
        } finally {
            stats.streamClosed();
            metrics.streamClosed();
        }
    }

    private void reject(RelayException e, String resource, String traceId) {
        metrics.rejected(e.reason());
        System.out.println("inbound " + resource + " rejected (" + e.reason().code() + "): " + e.getMessage()
                + " trace=" + TraceContextUtil.shortId(traceId));
        audit.log(AuditLogger.AuditEvent.of("inbound.rejected", "anonymous", resource, e.reason().code(), traceId,
                Map.of("message", String.valueOf(e.getMessage()))));
    }

    private static void respond(Socket socket, int status, String reason, String body, String retryAfter) throws IOException {
        if (socket.isClosed()) {
            return;
        }
        byte[] bytes = body.getBytes(StandardCharsets.UTF_8);
        List<HttpHead.Header> headers = new ArrayList<>();
        headers.add(new HttpHead.Header("Content-Type", "text/plain; charset=utf-8"));
        headers.add(new HttpHead.Header("Content-Length", Integer.toString(bytes.length)));
        headers.add(new HttpHead.Header("Connection", "close"));
        if (retryAfter != null) {
            headers.add(new HttpHead.Header("Retry-After", retryAfter));
        }
        OutputStream out = socket.getOutputStream();
        out.write(HttpHead.toWire("HTTP/1.1 " + status + " " + reason, headers));
        out.write(bytes);
        out.flush();
    }

    record ConnectTarget(AgentSession session, String service) {
    }
}
