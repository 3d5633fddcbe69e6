package io.kuberde.relay;

import io.kuberde.auth.AuthException;
import io.kuberde.auth.Authorizer;
import io.kuberde.auth.TokenVerifier;
import io.kuberde.auth.VerifiedToken;
import io.kuberde.config.RelayConfig;
import io.kuberde.model.AgentIdentity;
import io.kuberde.mux.MuxConfig;
import io.kuberde.mux.MuxSession;
import io.kuberde.observability.AuditLogger;
import io.kuberde.observability.TraceContextUtil;
import io.kuberde.tunnel.TunnelHandshake;

import java.io.IOException;
import java.net.Socket;
import java.net.SocketTimeoutException;
import java.time.Clock;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Admits agents: validates the upgrade request and credential, upgrades the connection to a mux
 * session and registers it, superseding any older session for the same identity. Upgrades of
 * {@code /connect/{identity}} come from users and are handed to the inbound router.
 */
public final class TunnelListener {
    private final RelayConfig config;
    private final TokenVerifier verifier;
    private final Authorizer authorizer;
    private final SessionRegistry sessions;
    private final InboundRouter userTunnels;
    private final RelayMetrics metrics;
    private final AuditLogger audit;
    private final Clock clock;

    public TunnelListener(
            RelayConfig config,
            TokenVerifier verifier,
            Authorizer authorizer,
            SessionRegistry sessions,
            InboundRouter userTunnels,
            RelayMetrics metrics,
            AuditLogger audit,
            Clock clock
    ) {
        this.config = config;
        this.verifier = verifier;
        this.authorizer = authorizer;
        this.sessions = sessions;
        this.userTunnels = userTunnels;
        this.metrics = metrics;
        this.audit = audit;
        this.clock = clock;
    }

    /**
     * Runs the handshake on an accepted connection. On success the socket is owned by the new mux
     * session; otherwise it is answered and closed here.
     */
    public void handle(Socket socket) {
        String traceId = TraceContextUtil.newTraceId();
        boolean admitted = false;
        try {
            socket.setSoTimeout((int) config.headReadTimeout().toMillis());
            TunnelHandshake.UpgradeRequest request;
            try {
                request = TunnelHandshake.readRequest(socket.getInputStream());
            } catch (SocketTimeoutException e) {
                System.err.println("WARN tunnel handshake from " + socket.getRemoteSocketAddress() + " timed out");
                return;
            }
            if (request == null) {
                TunnelHandshake.reject(socket.getOutputStream(), 400, "bad_request");
                return;
            }
            if (request.connectTarget() != null) {
                admitted = true;
                userTunnels.handleConnect(socket, request, traceId);
                return;
            }
            if (!config.tunnelPath().equals(request.path())) {
                TunnelHandshake.reject(socket.getOutputStream(), 404, "not_found");
                return;
            }
            if (!"GET".equalsIgnoreCase(request.method()) || !request.upgradesTo(TunnelHandshake.UPGRADE_PROTOCOL)) {
                TunnelHandshake.reject(socket.getOutputStream(), 400, "upgrade_required");
                return;
            }
            String identity = request.agentId();
            if (!AgentIdentity.isValidIdentity(identity)) {
                TunnelHandshake.reject(socket.getOutputStream(), 400, "invalid_agent_id");
                return;
            }
            for (String service : request.services()) {
                if (!AgentIdentity.isValidLabel(service)) {
                    TunnelHandshake.reject(socket.getOutputStream(), 400, "invalid_services");
                    return;
                }
            }
            if (request.bearerToken() == null) {
                metrics.authFailure();
                TunnelHandshake.reject(socket.getOutputStream(), 401, "missing_token");
                return;
            }
            VerifiedToken token;
            try {
                token = verifier.verify(request.bearerToken());
            } catch (AuthException e) {
                metrics.authFailure();
                audit.log(AuditLogger.AuditEvent.of("agent.rejected", "anonymous", identity, e.errorCode(), traceId, Map.of()));
                TunnelHandshake.reject(socket.getOutputStream(), 401, e.errorCode());
                return;
            }
            if (!authorizer.canOpenSession(token, identity)) {
                metrics.authFailure();
                audit.log(AuditLogger.AuditEvent.of("agent.rejected", token.principal(), identity, "forbidden", traceId, Map.of()));
                TunnelHandshake.reject(socket.getOutputStream(), 401, "forbidden");
                return;
            }
            TunnelHandshake.accept(socket.getOutputStream());
            socket.setSoTimeout(0);
            admit(socket, identity, request.services(), token, traceId);
            admitted = true;
        } catch (IOException e) {
            System.err.println("WARN tunnel handshake from " + socket.getRemoteSocketAddress() + " failed: " + e.getMessage());
        } finally {
            if (!admitted) {
                closeQuietly(socket);
            }
        }
    }

    private void admit(Socket socket, String identity, List<String> services, VerifiedToken token, String traceId) throws IOException {
        MuxConfig muxConfig = MuxConfig.of(config.keepAliveInterval(), Duration.ZERO, config.writeTimeout());
        MuxSession mux = MuxSession.server(socket, muxConfig, identity);
        AgentSession session = new AgentSession(identity, services, mux, token.principal(), token.expiry(), clock.instant());
        mux.setControlHandler(refreshed -> reauthenticate(session, refreshed));
        List<AgentSession> superseded = sessions.admit(session);
        for (AgentSession previous : superseded) {
            previous.close("superseded by a newer session for " + identity);
            audit.log(AuditLogger.AuditEvent.of("agent.superseded", previous.subject(), previous.identity(), "closed", traceId, Map.of()));
        }
        mux.onClose(() -> {
            if (sessions.remove(session)) {
                Throwable cause = mux.closeCause();
                System.out.println("agent " + identity + " disconnected: " + (cause == null ? "closed" : cause.getMessage()));
                audit.log(AuditLogger.AuditEvent.of("agent.disconnected", session.subject(), identity, "closed", null,
                        Map.of("reason", cause == null ? "closed" : String.valueOf(cause.getMessage()))));
            }
        });
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("services", services);
        details.put("superseded", superseded.size());
        details.put("credentialExpiry", token.expiry() == null ? null : token.expiry().toString());
        audit.log(AuditLogger.AuditEvent.of("agent.admitted", token.principal(), identity, "ok", traceId, details));
        System.out.println("agent " + identity + " connected services=" + services
                + " trace=" + TraceContextUtil.shortId(traceId));
    }

    private boolean reauthenticate(AgentSession session, String refreshed) {
        VerifiedToken token;
        try {
            token = verifier.verify(refreshed);
        } catch (AuthException e) {
            metrics.authFailure();
            audit.log(AuditLogger.AuditEvent.of("agent.reauth", session.subject(), session.identity(), e.errorCode(), null, Map.of()));
            return false;
        }
        if (!authorizer.canOpenSession(token, session.identity())) {
            metrics.authFailure();
            audit.log(AuditLogger.AuditEvent.of("agent.reauth", token.principal(), session.identity(), "forbidden", null, Map.of()));
            return false;
        }
        session.extendCredential(token.expiry());
        audit.log(AuditLogger.AuditEvent.of("agent.reauth", token.principal(), session.identity(), "ok", null,
                Map.of("credentialExpiry", String.valueOf(token.expiry()))));
        return true;
    }

    private static void closeQuietly(Socket socket) {
        try {
            socket.close();
        } catch (IOException e) {
            System.err.println("WARN closing tunnel socket failed: " + e.getMessage());
        }
    }
}
