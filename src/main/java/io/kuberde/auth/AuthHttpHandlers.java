package io.kuberde.auth;

import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import io.kuberde.observability.AuditLogger;
import io.kuberde.util.HttpExchanges;

import java.io.IOException;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Token issuance endpoints mounted on the relay's management server: machine credential exchange,
 * browser login through the identity provider and logout.
 */
public final class AuthHttpHandlers {
    public static final String SESSION_COOKIE = "kuberde_session";
    public static final Duration DEFAULT_SESSION_TTL = Duration.ofHours(8);

    private final TokenIssuer issuer;
    private final ClientRegistry clients;
    private final SessionStore sessions;
    private final TokenVerifier verifier;
    private final OidcLoginFlow oidc;
    private final String cookieDomain;
    private final boolean secureCookie;
    private final Duration sessionTtl;
    private final AuditLogger audit;
    private final Runnable onFailure;

    public AuthHttpHandlers(
            TokenIssuer issuer,
            ClientRegistry clients,
            SessionStore sessions,
            TokenVerifier verifier,
            OidcLoginFlow oidc,
            String cookieDomain,
            boolean secureCookie,
            Duration sessionTtl,
            AuditLogger audit,
            Runnable onFailure
    ) {
        this.issuer = issuer;
        this.clients = clients == null ? ClientRegistry.empty() : clients;
        this.sessions = sessions;
        this.verifier = verifier;
        this.oidc = oidc;
        this.cookieDomain = cookieDomain == null ? "" : cookieDomain.trim();
        this.secureCookie = secureCookie;
        this.sessionTtl = sessionTtl == null ? DEFAULT_SESSION_TTL : sessionTtl;
        this.audit = audit;
        this.onFailure = onFailure == null ? () -> { } : onFailure;
    }

    public void register(HttpServer server) {
        server.createContext("/auth/token", this::handleToken);
        server.createContext("/auth/login", this::handleLogin);
        server.createContext("/auth/callback", this::handleCallback);
        server.createContext("/auth/logout", this::handleLogout);
    }

    void handleToken(HttpExchange exchange) throws IOException {
        if (!HttpExchanges.allowMethods(exchange, "POST")) {
            return;
        }
        Map<String, String> params = HttpExchanges.parseParams(exchange);
        String grant = params.getOrDefault("grant_type", "");
        if (!"client_credentials".equals(grant)) {
            HttpExchanges.writeJson(exchange, Map.of("error", "unsupported_grant_type"), 400);
            return;
        }
        String clientId = params.get("client_id");
        String clientSecret = params.get("client_secret");
        String[] basic = HttpExchanges.extractBasic(exchange);
        if (basic != null) {
            clientId = basic[0];
            clientSecret = basic[1];
        }
        Optional<ClientRegistry.ClientRecord> client = clients.authenticate(clientId, clientSecret);
        if (client.isEmpty()) {
            onFailure.run();
            audit("auth.token", clientId, "denied", Map.of("reason", "invalid_client"));
            HttpExchanges.writeJson(exchange, Map.of("error", "invalid_client"), 401);
            return;
        }
        AccessToken token = issuer.issue(client.get().toTokenRequest());
        audit("auth.token", clientId, "ok", Map.of(
                "kind", client.get().kind().claimValue(),
                "expires_at", token.expiresAt().toString()
        ));
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("access_token", token.value());
        body.put("token_type", "Bearer");
        body.put("expires_in", token.lifetime().getSeconds());
        exchange.getResponseHeaders().set("Cache-Control", "no-store");
        HttpExchanges.writeJson(exchange, body, 200);
    }

    void handleLogin(HttpExchange exchange) throws IOException {
        if (!HttpExchanges.allowMethods(exchange, "GET")) {
            return;
        }
        if (oidc == null) {
            HttpExchanges.writeJson(exchange, Map.of("error", "login_disabled"), 404);
            return;
        }
        String returnUrl = HttpExchanges.parseQuery(exchange.getRequestURI()).get("return_url");
        HttpExchanges.redirect(exchange, oidc.begin(returnUrl).toString());
    }

    void handleCallback(HttpExchange exchange) throws IOException {
        if (!HttpExchanges.allowMethods(exchange, "GET")) {
            return;
        }
        if (oidc == null) {
            HttpExchanges.writeJson(exchange, Map.of("error", "login_disabled"), 404);
            return;
        }
        Map<String, String> query = HttpExchanges.parseQuery(exchange.getRequestURI());
        OidcLoginFlow.LoginResult result;
        try {
            result = oidc.complete(query.get("code"), query.get("state"));
        } catch (AuthException e) {
            onFailure.run();
            audit("auth.login", null, "denied", Map.of("reason", e.getMessage()));
            HttpExchanges.writeJson(exchange, Map.of("error", "login_failed"), 401);
            return;
        }
        VerifiedToken identity = result.identity();
        SessionStore.SessionRecord session = sessions.create(
                identity.subjectId(), identity.username(), identity.roles(), sessionTtl);
        AccessToken token = issuer.issue(new TokenIssuer.TokenRequest(
                identity.subjectId(),
                identity.username(),
                ActorKind.SESSION,
                identity.roles(),
                null,
                session.id(),
                sessionTtl
        ));
        exchange.getResponseHeaders().add("Set-Cookie", sessionCookie(token.value(), sessionTtl.getSeconds()));
        audit("auth.login", identity.principal(), "ok", Map.of("session", session.id()));
        HttpExchanges.redirect(exchange, result.returnUrl());
    }

    void handleLogout(HttpExchange exchange) throws IOException {
        if (!HttpExchanges.allowMethods(exchange, "POST")) {
            return;
        }
        String token = HttpExchanges.cookie(exchange, SESSION_COOKIE);
        if (token == null) {
            token = HttpExchanges.extractBearer(exchange);
        }
        String principal = null;
        if (token != null) {
            try {
                JwtCodec.Parsed parsed = JwtCodec.parse(token);
                JwtCodec.verifySignature(parsed, verifier.keys());
                String sid = parsed.claims().path("sid").asText("");
                principal = parsed.claims().path("preferred_username").asText(parsed.claims().path("sub").asText(""));
                if (!sid.isEmpty()) {
                    sessions.revoke(sid);
                }
            } catch (AuthException e) {
                audit("auth.logout", null, "ignored", Map.of("reason", e.getMessage()));
            }
        }
        exchange.getResponseHeaders().add("Set-Cookie", sessionCookie("", 0L));
        audit("auth.logout", principal, "ok", Map.of());
        HttpExchanges.writeJson(exchange, Map.of("status", "logged_out"), 200);
    }

    String sessionCookie(String value, long maxAgeSeconds) {
        StringBuilder sb = new StringBuilder();
        sb.append(SESSION_COOKIE).append('=').append(value)
                .append("; Path=/; HttpOnly; SameSite=Lax; Max-Age=").append(maxAgeSeconds);
        if (!cookieDomain.isEmpty()) {
            sb.append("; Domain=").append(cookieDomain);
        }
        if (secureCookie) {
            sb.append("; Secure");
        }
        return sb.toString();
    }

    private void audit(String action, String actor, String result, Map<String, Object> details) {
        if (audit == null) {
            return;
        }
        audit.log(AuditLogger.AuditEvent.of(action, actor, "auth", result, null, details));
    }
}
