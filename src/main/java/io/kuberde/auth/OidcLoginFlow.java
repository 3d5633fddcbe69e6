package io.kuberde.auth;

import com.fasterxml.jackson.databind.JsonNode;
import io.kuberde.util.Jsons;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.security.SecureRandom;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.HexFormat;
import java.util.Iterator;
import java.util.Locale;
import java.util.Map;

/**
 * Authorization-code login against an OpenID Connect provider. The {@code state} value is kept
 * server side and consumed exactly once.
 */
public final class OidcLoginFlow {
    public static final Duration STATE_TTL = Duration.ofMinutes(10);
    private static final SecureRandom RANDOM = new SecureRandom();

    private final HttpClient http;
    private final ProviderSettings provider;
    private final TokenVerifier idTokenVerifier;
    private final String agentDomain;
    private final Clock clock;
    private final Map<String, PendingLogin> pending = new HashMap<>();

    public OidcLoginFlow(
            HttpClient http,
            ProviderSettings provider,
            TokenVerifier idTokenVerifier,
            String agentDomain,
            Clock clock
    ) {
        this.http = http;
        this.provider = provider;
        this.idTokenVerifier = idTokenVerifier;
        this.agentDomain = agentDomain == null ? "" : agentDomain.trim().toLowerCase(Locale.ROOT);
        this.clock = clock;
    }

    public URI begin(String returnUrl) {
        byte[] raw = new byte[16];
        RANDOM.nextBytes(raw);
        String state = HexFormat.of().formatHex(raw);
        synchronized (pending) {
            purgeExpired();
            pending.put(state, new PendingLogin(safeReturnUrl(returnUrl), clock.instant()));
        }
        String query = "response_type=code"
                + "&client_id=" + enc(provider.clientId())
                + "&redirect_uri=" + enc(provider.redirectUri().toString())
                + "&scope=" + enc("openid profile email")
                + "&state=" + enc(state);
        String base = provider.authorizeUrl().toString();
        return URI.create(base + (base.contains("?") ? "&" : "?") + query);
    }

    public LoginResult complete(String code, String state) throws IOException, AuthException {
        if (code == null || code.isBlank() || state == null || state.isBlank()) {
            throw AuthException.invalid("callback needs code and state");
        }
        PendingLogin login;
        synchronized (pending) {
            purgeExpired();
            login = pending.remove(state);
        }
        if (login == null) {
            throw AuthException.invalid("unknown or expired login state");
        }
        String form = "grant_type=authorization_code"
                + "&code=" + enc(code)
                + "&redirect_uri=" + enc(provider.redirectUri().toString())
                + "&client_id=" + enc(provider.clientId())
                + "&client_secret=" + enc(provider.clientSecret());
        HttpRequest request = HttpRequest.newBuilder(provider.tokenUrl())
                .timeout(Duration.ofSeconds(10))
                .header("Content-Type", "application/x-www-form-urlencoded")
                .POST(HttpRequest.BodyPublishers.ofString(form))
                .build();
        HttpResponse<String> response;
        try {
            response = http.send(request, HttpResponse.BodyHandlers.ofString());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IOException("Interrupted during code exchange", e);
        }
        if (response.statusCode() != 200) {
            throw AuthException.invalid("code exchange failed: HTTP " + response.statusCode());
        }
        JsonNode body = Jsons.mapper().readTree(response.body());
        String idToken = body.path("id_token").asText("");
        if (idToken.isBlank()) {
            throw AuthException.invalid("provider response has no id_token");
        }
        VerifiedToken identity = idTokenVerifier.verify(idToken);
        return new LoginResult(identity, login.returnUrl());
    }

    /**
     * Accepts relative paths and absolute URLs under the agent domain; everything else falls back to
     * {@code /} so the callback cannot be used as an open redirect.
     */
    String safeReturnUrl(String raw) {
        if (raw == null || raw.isBlank()) {
            return "/";
        }
        String value = raw.trim();
        if (value.startsWith("/") && !value.startsWith("//")) {
            return value;
        }
        try {
            URI uri = URI.create(value);
            String host = uri.getHost() == null ? "" : uri.getHost().toLowerCase(Locale.ROOT);
            boolean web = "https".equalsIgnoreCase(uri.getScheme()) || "http".equalsIgnoreCase(uri.getScheme());
            if (web && !agentDomain.isEmpty() && (host.equals(agentDomain) || host.endsWith("." + agentDomain))) {
                return value;
            }
        } catch (IllegalArgumentException e) {
            return "/";
        }
        return "/";
    }

    private void purgeExpired() {
        Instant cutoff = clock.instant().minus(STATE_TTL);
        Iterator<PendingLogin> it = pending.values().iterator();
        while (it.hasNext()) {
            if (it.next().createdAt().isBefore(cutoff)) {
                it.remove();
            }
        }
    }

    private static String enc(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8);
    }

    public record ProviderSettings(
            URI authorizeUrl,
            URI tokenUrl,
            String clientId,
            String clientSecret,
            URI redirectUri
    ) {
    }

    public record LoginResult(VerifiedToken identity, String returnUrl) {
    }

    private record PendingLogin(String returnUrl, Instant createdAt) {
    }
}
