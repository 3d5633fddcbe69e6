package io.kuberde.auth;

import com.fasterxml.jackson.databind.JsonNode;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import io.kuberde.util.Hashing;
import io.kuberde.util.HttpExchanges;
import io.kuberde.util.Jsons;

import java.io.Closeable;
import java.io.IOException;
import java.net.InetAddress;
import java.net.InetSocketAddress;
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
import java.util.HexFormat;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Command-line login: authorization code with PKCE against the identity provider, received on a
 * one-shot callback server bound to the loopback interface.
 */
public final class LoopbackLogin implements Closeable {
    public static final String CALLBACK_PATH = "/callback";
    private static final SecureRandom RANDOM = new SecureRandom();

    private final HttpClient http;
    private final URI authorizeUrl;
    private final URI tokenUrl;
    private final String clientId;
    private final String clientSecret;
    private final Clock clock;
    private final String state = randomHex(16);
    private final String codeVerifier = Hashing.base64Url(randomBytes(32));
    private final CompletableFuture<String> code = new CompletableFuture<>();
    private HttpServer server;
    private URI redirectUri;

    public LoopbackLogin(HttpClient http, URI authorizeUrl, URI tokenUrl, String clientId, String clientSecret, Clock clock) {
        this.http = http;
        this.authorizeUrl = authorizeUrl;
        this.tokenUrl = tokenUrl;
        this.clientId = clientId;
        this.clientSecret = clientSecret == null ? "" : clientSecret;
        this.clock = clock;
    }

    /**
     * Binds the callback server and returns the URL the user opens in a browser.
     */
    public URI start() throws IOException {
        server = HttpServer.create(new InetSocketAddress(InetAddress.getLoopbackAddress(), 0), 0);
        server.createContext(CALLBACK_PATH, this::handleCallback);
        server.start();
        redirectUri = URI.create("http://127.0.0.1:" + server.getAddress().getPort() + CALLBACK_PATH);
        String challenge = Hashing.base64Url(Hashing.sha256(codeVerifier.getBytes(StandardCharsets.US_ASCII)));
        String query = "response_type=code"
                + "&client_id=" + enc(clientId)
                + "&redirect_uri=" + enc(redirectUri.toString())
                + "&scope=" + enc("openid profile email")
                + "&state=" + enc(state)
                + "&code_challenge=" + enc(challenge)
                + "&code_challenge_method=S256";
        String base = authorizeUrl.toString();
        return URI.create(base + (base.contains("?") ? "&" : "?") + query);
    }

    /**
     * Waits for the provider's redirect, then exchanges the code for tokens.
     *
     * @throws TimeoutException when no callback arrived within {@code timeout}
     * @throws AuthException when the provider reported an error or refused the exchange
     */
    public StoredToken await(Duration timeout) throws IOException, AuthException, InterruptedException, TimeoutException {
        if (server == null) {
            throw new IllegalStateException("start() was not called");
        }
        String received;
        try {
            received = code.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (ExecutionException e) {
            if (e.getCause() instanceof AuthException) {
                throw (AuthException) e.getCause();
            }
            throw new IOException("login callback failed", e.getCause());
        }
        return exchange(received);
    }

    void handleCallback(HttpExchange exchange) throws IOException {
        if (!HttpExchanges.allowMethods(exchange, "GET")) {
            return;
        }
        Map<String, String> query = HttpExchanges.parseQuery(exchange.getRequestURI());
        if (!state.equals(query.get("state"))) {
            HttpExchanges.writeText(exchange, "text/plain; charset=utf-8", "state mismatch\n", 400);
            return;
        }
        String error = query.get("error");
        if (error != null && !error.isBlank()) {
            code.completeExceptionally(AuthException.invalid("provider refused the login: " + error));
            HttpExchanges.writeText(exchange, "text/plain; charset=utf-8", "Login failed: " + error + "\n", 400);
            return;
        }
        String value = query.get("code");
        if (value == null || value.isBlank()) {
            HttpExchanges.writeText(exchange, "text/plain; charset=utf-8", "no code in callback\n", 400);
            return;
        }
        code.complete(value);
        HttpExchanges.writeText(exchange, "text/plain; charset=utf-8", "Login successful. You can close this window.\n", 200);
    }

    private StoredToken exchange(String authorizationCode) throws IOException, AuthException {
        String form = "grant_type=authorization_code"
                + "&code=" + enc(authorizationCode)
                + "&redirect_uri=" + enc(redirectUri.toString())
                + "&client_id=" + enc(clientId)
                + "&code_verifier=" + enc(codeVerifier)
                + (clientSecret.isBlank() ? "" : "&client_secret=" + enc(clientSecret));
        HttpRequest request = HttpRequest.newBuilder(tokenUrl)
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
        String accessToken = body.path("access_token").asText("");
        if (accessToken.isBlank()) {
            throw AuthException.invalid("provider response has no access_token");
        }
        Instant expiresAt = body.path("expires_in").canConvertToLong()
                ? clock.instant().plusSeconds(body.path("expires_in").asLong())
                : null;
        String refresh = body.path("refresh_token").asText("");
        return new StoredToken(accessToken, body.path("token_type").asText("Bearer"), expiresAt,
                refresh.isEmpty() ? null : refresh);
    }

    @Override
    public void close() {
        if (server != null) {
            server.stop(0);
        }
    }

    private static String enc(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8);
    }

    private static byte[] randomBytes(int size) {
        byte[] raw = new byte[size];
        RANDOM.nextBytes(raw);
        return raw;
    }

    private static String randomHex(int size) {
        return HexFormat.of().formatHex(randomBytes(size));
    }
}
