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
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * OAuth2 client-credentials grant against a token endpoint (the relay's {@code /auth/token} or an
 * external identity provider).
 */
public final class ClientCredentialsTokenSource implements TokenSource {
    private static final Duration REQUEST_TIMEOUT = Duration.ofSeconds(10);

    private final HttpClient http;
    private final URI tokenUrl;
    private final String clientId;
    private final String clientSecret;
    private final Clock clock;

    public ClientCredentialsTokenSource(HttpClient http, URI tokenUrl, String clientId, String clientSecret, Clock clock) {
        if (clientId == null || clientId.isBlank() || clientSecret == null || clientSecret.isBlank()) {
            throw new IllegalArgumentException("client id and secret are required");
        }
        this.http = http;
        this.tokenUrl = tokenUrl;
        this.clientId = clientId.trim();
        this.clientSecret = clientSecret;
        this.clock = clock;
    }

    @Override
    public AccessToken fetch() throws IOException, AuthException {
        String form = "grant_type=client_credentials"
                + "&client_id=" + URLEncoder.encode(clientId, StandardCharsets.UTF_8)
                + "&client_secret=" + URLEncoder.encode(clientSecret, StandardCharsets.UTF_8);
        HttpRequest request = HttpRequest.newBuilder(tokenUrl)
                .timeout(REQUEST_TIMEOUT)
                .header("Content-Type", "application/x-www-form-urlencoded")
                .header("Accept", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(form))
                .build();
        Instant issuedAt = clock.instant();
        HttpResponse<String> response;
        try {
            response = http.send(request, HttpResponse.BodyHandlers.ofString());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IOException("Interrupted while requesting token from " + tokenUrl, e);
        }
        if (response.statusCode() == 400 || response.statusCode() == 401) {
            throw AuthException.invalid("token endpoint rejected client " + clientId + ": HTTP " + response.statusCode());
        }
        if (response.statusCode() != 200) {
            throw new IOException("token endpoint returned HTTP " + response.statusCode());
        }
        JsonNode body = Jsons.mapper().readTree(response.body());
        String value = body.path("access_token").asText("");
        long expiresIn = body.path("expires_in").asLong(0L);
        if (value.isBlank() || expiresIn <= 0L) {
            throw new IOException("token endpoint response lacks access_token or expires_in");
        }
        return new AccessToken(value, issuedAt, issuedAt.plusSeconds(expiresIn));
    }
}
