package io.kuberde.controller;

import com.fasterxml.jackson.databind.JsonNode;
import io.kuberde.auth.AuthException;
import io.kuberde.auth.CachingTokenSource;
import io.kuberde.model.RouteKind;
import io.kuberde.util.Jsons;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * {@link RelayApi} over HTTP with a cached system credential. A {@code 401} drops the cached
 * credential so the next call fetches a fresh one.
 */
public final class HttpRelayApi implements RelayApi {
    private static final Duration REQUEST_TIMEOUT = Duration.ofSeconds(10);

    private final HttpClient http;
    private final String baseUrl;
    private final CachingTokenSource tokens;

    public HttpRelayApi(HttpClient http, String baseUrl, CachingTokenSource tokens) {
        this.http = http;
        this.baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        this.tokens = tokens;
    }

    @Override
    public List<ObservedRoute> listRoutes(String agentPrefix) throws IOException {
        JsonNode body = send("GET", "/mgmt/services?agentPrefix=" + encode(agentPrefix), null);
        List<ObservedRoute> out = new ArrayList<>();
        for (JsonNode row : body.path("routes")) {
            out.add(new ObservedRoute(
                    RouteKind.fromString(row.path("kind").asText("")),
                    row.path("key").asText(""),
                    row.path("agentID").asText(""),
                    row.path("service").asText(""),
                    row.path("parked").asBoolean(false)
            ));
        }
        return out;
    }

    @Override
    public void register(RouteKind kind, String key, String agentId, String service) throws IOException {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put(keyParam(kind), key);
        body.put("agentID", agentId);
        body.put("service", service);
        send("POST", "/mgmt/services/" + kind.wireName(), Jsons.toCompactJson(body));
    }

    @Override
    public void deregister(RouteKind kind, String key, boolean park) throws IOException {
        String query = keyParam(kind) + "=" + encode(key) + (park ? "&reason=idle" : "");
        try {
            send("DELETE", "/mgmt/services/" + kind.wireName() + "?" + query, null);
        } catch (RelayApiException e) {
            if (e.status() != 404) {
                throw e;
            }
        }
    }

    @Override
    public Optional<AgentActivity> agentActivity(String identity) throws IOException {
        JsonNode body;
        try {
            body = send("GET", "/mgmt/agents/" + encode(identity), null);
        } catch (RelayApiException e) {
            if (e.status() == 404) {
                return Optional.empty();
            }
            throw e;
        }
        Instant lastActivity = null;
        String raw = body.path("lastActivity").asText("");
        if (!raw.isBlank()) {
            try {
                lastActivity = Instant.parse(raw);
            } catch (DateTimeParseException e) {
                System.err.println("WARN relay reported an unreadable lastActivity for " + identity + ": " + raw);
            }
        }
        return Optional.of(new AgentActivity(
                body.path("agentID").asText(identity),
                body.path("online").asBoolean(false),
                lastActivity,
                body.path("activeConnections").asInt(0)
        ));
    }

    private JsonNode send(String method, String pathAndQuery, String jsonBody) throws IOException {
        String bearer;
        try {
            bearer = tokens.fetch().value();
        } catch (AuthException e) {
            throw new IOException("cannot obtain a relay credential: " + e.getMessage(), e);
        }
        HttpRequest.Builder builder = HttpRequest.newBuilder(URI.create(baseUrl + pathAndQuery))
                .timeout(REQUEST_TIMEOUT)
                .header("Authorization", "Bearer " + bearer)
                .header("Accept", "application/json");
        if (jsonBody == null) {
            builder.method(method, HttpRequest.BodyPublishers.noBody());
        } else {
            builder.header("Content-Type", "application/json");
            builder.method(method, HttpRequest.BodyPublishers.ofString(jsonBody));
        }
        HttpResponse<String> response;
        try {
            response = http.send(builder.build(), HttpResponse.BodyHandlers.ofString());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IOException("interrupted calling relay " + method + " " + pathAndQuery, e);
        }
        JsonNode body = parse(response.body());
        int status = response.statusCode();
        if (status == 401) {
            tokens.invalidate();
        }
        if (status >= 300) {
            String error = body.path("error").asText("");
            throw new RelayApiException(status, error, "relay " + method + " " + pathAndQuery + " answered " + status
                    + (error.isEmpty() ? "" : " (" + error + ")"));
        }
        return body;
    }

    private static JsonNode parse(String text) {
        if (text == null || text.isBlank()) {
            return Jsons.mapper().createObjectNode();
        }
        try {
            return Jsons.mapper().readTree(text);
        } catch (IOException e) {
            return Jsons.mapper().createObjectNode();
        }
    }

    private static String keyParam(RouteKind kind) {
        return kind == RouteKind.TCP ? "port" : "hostnamePrefix";
    }

    private static String encode(String value) {
        return URLEncoder.encode(value == null ? "" : value, StandardCharsets.UTF_8);
    }
}
