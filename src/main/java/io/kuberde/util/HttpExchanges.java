package io.kuberde.util;

import com.fasterxml.jackson.databind.JsonNode;
import com.sun.net.httpserver.HttpExchange;

import java.io.IOException;
import java.io.OutputStream;
import java.net.URI;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Request and response plumbing shared by the management API and the controller's HTTP server.
 */
public final class HttpExchanges {
    private static final int MAX_BODY_BYTES = 64 * 1024;

    private HttpExchanges() {
    }

    public static void writeJson(HttpExchange exchange, Object body, int status) throws IOException {
        byte[] bytes = Jsons.toCompactJson(body).getBytes(StandardCharsets.UTF_8);
        exchange.getResponseHeaders().set("Content-Type", "application/json; charset=utf-8");
        exchange.sendResponseHeaders(status, bytes.length);
        try (OutputStream os = exchange.getResponseBody()) {
            os.write(bytes);
        }
    }

    public static void writeText(HttpExchange exchange, String contentType, String body, int status) throws IOException {
        byte[] bytes = body.getBytes(StandardCharsets.UTF_8);
        exchange.getResponseHeaders().set("Content-Type", contentType);
        exchange.sendResponseHeaders(status, bytes.length);
        try (OutputStream os = exchange.getResponseBody()) {
            os.write(bytes);
        }
    }

    public static void redirect(HttpExchange exchange, String location) throws IOException {
        exchange.getResponseHeaders().set("Location", location);
        exchange.sendResponseHeaders(302, -1);
        exchange.close();
    }

    public static boolean allowMethods(HttpExchange exchange, String... methods) throws IOException {
        String method = exchange.getRequestMethod();
        for (String allowed : methods) {
            if (allowed.equalsIgnoreCase(method)) {
                return true;
            }
        }
        exchange.getResponseHeaders().set("Allow", String.join(",", methods));
        writeJson(exchange, Map.of("error", "method_not_allowed", "method", method == null ? "" : method), 405);
        return false;
    }

    public static String extractBearer(HttpExchange exchange) {
        String authz = exchange.getRequestHeaders().getFirst("Authorization");
        if (authz != null && authz.regionMatches(true, 0, "Bearer ", 0, 7)) {
            String token = authz.substring(7).trim();
            if (!token.isEmpty()) {
                return token;
            }
        }
        return null;
    }

    /**
     * {@code client_id:client_secret} from an HTTP Basic header, or {@code null}.
     */
    public static String[] extractBasic(HttpExchange exchange) {
        String authz = exchange.getRequestHeaders().getFirst("Authorization");
        if (authz == null || !authz.regionMatches(true, 0, "Basic ", 0, 6)) {
            return null;
        }
        try {
            String decoded = new String(Base64.getDecoder().decode(authz.substring(6).trim()), StandardCharsets.UTF_8);
            int idx = decoded.indexOf(':');
            if (idx <= 0) {
                return null;
            }
            return new String[]{
                    URLDecoder.decode(decoded.substring(0, idx), StandardCharsets.UTF_8),
                    URLDecoder.decode(decoded.substring(idx + 1), StandardCharsets.UTF_8)
            };
        } catch (IllegalArgumentException e) {
            return null;
        }
    }

    public static String cookie(HttpExchange exchange, String name) {
        for (String header : exchange.getRequestHeaders().getOrDefault("Cookie", List.of())) {
            String value = cookieValue(header, name);
            if (value != null) {
                return value;
            }
        }
        return null;
    }

    public static String cookieValue(String header, String name) {
        if (header == null) {
            return null;
        }
        for (String part : header.split(";")) {
            String pair = part.trim();
            int idx = pair.indexOf('=');
            if (idx > 0 && pair.substring(0, idx).trim().equals(name)) {
                String value = pair.substring(idx + 1).trim();
                return value.isEmpty() ? null : value;
            }
        }
        return null;
    }

    /**
     * Query parameters merged with a JSON object or form-encoded body.
     */
    public static Map<String, String> parseParams(HttpExchange exchange) throws IOException {
        Map<String, String> out = new LinkedHashMap<>(parseQuery(exchange.getRequestURI()));
        String method = exchange.getRequestMethod();
        if (!"POST".equalsIgnoreCase(method) && !"PUT".equalsIgnoreCase(method) && !"DELETE".equalsIgnoreCase(method)) {
            return out;
        }
        byte[] raw = exchange.getRequestBody().readNBytes(MAX_BODY_BYTES + 1);
        if (raw.length > MAX_BODY_BYTES) {
            throw new IOException("request body exceeds " + MAX_BODY_BYTES + " bytes");
        }
        String body = new String(raw, StandardCharsets.UTF_8).trim();
        if (body.isEmpty()) {
            return out;
        }
        String contentType = exchange.getRequestHeaders().getFirst("Content-Type");
        String normalized = contentType == null ? "" : contentType.toLowerCase(Locale.ROOT);
        if (normalized.contains("application/json") || body.startsWith("{")) {
            JsonNode node = Jsons.mapper().readTree(body);
            if (node != null && node.isObject()) {
                node.fieldNames().forEachRemaining(key -> {
                    JsonNode value = node.path(key);
                    if (value.isNull()) {
                        out.put(key, "");
                    } else if (value.isValueNode()) {
                        out.put(key, value.asText());
                    } else {
                        out.put(key, value.toString());
                    }
                });
            }
            return out;
        }
        out.putAll(parseQueryString(body));
        return out;
    }

    public static Map<String, String> parseQuery(URI uri) {
        return parseQueryString(uri.getRawQuery());
    }

    public static Map<String, String> parseQueryString(String query) {
        Map<String, String> out = new LinkedHashMap<>();
        if (query == null || query.isBlank()) {
            return out;
        }
        for (String pair : query.split("&")) {
            if (pair.isBlank()) {
                continue;
            }
            int idx = pair.indexOf('=');
            if (idx < 0) {
                out.put(URLDecoder.decode(pair, StandardCharsets.UTF_8), "");
            } else {
                out.put(URLDecoder.decode(pair.substring(0, idx), StandardCharsets.UTF_8),
                        URLDecoder.decode(pair.substring(idx + 1), StandardCharsets.UTF_8));
            }
        }
        return out;
    }
}
