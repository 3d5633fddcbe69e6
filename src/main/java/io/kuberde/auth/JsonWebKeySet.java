package io.kuberde.auth;

import com.fasterxml.jackson.databind.JsonNode;
import io.kuberde.util.Hashing;
import io.kuberde.util.Jsons;

import java.io.IOException;
import java.math.BigInteger;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.GeneralSecurityException;
import java.security.KeyFactory;
import java.security.PublicKey;
import java.security.SecureRandom;
import java.security.spec.RSAPublicKeySpec;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Verification keys indexed by {@code kid}. RSA keys come from an identity provider's published
 * set; {@code oct} keys are the relay's own HS256 secrets and are also used for signing.
 */
public final class JsonWebKeySet {
    private static final SecureRandom RANDOM = new SecureRandom();

    private final Map<String, Key> keys;

    private JsonWebKeySet(Map<String, Key> keys) {
        this.keys = Map.copyOf(keys);
        if (keys.isEmpty()) {
            throw new IllegalArgumentException("key set is empty");
        }
    }

    public static JsonWebKeySet load(Path file) throws IOException {
        return parse(Files.readString(file, StandardCharsets.UTF_8));
    }

    public static JsonWebKeySet fetch(HttpClient client, URI jwksUri) throws IOException {
        HttpRequest request = HttpRequest.newBuilder(jwksUri).timeout(Duration.ofSeconds(10)).GET().build();
        try {
            HttpResponse<String> response = client.send(request, HttpResponse.BodyHandlers.ofString());
            if (response.statusCode() != 200) {
                throw new IOException("JWKS fetch from " + jwksUri + " returned HTTP " + response.statusCode());
            }
            return parse(response.body());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IOException("Interrupted while fetching JWKS from " + jwksUri, e);
        }
    }

    public static JsonWebKeySet parse(String json) throws IOException {
        JsonNode root = Jsons.mapper().readTree(json);
        JsonNode items = root.path("keys");
        if (!items.isArray()) {
            throw new IOException("JWKS document has no keys array");
        }
        Map<String, Key> out = new LinkedHashMap<>();
        for (JsonNode item : items) {
            String kid = item.path("kid").asText("").trim();
            if (kid.isEmpty()) {
                throw new IOException("JWKS key without kid");
            }
            String kty = item.path("kty").asText("");
            String use = item.path("use").asText("sig");
            if (!"sig".equals(use)) {
                continue;
            }
            if ("RSA".equals(kty)) {
                out.put(kid, new Key(kid, "RS256", rsaPublicKey(item), null));
            } else if ("oct".equals(kty)) {
                byte[] secret = Hashing.fromBase64Url(item.path("k").asText(""));
                if (secret.length < 32) {
                    throw new IOException("oct key " + kid + " is shorter than 256 bits");
                }
                out.put(kid, new Key(kid, "HS256", null, secret));
            }
        }
        return new JsonWebKeySet(out);
    }

    public static JsonWebKeySet generateHs256(String kid) {
        byte[] secret = new byte[32];
        RANDOM.nextBytes(secret);
        return new JsonWebKeySet(Map.of(kid, new Key(kid, "HS256", null, secret)));
    }

    public static JsonWebKeySet merge(JsonWebKeySet first, JsonWebKeySet second) {
        if (first == null) {
            return second;
        }
        if (second == null) {
            return first;
        }
        Map<String, Key> out = new LinkedHashMap<>(first.keys);
        for (Map.Entry<String, Key> e : second.keys.entrySet()) {
            if (out.putIfAbsent(e.getKey(), e.getValue()) != null) {
                throw new IllegalArgumentException("Duplicate key id across key sets: " + e.getKey());
            }
        }
        return new JsonWebKeySet(out);
    }

    public Optional<Key> find(String kid) {
        if (kid == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(keys.get(kid));
    }

    /**
     * First symmetric key, in document order; used by {@link TokenIssuer}.
     */
    public Key signingKey() {
        List<Key> symmetric = new ArrayList<>();
        for (Key key : keys.values()) {
            if (key.secret() != null) {
                symmetric.add(key);
            }
        }
        if (symmetric.isEmpty()) {
            throw new IllegalStateException("key set has no HS256 signing key");
        }
        return symmetric.get(0);
    }

    public int size() {
        return keys.size();
    }

    /**
     * Serializes symmetric keys only; provider keys are never written back.
     */
    public String toJson() {
        List<Map<String, Object>> rows = new ArrayList<>();
        for (Key key : keys.values()) {
            if (key.secret() == null) {
                continue;
            }
            Map<String, Object> row = new LinkedHashMap<>();
            row.put("kty", "oct");
            row.put("kid", key.kid());
            row.put("alg", "HS256");
            row.put("use", "sig");
            row.put("k", Hashing.base64Url(key.secret()));
            rows.add(row);
        }
        return Jsons.toJson(Map.of("keys", rows));
    }

    private static PublicKey rsaPublicKey(JsonNode item) throws IOException {
        try {
            BigInteger modulus = new BigInteger(1, Hashing.fromBase64Url(item.path("n").asText("")));
            BigInteger exponent = new BigInteger(1, Hashing.fromBase64Url(item.path("e").asText("")));
            return KeyFactory.getInstance("RSA").generatePublic(new RSAPublicKeySpec(modulus, exponent));
        } catch (GeneralSecurityException | IllegalArgumentException e) {
            throw new IOException("Invalid RSA key " + item.path("kid").asText(""), e);
        }
    }

    public record Key(String kid, String algorithm, PublicKey publicKey, byte[] secret) {
    }
}
