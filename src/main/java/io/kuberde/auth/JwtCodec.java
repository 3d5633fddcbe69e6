package io.kuberde.auth;

import com.fasterxml.jackson.databind.JsonNode;
import io.kuberde.util.Hashing;
import io.kuberde.util.Jsons;

import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.Signature;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Compact JWS encoding. Only HS256 and RS256 are accepted; anything else, {@code none} included,
 * is rejected before a key is looked up.
 */
public final class JwtCodec {
    private JwtCodec() {
    }

    public static String signHs256(String kid, byte[] secret, Map<String, Object> claims) {
        Map<String, Object> header = new LinkedHashMap<>();
        header.put("alg", "HS256");
        header.put("typ", "JWT");
        header.put("kid", kid);
        String signingInput = segment(header) + "." + segment(claims);
        byte[] signature = Hashing.hmacSha256(secret, signingInput.getBytes(StandardCharsets.US_ASCII));
        return signingInput + "." + Hashing.base64Url(signature);
    }

    public static Parsed parse(String token) throws AuthException {
        if (token == null || token.isBlank()) {
            throw AuthException.invalid("empty token");
        }
        String[] parts = token.trim().split("\\.", -1);
        if (parts.length != 3) {
            throw AuthException.invalid("token is not a compact JWS");
        }
        try {
            JsonNode header = Jsons.mapper().readTree(Hashing.fromBase64Url(parts[0]));
            JsonNode claims = Jsons.mapper().readTree(Hashing.fromBase64Url(parts[1]));
            if (header == null || !header.isObject() || claims == null || !claims.isObject()) {
                throw AuthException.invalid("token segments are not JSON objects");
            }
            byte[] signature = Hashing.fromBase64Url(parts[2]);
            String alg = header.path("alg").asText("");
            if (!"HS256".equals(alg) && !"RS256".equals(alg)) {
                throw AuthException.invalid("unsupported token algorithm: " + alg);
            }
            byte[] signingInput = (parts[0] + "." + parts[1]).getBytes(StandardCharsets.US_ASCII);
            return new Parsed(header, claims, alg, header.path("kid").asText(""), signingInput, signature);
        } catch (AuthException e) {
            throw e;
        } catch (Exception e) {
            throw new AuthException(AuthException.Kind.INVALID, "malformed token", e);
        }
    }

    public static void verifySignature(Parsed parsed, JsonWebKeySet keys) throws AuthException {
        JsonWebKeySet.Key key = keys.find(parsed.kid())
                .orElseThrow(() -> AuthException.invalid("unknown signing key: " + parsed.kid()));
        if (!key.algorithm().equals(parsed.algorithm())) {
            throw AuthException.invalid("algorithm does not match key " + key.kid());
        }
        boolean valid;
        if ("HS256".equals(parsed.algorithm())) {
            byte[] expected = Hashing.hmacSha256(key.secret(), parsed.signingInput());
            valid = Hashing.constantTimeEquals(expected, parsed.signature());
        } else {
            try {
                Signature verifier = Signature.getInstance("SHA256withRSA");
                verifier.initVerify(key.publicKey());
                verifier.update(parsed.signingInput());
                valid = verifier.verify(parsed.signature());
            } catch (GeneralSecurityException e) {
                throw new AuthException(AuthException.Kind.INVALID, "signature check failed", e);
            }
        }
        if (!valid) {
            throw AuthException.invalid("bad token signature");
        }
    }

    private static String segment(Map<String, Object> value) {
        return Hashing.base64Url(Jsons.toCompactJson(value).getBytes(StandardCharsets.UTF_8));
    }

    public record Parsed(
            JsonNode header,
            JsonNode claims,
            String algorithm,
            String kid,
            byte[] signingInput,
            byte[] signature
    ) {
    }
}
