package io.kuberde.auth;

import com.fasterxml.jackson.databind.JsonNode;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Stateless bearer verification against a key set, plus the session-record check for browser
 * session tokens.
 */
public final class TokenVerifier {
    public static final Duration DEFAULT_CLOCK_SKEW = Duration.ofSeconds(30);
    static final String SERVICE_ACCOUNT_PREFIX = "service-account-";

    private final JsonWebKeySet keys;
    private final Set<String> issuers;
    private final Duration clockSkew;
    private final Clock clock;
    private final SessionStore sessions;

    public TokenVerifier(JsonWebKeySet keys, Set<String> issuers, Duration clockSkew, Clock clock, SessionStore sessions) {
        this.keys = keys;
        this.issuers = issuers == null ? Set.of() : Set.copyOf(issuers);
        this.clockSkew = clockSkew == null ? DEFAULT_CLOCK_SKEW : clockSkew;
        this.clock = clock;
        this.sessions = sessions;
    }

    public VerifiedToken verify(String token) throws AuthException {
        JwtCodec.Parsed parsed = JwtCodec.parse(token);
        JwtCodec.verifySignature(parsed, keys);
        JsonNode claims = parsed.claims();

        Instant now = clock.instant();
        if (!claims.path("exp").canConvertToLong()) {
            throw AuthException.invalid("token has no exp claim");
        }
        Instant expiry = Instant.ofEpochSecond(claims.path("exp").asLong());
        if (!now.isBefore(expiry.plus(clockSkew))) {
            throw AuthException.expired("token expired at " + expiry);
        }
        if (claims.path("nbf").canConvertToLong()) {
            Instant notBefore = Instant.ofEpochSecond(claims.path("nbf").asLong());
            if (now.plus(clockSkew).isBefore(notBefore)) {
                throw AuthException.invalid("token not valid before " + notBefore);
            }
        }
        if (!issuers.isEmpty() && !issuers.contains(claims.path("iss").asText(""))) {
            throw AuthException.invalid("untrusted issuer: " + claims.path("iss").asText(""));
        }

        String subject = claims.path("sub").asText("").trim();
        if (subject.isEmpty()) {
            throw AuthException.invalid("token has no sub claim");
        }
        String username = claims.path("preferred_username").asText("").trim();
        ActorKind kind = resolveKind(claims, username);
        String sessionId = textOrNull(claims.path("sid"));
        if (kind == ActorKind.SESSION) {
            if (sessions == null || !sessions.isActive(sessionId)) {
                throw AuthException.invalid("browser session is not active");
            }
        }
        return new VerifiedToken(
                subject,
                username.isEmpty() ? null : username,
                roles(claims),
                expiry,
                kind,
                sessionId,
                textOrNull(claims.path("agent_id"))
        );
    }

    /**
     * Signature-only view used where an expired or revoked token must still be attributed.
     */
    public JsonWebKeySet keys() {
        return keys;
    }

    private static ActorKind resolveKind(JsonNode claims, String username) throws AuthException {
        String raw = claims.path("kind").asText("");
        if (raw.isBlank()) {
            // Provider-issued client-credential tokens carry no kind claim.
            return username.startsWith(SERVICE_ACCOUNT_PREFIX) ? ActorKind.AGENT : ActorKind.USER;
        }
        try {
            return ActorKind.fromString(raw);
        } catch (IllegalArgumentException e) {
            throw AuthException.invalid("unknown kind claim: " + raw);
        }
    }

    private static List<String> roles(JsonNode claims) {
        List<String> out = new ArrayList<>();
        collect(claims.path("roles"), out);
        collect(claims.path("realm_access").path("roles"), out);
        return out;
    }

    private static void collect(JsonNode node, List<String> out) {
        if (!node.isArray()) {
            return;
        }
        for (JsonNode role : node) {
            String value = role.asText("").trim();
            if (!value.isEmpty() && !out.contains(value)) {
                out.add(value);
            }
        }
    }

    private static String textOrNull(JsonNode node) {
        if (node == null || node.isMissingNode() || node.isNull()) {
            return null;
        }
        String value = node.asText("").trim();
        return value.isEmpty() ? null : value;
    }
}
