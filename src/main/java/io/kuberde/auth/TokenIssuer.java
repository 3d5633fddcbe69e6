package io.kuberde.auth;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Mints HS256 tokens with the first symmetric key of the local key set.
 */
public final class TokenIssuer {
    private final JsonWebKeySet keys;
    private final String issuer;
    private final Clock clock;

    public TokenIssuer(JsonWebKeySet keys, String issuer, Clock clock) {
        this.keys = keys;
        this.issuer = issuer == null || issuer.isBlank() ? "kuberde-relay" : issuer.trim();
        this.clock = clock;
        keys.signingKey();
    }

    public AccessToken issue(TokenRequest request) {
        if (request.subject() == null || request.subject().isBlank()) {
            throw new IllegalArgumentException("subject is required");
        }
        if (request.ttl() == null || request.ttl().isNegative() || request.ttl().isZero()) {
            throw new IllegalArgumentException("token ttl must be positive");
        }
        Instant now = clock.instant();
        Instant expiresAt = now.plus(request.ttl());
        Map<String, Object> claims = new LinkedHashMap<>();
        claims.put("iss", issuer);
        claims.put("sub", request.subject());
        if (request.username() != null && !request.username().isBlank()) {
            claims.put("preferred_username", request.username());
        }
        claims.put("kind", request.kind().claimValue());
        claims.put("roles", request.roles() == null ? List.of() : request.roles());
        claims.put("iat", now.getEpochSecond());
        claims.put("nbf", now.getEpochSecond());
        claims.put("exp", expiresAt.getEpochSecond());
        if (request.sessionId() != null) {
            claims.put("sid", request.sessionId());
        }
        if (request.agentId() != null && !request.agentId().isBlank()) {
            claims.put("agent_id", request.agentId());
        }
        JsonWebKeySet.Key key = keys.signingKey();
        String value = JwtCodec.signHs256(key.kid(), key.secret(), claims);
        return new AccessToken(value, Instant.ofEpochSecond(now.getEpochSecond()), Instant.ofEpochSecond(expiresAt.getEpochSecond()));
    }

    public String issuer() {
        return issuer;
    }

    public record TokenRequest(
            String subject,
            String username,
            ActorKind kind,
            List<String> roles,
            String agentId,
            String sessionId,
            Duration ttl
    ) {
        public TokenRequest {
            kind = kind == null ? ActorKind.USER : kind;
        }

        public static TokenRequest system(String subject, Duration ttl) {
            return new TokenRequest(subject, subject, ActorKind.SYSTEM, List.of(VerifiedToken.ADMIN_ROLE), null, null, ttl);
        }

        public static TokenRequest agent(String subject, String agentId, Duration ttl) {
            return new TokenRequest(subject, subject, ActorKind.AGENT, List.of(), agentId, null, ttl);
        }
    }
}
