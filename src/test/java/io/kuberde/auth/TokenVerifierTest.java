package io.kuberde.auth;

import io.kuberde.MutableClock;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

final class TokenVerifierTest {
    private static final Instant START = Instant.parse("2025-03-01T10:00:00Z");

    @Test
    void acceptsIssuedAgentTokenAndKeepsClaims() throws Exception {
        MutableClock clock = new MutableClock(START);
        JsonWebKeySet keys = JsonWebKeySet.generateHs256("k1");
        TokenIssuer issuer = new TokenIssuer(keys, "kuberde-relay", clock);
        TokenVerifier verifier = new TokenVerifier(keys, Set.of("kuberde-relay"), Duration.ZERO, clock, null);

        AccessToken token = issuer.issue(TokenIssuer.TokenRequest.agent("agent-alice", "user-alice-dev", Duration.ofMinutes(5)));
        VerifiedToken verified = verifier.verify(token.value());

        Assertions.assertEquals("agent-alice", verified.subjectId());
        Assertions.assertEquals(ActorKind.AGENT, verified.kind());
        Assertions.assertEquals("user-alice-dev", verified.agentId());
        Assertions.assertEquals(START.plus(Duration.ofMinutes(5)), verified.expiry());
    }

    @Test
    void expiredTokenIsReportedAsExpiredAfterSkew() throws Exception {
        MutableClock clock = new MutableClock(START);
        JsonWebKeySet keys = JsonWebKeySet.generateHs256("k1");
        TokenIssuer issuer = new TokenIssuer(keys, "kuberde-relay", clock);
        TokenVerifier verifier = new TokenVerifier(keys, Set.of(), Duration.ofSeconds(30), clock, null);
        String token = issuer.issue(TokenIssuer.TokenRequest.system("controller", Duration.ofMinutes(1))).value();

        clock.advance(Duration.ofSeconds(80));
        Assertions.assertEquals(ActorKind.SYSTEM, verifier.verify(token).kind());

        clock.advance(Duration.ofSeconds(20));
        AuthException error = Assertions.assertThrows(AuthException.class, () -> verifier.verify(token));
        Assertions.assertEquals(AuthException.Kind.EXPIRED, error.kind());
        Assertions.assertEquals("expired_token", error.errorCode());
    }

    @Test
    void rejectsForeignKeyUntrustedIssuerAndGarbage() {
        MutableClock clock = new MutableClock(START);
        JsonWebKeySet trusted = JsonWebKeySet.generateHs256("k1");
        JsonWebKeySet foreign = JsonWebKeySet.generateHs256("k1");
        TokenVerifier verifier = new TokenVerifier(trusted, Set.of("kuberde-relay"), Duration.ZERO, clock, null);

        String forged = new TokenIssuer(foreign, "kuberde-relay", clock)
                .issue(TokenIssuer.TokenRequest.system("x", Duration.ofMinutes(1))).value();
        Assertions.assertEquals(AuthException.Kind.INVALID,
                Assertions.assertThrows(AuthException.class, () -> verifier.verify(forged)).kind());

        String otherIssuer = new TokenIssuer(trusted, "someone-else", clock)
                .issue(TokenIssuer.TokenRequest.system("x", Duration.ofMinutes(1))).value();
        Assertions.assertThrows(AuthException.class, () -> verifier.verify(otherIssuer));

        Assertions.assertThrows(AuthException.class, () -> verifier.verify("not-a-token"));
        Assertions.assertThrows(AuthException.class, () -> verifier.verify(""));
    }

    @Test
    void sessionTokenRequiresLiveSessionRecord() throws Exception {
        MutableClock clock = new MutableClock(START);
        JsonWebKeySet keys = JsonWebKeySet.generateHs256("k1");
        SessionStore sessions = new SessionStore(clock);
        TokenVerifier verifier = new TokenVerifier(keys, Set.of(), Duration.ZERO, clock, sessions);
        TokenIssuer issuer = new TokenIssuer(keys, "kuberde-relay", clock);
        SessionStore.SessionRecord record = sessions.create("sub-1", "alice", List.of(), Duration.ofHours(1));

        String token = issuer.issue(new TokenIssuer.TokenRequest("sub-1", "alice", ActorKind.SESSION, List.of(), null,
                record.id(), Duration.ofHours(1))).value();
        Assertions.assertEquals("alice", verifier.verify(token).principal());

        sessions.revoke(record.id());
        Assertions.assertThrows(AuthException.class, () -> verifier.verify(token));
    }

    @Test
    void providerTokenWithoutKindIsInferredFromUsername() throws Exception {
        MutableClock clock = new MutableClock(START);
        JsonWebKeySet keys = JsonWebKeySet.generateHs256("idp");
        TokenVerifier verifier = new TokenVerifier(keys, Set.of(), Duration.ZERO, clock, null);
        JsonWebKeySet.Key key = keys.signingKey();

        Map<String, Object> claims = new LinkedHashMap<>();
        claims.put("sub", "5f1c");
        claims.put("preferred_username", "service-account-kuberde-agent");
        claims.put("exp", START.plus(Duration.ofMinutes(5)).getEpochSecond());
        claims.put("realm_access", Map.of("roles", List.of("kuberde-agent")));
        VerifiedToken agent = verifier.verify(JwtCodec.signHs256(key.kid(), key.secret(), claims));
        Assertions.assertEquals(ActorKind.AGENT, agent.kind());
        Assertions.assertTrue(agent.hasRole(Authorizer.AGENT_ROLE));

        claims.put("preferred_username", "alice");
        VerifiedToken user = verifier.verify(JwtCodec.signHs256(key.kid(), key.secret(), claims));
        Assertions.assertEquals(ActorKind.USER, user.kind());
    }
}
