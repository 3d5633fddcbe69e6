package io.kuberde.auth;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

final class StoredTokenTest {

    @Test
    void savedTokenLoadsBackWithExpiry(@TempDir Path dir) throws Exception {
        Path file = dir.resolve("nested").resolve("token.json");
        Assertions.assertTrue(StoredToken.load(file).isEmpty());

        StoredToken token = new StoredToken("at-1", null, Instant.parse("2025-03-01T10:05:00Z"), "rt-1");
        token.save(file);
        StoredToken loaded = StoredToken.load(file).orElseThrow();

        Assertions.assertEquals("at-1", loaded.accessToken());
        Assertions.assertEquals("Bearer", loaded.tokenType());
        Assertions.assertEquals("rt-1", loaded.refreshToken());
        Assertions.assertFalse(loaded.expired(Instant.parse("2025-03-01T10:04:59Z")));
        Assertions.assertTrue(loaded.expired(Instant.parse("2025-03-01T10:05:00Z")));
        Assertions.assertFalse(loaded.toString().contains("at-1"));
    }

    @Test
    void bearerExpiryComesFromItsClaims() throws Exception {
        Instant now = Instant.parse("2025-03-01T10:00:00Z");
        TokenIssuer issuer = new TokenIssuer(JsonWebKeySet.generateHs256("k1"), "kuberde-relay", Clock.fixed(now, ZoneOffset.UTC));
        AccessToken issued = issuer.issue(new TokenIssuer.TokenRequest("alice-id", "alice", ActorKind.USER, List.of(),
                null, null, Duration.ofMinutes(30)));

        StoredToken token = StoredToken.fromBearer(" " + issued.value() + "\n");
        Assertions.assertEquals(issued.value(), token.accessToken());
        Assertions.assertEquals(issued.expiresAt(), token.expiresAt());
        Assertions.assertThrows(AuthException.class, () -> StoredToken.fromBearer("not-a-jwt"));
    }

    @Test
    void fileWithoutAccessTokenIsRejected(@TempDir Path dir) throws Exception {
        Path file = dir.resolve("token.json");
        Files.writeString(file, "{\"token_type\":\"Bearer\"}");
        Assertions.assertThrows(IOException.class, () -> StoredToken.load(file));
    }
}
