package io.kuberde.auth;

import java.time.Duration;
import java.time.Instant;

public record AccessToken(String value, Instant issuedAt, Instant expiresAt) {
    public Duration lifetime() {
        return Duration.between(issuedAt, expiresAt);
    }

    /**
     * Point in time after {@code fraction} of the validity window has elapsed.
     */
    public Instant refreshAt(double fraction) {
        long millis = (long) (lifetime().toMillis() * fraction);
        return issuedAt.plusMillis(Math.max(0L, millis));
    }

    @Override
    public String toString() {
        return "AccessToken[issuedAt=" + issuedAt + ", expiresAt=" + expiresAt + "]";
    }
}
