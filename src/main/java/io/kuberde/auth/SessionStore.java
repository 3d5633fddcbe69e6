package io.kuberde.auth;

import java.security.SecureRandom;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.HexFormat;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Server-side record of interactive browser sessions. A {@code session} token is only accepted
 * while its record is present, which makes logout effective before the token expires.
 */
public final class SessionStore {
    private static final SecureRandom RANDOM = new SecureRandom();

    private final Clock clock;
    private final Map<String, SessionRecord> sessions = new HashMap<>();

    public SessionStore(Clock clock) {
        this.clock = clock;
    }

    public synchronized SessionRecord create(String subjectId, String username, List<String> roles, Duration ttl) {
        byte[] raw = new byte[18];
        RANDOM.nextBytes(raw);
        String id = HexFormat.of().formatHex(raw);
        Instant now = clock.instant();
        SessionRecord record = new SessionRecord(id, subjectId, username, roles == null ? List.of() : List.copyOf(roles),
                now, now.plus(ttl));
        sessions.put(id, record);
        return record;
    }

    public synchronized boolean isActive(String sessionId) {
        if (sessionId == null) {
            return false;
        }
        SessionRecord record = sessions.get(sessionId);
        if (record == null) {
            return false;
        }
        if (!clock.instant().isBefore(record.expiresAt())) {
            sessions.remove(sessionId);
            return false;
        }
        return true;
    }

    public synchronized Optional<SessionRecord> find(String sessionId) {
        return Optional.ofNullable(sessionId == null ? null : sessions.get(sessionId));
    }

    public synchronized boolean revoke(String sessionId) {
        return sessionId != null && sessions.remove(sessionId) != null;
    }

    public synchronized int purgeExpired() {
        Instant now = clock.instant();
        int removed = 0;
        Iterator<SessionRecord> it = sessions.values().iterator();
        while (it.hasNext()) {
            if (!now.isBefore(it.next().expiresAt())) {
                it.remove();
                removed++;
            }
        }
        return removed;
    }

    public synchronized int size() {
        return sessions.size();
    }

    public record SessionRecord(
            String id,
            String subjectId,
            String username,
            List<String> roles,
            Instant createdAt,
            Instant expiresAt
    ) {
    }
}
