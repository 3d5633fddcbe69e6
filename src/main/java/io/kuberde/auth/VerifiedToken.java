package io.kuberde.auth;

import java.time.Instant;
import java.util.List;

public record VerifiedToken(
        String subjectId,
        String username,
        List<String> roles,
        Instant expiry,
        ActorKind kind,
        String sessionId,
        String agentId
) {
    public static final String ADMIN_ROLE = "admin";

    public VerifiedToken {
        roles = roles == null ? List.of() : List.copyOf(roles);
    }

    public boolean isAdmin() {
        return roles.contains(ADMIN_ROLE);
    }

    public boolean hasRole(String role) {
        return roles.contains(role);
    }

    /**
     * Name used in audit rows: the username when the issuer supplied one, the subject otherwise.
     */
    public String principal() {
        return username == null || username.isBlank() ? subjectId : username;
    }
}
