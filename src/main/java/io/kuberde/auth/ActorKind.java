package io.kuberde.auth;

import java.util.Locale;

public enum ActorKind {
    USER,
    SESSION,
    AGENT,
    SYSTEM;

    public String claimValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static ActorKind fromString(String raw) {
        if (raw == null || raw.isBlank()) {
            return USER;
        }
        for (ActorKind value : values()) {
            if (value.name().equalsIgnoreCase(raw.trim())) {
                return value;
            }
        }
        throw new IllegalArgumentException("Unknown actor kind: " + raw);
    }
}
