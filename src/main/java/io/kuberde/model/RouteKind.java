package io.kuberde.model;

import java.util.Locale;

public enum RouteKind {
    TCP,
    HTTP;

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static RouteKind of(ServiceProtocol protocol) {
        return protocol == ServiceProtocol.HTTP ? HTTP : TCP;
    }

    public static RouteKind fromString(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("route kind is required");
        }
        for (RouteKind value : values()) {
            if (value.name().equalsIgnoreCase(raw.trim())) {
                return value;
            }
        }
        throw new IllegalArgumentException("Unknown route kind: " + raw);
    }
}
