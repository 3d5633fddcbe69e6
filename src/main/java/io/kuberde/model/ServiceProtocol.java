package io.kuberde.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum ServiceProtocol {
    TCP,
    HTTP;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static ServiceProtocol fromString(String raw) {
        if (raw == null || raw.isBlank()) {
            return TCP;
        }
        for (ServiceProtocol value : values()) {
            if (value.name().equalsIgnoreCase(raw.trim())) {
                return value;
            }
        }
        throw new IllegalArgumentException("Unknown protocol: " + raw);
    }
}
