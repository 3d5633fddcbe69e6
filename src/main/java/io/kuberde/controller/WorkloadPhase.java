package io.kuberde.controller;

public enum WorkloadPhase {
    PENDING("Pending"),
    RECONCILING("Reconciling"),
    READY("Ready"),
    IDLE("Idle"),
    TERMINATING("Terminating"),
    DELETED("Deleted"),
    ERROR("Error");

    private final String wireName;

    WorkloadPhase(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    public static WorkloadPhase fromString(String raw) {
        if (raw == null || raw.isBlank()) {
            return PENDING;
        }
        for (WorkloadPhase value : values()) {
            if (value.wireName.equalsIgnoreCase(raw.trim()) || value.name().equalsIgnoreCase(raw.trim())) {
                return value;
            }
        }
        throw new IllegalArgumentException("Unknown workload phase: " + raw);
    }
}
