package io.kuberde.model;

import java.util.Locale;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Stable name of a workload or one of its services: {@code user-{owner}-{workload}[-{service}]}.
 * The owner never contains {@code -}, so the owner segment can be recovered from any identity.
 */
public record AgentIdentity(String owner, String workload, String service) {
    public static final String PREFIX = "user-";

    private static final Pattern OWNER = Pattern.compile("^[a-z0-9]([a-z0-9]{0,62})$");
    private static final Pattern LABEL = Pattern.compile("^[a-z0-9]([-a-z0-9]{0,61}[a-z0-9])?$");
    private static final Pattern IDENTITY = Pattern.compile("^[a-z0-9]([-a-z0-9]{0,251}[a-z0-9])?$");

    public AgentIdentity {
        Objects.requireNonNull(owner, "owner");
        Objects.requireNonNull(workload, "workload");
        if (!isValidOwner(owner)) {
            throw new IllegalArgumentException("Invalid owner: " + owner);
        }
        if (!isValidLabel(workload)) {
            throw new IllegalArgumentException("Invalid workload name: " + workload);
        }
        if (service != null && !isValidLabel(service)) {
            throw new IllegalArgumentException("Invalid service name: " + service);
        }
    }

    public static AgentIdentity of(String owner, String workload) {
        return new AgentIdentity(normalize(owner), normalize(workload), null);
    }

    public AgentIdentity forService(String serviceName) {
        return new AgentIdentity(owner, workload, normalize(serviceName));
    }

    public AgentIdentity workloadIdentity() {
        return service == null ? this : new AgentIdentity(owner, workload, null);
    }

    public String value() {
        String base = PREFIX + owner + "-" + workload;
        return service == null ? base : base + "-" + service;
    }

    /**
     * Owner segment of an identity string, or {@code null} when the value is not a user identity.
     */
    public static String ownerOf(String identity) {
        if (identity == null || !identity.startsWith(PREFIX)) {
            return null;
        }
        String[] parts = identity.split("-", 3);
        if (parts.length < 3 || parts[1].isEmpty() || parts[2].isEmpty()) {
            return null;
        }
        return parts[1];
    }

    public static boolean isValidOwner(String raw) {
        return raw != null && OWNER.matcher(raw).matches();
    }

    public static boolean isValidLabel(String raw) {
        return raw != null && LABEL.matcher(raw).matches();
    }

    /**
     * Shape check for identities received on the wire; ownership is not checked here.
     */
    public static boolean isValidIdentity(String raw) {
        return raw != null && IDENTITY.matcher(raw).matches();
    }

    @Override
    public String toString() {
        return value();
    }

    private static String normalize(String raw) {
        return raw == null ? null : raw.trim().toLowerCase(Locale.ROOT);
    }
}
