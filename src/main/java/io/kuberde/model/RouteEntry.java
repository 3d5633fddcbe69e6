package io.kuberde.model;

/**
 * One routing table row. For TCP routes {@code key} is the external port in decimal, for HTTP routes
 * it is the hostname prefix.
 */
public record RouteEntry(
        RouteKind kind,
        String key,
        String agentId,
        String service,
        String registeredBy,
        long registeredAtMs
) {
    public boolean sameTarget(RouteEntry other) {
        return other != null
                && kind == other.kind
                && key.equals(other.key)
                && agentId.equals(other.agentId)
                && service.equals(other.service);
    }
}
