package io.kuberde.relay;

import io.kuberde.model.RouteEntry;

/**
 * The key is already bound, live or parked, to a service of another workload.
 */
public final class RouteConflictException extends Exception {
    private final RouteEntry existing;

    public RouteConflictException(RouteEntry existing) {
        super("route " + existing.kind().wireName() + ":" + existing.key() + " is bound to " + existing.agentId());
        this.existing = existing;
    }

    public RouteEntry existing() {
        return existing;
    }
}
