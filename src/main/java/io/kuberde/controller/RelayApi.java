package io.kuberde.controller;

import io.kuberde.model.RouteKind;

import java.io.IOException;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * The relay's management API as the controller uses it.
 */
public interface RelayApi {
    List<ObservedRoute> listRoutes(String agentPrefix) throws IOException;

    /**
     * Registers or re-activates a route; a parked route becomes live again.
     *
     * @throws RelayApiException with status 409 when another agent holds the key
     */
    void register(RouteKind kind, String key, String agentId, String service) throws IOException;

    /**
     * @param park keep the key reserved for the same target while the workload is idle
     */
    void deregister(RouteKind kind, String key, boolean park) throws IOException;

    Optional<AgentActivity> agentActivity(String identity) throws IOException;

    record ObservedRoute(RouteKind kind, String key, String agentId, String service, boolean parked) {
        public String routeKey() {
            return kind.wireName() + ":" + key;
        }
    }

    record AgentActivity(String agentId, boolean online, Instant lastActivity, int activeConnections) {
    }
}
