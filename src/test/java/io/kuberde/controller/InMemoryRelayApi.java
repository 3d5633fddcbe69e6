package io.kuberde.controller;

import io.kuberde.model.RouteEntry;
import io.kuberde.model.RouteKind;
import io.kuberde.relay.RouteConflictException;
import io.kuberde.relay.RoutingTable;

import java.io.IOException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Relay double over a real {@link RoutingTable}, so ownership conflicts follow the relay's rule.
 * Keeps per-identity activity on the side.
 */
final class InMemoryRelayApi implements RelayApi {
    static final String REGISTRANT = "kuberde-controller";

    private final RoutingTable routes = new RoutingTable(null, null);
    private final Map<String, AgentActivity> activity = new HashMap<>();
    private final Set<String> brokenKeys = new HashSet<>();
    private final List<String> calls = new ArrayList<>();
    private IOException activityFailure;

    synchronized void online(String identity, Instant lastActivity) {
        activity.put(identity, new AgentActivity(identity, true, lastActivity, 0));
    }

    synchronized void offline(String identity) {
        activity.remove(identity);
    }

    synchronized void failActivity(IOException error) {
        activityFailure = error;
    }

    synchronized void heldByOtherAgent(RouteKind kind, String key) throws RouteConflictException {
        routes.register(kind, key, "user-mallory-box-held", "held", "someone-else");
    }

    synchronized void failRegistration(RouteKind kind, String key) {
        brokenKeys.add(kind.wireName() + ":" + key);
    }

    synchronized void seed(ObservedRoute route) throws RouteConflictException {
        routes.register(route.kind(), route.key(), route.agentId(), route.service(), REGISTRANT);
        if (route.parked()) {
            routes.park(route.kind(), route.key());
        }
    }

    synchronized ObservedRoute route(RouteKind kind, String key) {
        Optional<RouteEntry> live = routes.find(kind, key);
        if (live.isPresent()) {
            return observed(live.get(), false);
        }
        return routes.findParked(kind, key).map(entry -> observed(entry, true)).orElse(null);
    }

    synchronized int size() {
        return routes.size() + routes.parkedCount();
    }

    synchronized List<String> calls() {
        return new ArrayList<>(calls);
    }

    synchronized void clearCalls() {
        calls.clear();
    }

    @Override
    public synchronized List<ObservedRoute> listRoutes(String agentPrefix) {
        List<ObservedRoute> out = new ArrayList<>();
        for (RouteEntry entry : routes.listByPrefix(agentPrefix)) {
            out.add(observed(entry, false));
        }
        for (RouteEntry entry : routes.parkedByPrefix(agentPrefix)) {
            out.add(observed(entry, true));
        }
        return out;
    }

    @Override
    public synchronized void register(RouteKind kind, String key, String agentId, String service) throws IOException {
        String routeKey = kind.wireName() + ":" + key;
        if (brokenKeys.contains(routeKey)) {
            throw new RelayApiException(503, "unavailable", "relay answered 503");
        }
        try {
            routes.register(kind, key, agentId, service, REGISTRANT);
        } catch (RouteConflictException e) {
            calls.add("conflict " + routeKey + " held by " + e.existing().agentId());
            throw new RelayApiException(409, "route_conflict", routeKey + " is bound to " + e.existing().agentId());
        }
        calls.add("register " + routeKey + " -> " + agentId + "/" + service);
    }

    @Override
    public synchronized void deregister(RouteKind kind, String key, boolean park) throws IOException {
        String routeKey = kind.wireName() + ":" + key;
        Optional<RouteEntry> removed = park ? routes.park(kind, key) : routes.deregister(kind, key);
        if (removed.isEmpty()) {
            throw new RelayApiException(404, "not_found", routeKey);
        }
        calls.add((park ? "park " : "remove ") + routeKey);
    }

    @Override
    public synchronized Optional<AgentActivity> agentActivity(String identity) throws IOException {
        if (activityFailure != null) {
            throw activityFailure;
        }
        return Optional.ofNullable(activity.get(identity));
    }

    private static ObservedRoute observed(RouteEntry entry, boolean parked) {
        return new ObservedRoute(entry.kind(), entry.key(), entry.agentId(), entry.service(), parked);
    }
}
