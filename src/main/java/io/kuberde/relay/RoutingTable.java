package io.kuberde.relay;

import io.kuberde.model.AgentIdentity;
import io.kuberde.model.RouteEntry;
import io.kuberde.model.RouteKind;

import java.time.Clock;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.function.IntPredicate;
import java.util.function.Predicate;
import java.util.regex.Pattern;

/**
 * In-memory map of TCP ports and HTTP hostname prefixes to agent services. Every accessor holds the
 * table lock and hands out copies, never the backing maps.
 *
 * <p>Idle workloads keep a parked marker per key: connections on a parked key fail fast and
 * signal the controller, and a later registration clears the marker.
 */
public final class RoutingTable {
    private static final Pattern HOST_PREFIX = Pattern.compile(
            "^[a-z0-9]([-a-z0-9]{0,61}[a-z0-9])?(\\.[a-z0-9]([-a-z0-9]{0,61}[a-z0-9])?)*$");

    private final Map<RouteKey, RouteEntry> routes = new LinkedHashMap<>();
    private final Map<RouteKey, RouteEntry> parked = new LinkedHashMap<>();
    private final IntPredicate tcpPortAllowed;
    private final Clock clock;

    public RoutingTable(IntPredicate tcpPortAllowed, Clock clock) {
        this.tcpPortAllowed = tcpPortAllowed == null ? port -> port >= 1 && port <= 65535 : tcpPortAllowed;
        this.clock = clock == null ? Clock.systemUTC() : clock;
    }

    /**
     * Binds {@code key} to {@code (agentId, service)}. Re-registering the same mapping is a no-op.
     * A key held by another identity, live or parked, may only move between services of the same
     * workload; the registrant plays no part in that decision.
     *
     * @throws IllegalArgumentException when the key, identity or service is malformed
     * @throws RouteConflictException when the key belongs to another workload
     */
    public synchronized Registration register(
            RouteKind kind,
            String key,
            String agentId,
            String service,
            String registeredBy
    ) throws RouteConflictException {
        String normalized = normalizeKey(kind, key);
        if (agentId == null || agentId.isBlank()) {
            throw new IllegalArgumentException("agentID is required");
        }
        if (!AgentIdentity.isValidLabel(service)) {
            throw new IllegalArgumentException("Invalid service name: " + service);
        }
        RouteKey routeKey = new RouteKey(kind, normalized);
        RouteEntry candidate = new RouteEntry(
                kind,
                normalized,
                agentId.trim(),
                service,
                registeredBy == null ? "" : registeredBy,
                clock.millis()
        );
        RouteEntry existing = routes.get(routeKey);
        if (existing != null && existing.sameTarget(candidate)) {
            parked.remove(routeKey);
            return new Registration(Outcome.UNCHANGED, existing, null);
        }
        RouteEntry holder = existing != null ? existing : parked.get(routeKey);
        if (holder != null && !sameWorkload(holder, candidate)) {
            throw new RouteConflictException(holder);
        }
        parked.remove(routeKey);
        routes.put(routeKey, candidate);
        return new Registration(existing == null ? Outcome.CREATED : Outcome.REPLACED, candidate, existing);
    }

    /**
     * Workload identity a route serves: the agent id without its {@code -service} suffix.
     */
    static String workloadOf(RouteEntry entry) {
        String suffix = "-" + entry.service();
        String agentId = entry.agentId();
        if (agentId.endsWith(suffix) && agentId.length() > suffix.length()) {
            return agentId.substring(0, agentId.length() - suffix.length());
        }
        return agentId;
    }

    private static boolean sameWorkload(RouteEntry a, RouteEntry b) {
        return a.agentId().equals(b.agentId()) || workloadOf(a).equals(workloadOf(b));
    }

    /**
     * Removes the live entry and any parked marker.
     *
     * @return the removed entry (live preferred), empty when the key was unknown
     */
    public synchronized Optional<RouteEntry> deregister(RouteKind kind, String key) {
        RouteKey routeKey = new RouteKey(kind, normalizeKey(kind, key));
        RouteEntry live = routes.remove(routeKey);
        RouteEntry marker = parked.remove(routeKey);
        return Optional.ofNullable(live != null ? live : marker);
    }

    /**
     * Moves a live entry to the parked map. Parking an already parked key returns its marker.
     */
    public synchronized Optional<RouteEntry> park(RouteKind kind, String key) {
        RouteKey routeKey = new RouteKey(kind, normalizeKey(kind, key));
        RouteEntry live = routes.remove(routeKey);
        if (live != null) {
            parked.put(routeKey, live);
            return Optional.of(live);
        }
        return Optional.ofNullable(parked.get(routeKey));
    }

    public synchronized Optional<RouteEntry> find(RouteKind kind, String key) {
        return Optional.ofNullable(routes.get(new RouteKey(kind, key)));
    }

    public synchronized Optional<RouteEntry> findParked(RouteKind kind, String key) {
        return Optional.ofNullable(parked.get(new RouteKey(kind, key)));
    }

    public Optional<Resolution> resolvePort(int port) {
        String key = Integer.toString(port);
        synchronized (this) {
            RouteEntry live = routes.get(new RouteKey(RouteKind.TCP, key));
            if (live != null) {
                return Optional.of(new Resolution(live, false, false));
            }
            RouteEntry marker = parked.get(new RouteKey(RouteKind.TCP, key));
            if (marker != null) {
                return Optional.of(new Resolution(marker, true, false));
            }
        }
        return Optional.empty();
    }

    /**
     * Resolves an HTTP {@code Host} header. Explicit hostname prefixes win; otherwise the first
     * label is taken as the service and the remaining labels as the workload identity, which only
     * resolves while {@code hasLiveSession} accepts {@code workloadIdentity + "-" + service}.
     */
    public Optional<Resolution> resolveHost(String hostHeader, String agentDomain, Predicate<String> hasLiveSession) {
        String prefix = hostPrefix(hostHeader, agentDomain);
        if (prefix == null) {
            return Optional.empty();
        }
        RouteKey routeKey = new RouteKey(RouteKind.HTTP, prefix);
        synchronized (this) {
            RouteEntry live = routes.get(routeKey);
            if (live != null) {
                return Optional.of(new Resolution(live, false, false));
            }
            RouteEntry marker = parked.get(routeKey);
            if (marker != null) {
                return Optional.of(new Resolution(marker, true, false));
            }
        }
        int dot = prefix.indexOf('.');
        if (dot <= 0 || dot == prefix.length() - 1) {
            return Optional.empty();
        }
        String service = prefix.substring(0, dot);
        String workload = prefix.substring(dot + 1);
        if (workload.indexOf('.') >= 0 || !AgentIdentity.isValidLabel(service)) {
            return Optional.empty();
        }
        String identity = workload + "-" + service;
        if (hasLiveSession == null || !hasLiveSession.test(identity)) {
            return Optional.empty();
        }
        RouteEntry derived = new RouteEntry(RouteKind.HTTP, prefix, identity, service, "", clock.millis());
        return Optional.of(new Resolution(derived, false, true));
    }

    /**
     * Live routes whose identity starts with {@code agentPrefix}; a blank prefix lists all.
     */
    public synchronized List<RouteEntry> listByPrefix(String agentPrefix) {
        return filter(routes, agentPrefix);
    }

    public synchronized List<RouteEntry> parkedByPrefix(String agentPrefix) {
        return filter(parked, agentPrefix);
    }

    public synchronized Map<String, Long> countByKind() {
        Map<RouteKind, Long> counts = new EnumMap<>(RouteKind.class);
        for (RouteKind kind : RouteKind.values()) {
            counts.put(kind, 0L);
        }
        for (RouteEntry entry : routes.values()) {
            counts.merge(entry.kind(), 1L, Long::sum);
        }
        Map<String, Long> out = new LinkedHashMap<>();
        counts.forEach((kind, count) -> out.put(kind.wireName(), count));
        return out;
    }

    public synchronized int parkedCount() {
        return parked.size();
    }

    public synchronized int size() {
        return routes.size();
    }

    /**
     * Canonical key form: decimal port inside the allowed range, or a lower-case dotted hostname
     * prefix.
     */
    public String normalizeKey(RouteKind kind, String key) {
        if (kind == null) {
            throw new IllegalArgumentException("route kind is required");
        }
        if (key == null || key.isBlank()) {
            throw new IllegalArgumentException("route key is required");
        }
        String trimmed = key.trim();
        if (kind == RouteKind.TCP) {
            int port;
            try {
                port = Integer.parseInt(trimmed);
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Invalid port: " + key);
            }
            if (!tcpPortAllowed.test(port)) {
                throw new IllegalArgumentException("Port outside the allowed range: " + port);
            }
            return Integer.toString(port);
        }
        String host = trimmed.toLowerCase(Locale.ROOT);
        if (host.length() > 253 || !HOST_PREFIX.matcher(host).matches()) {
            throw new IllegalArgumentException("Invalid hostname prefix: " + key);
        }
        return host;
    }

    static String hostPrefix(String hostHeader, String agentDomain) {
        if (hostHeader == null || hostHeader.isBlank()) {
            return null;
        }
        String host = hostHeader.trim().toLowerCase(Locale.ROOT);
        int colon = host.lastIndexOf(':');
        if (colon > 0 && host.indexOf(']') < 0) {
            host = host.substring(0, colon);
        }
        while (host.endsWith(".")) {
            host = host.substring(0, host.length() - 1);
        }
        String domain = agentDomain == null ? "" : agentDomain;
        if (!domain.isEmpty()) {
            String suffix = "." + domain;
            if (!host.endsWith(suffix)) {
                return null;
            }
            host = host.substring(0, host.length() - suffix.length());
        }
        return host.isEmpty() ? null : host;
    }

    private static List<RouteEntry> filter(Map<RouteKey, RouteEntry> source, String agentPrefix) {
        String prefix = agentPrefix == null ? "" : agentPrefix.trim();
        List<RouteEntry> out = new ArrayList<>();
        for (RouteEntry entry : source.values()) {
            if (entry.agentId().startsWith(prefix)) {
                out.add(entry);
            }
        }
        return out;
    }

    public enum Outcome {
        CREATED,
        UNCHANGED,
        REPLACED
    }

    public record Registration(Outcome outcome, RouteEntry entry, RouteEntry previous) {
    }

    /**
     * @param parked  the workload is idle; the caller should fail fast and ask for a scale-up
     * @param derived resolved from the host labels rather than an explicit entry
     */
    public record Resolution(RouteEntry entry, boolean parked, boolean derived) {
    }

    private record RouteKey(RouteKind kind, String key) {
    }
}
