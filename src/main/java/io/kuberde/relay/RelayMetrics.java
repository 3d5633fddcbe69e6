package io.kuberde.relay;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Process-wide relay counters plus live gauges read from the routing table and session registry.
 */
public final class RelayMetrics {
    private final RoutingTable routes;
    private final SessionRegistry sessions;
    private final AtomicLong activeStreams = new AtomicLong();
    private final AtomicLong streamsOpened = new AtomicLong();
    private final AtomicLong bytesIn = new AtomicLong();
    private final AtomicLong bytesOut = new AtomicLong();
    private final AtomicLong authFailures = new AtomicLong();
    private final AtomicLong scaleUpSignals = new AtomicLong();
    private final AtomicLong sessionsSwept = new AtomicLong();
    private final AtomicLong routesWithoutSession = new AtomicLong();
    private final Map<String, AtomicLong> rejected = new ConcurrentHashMap<>();

    public RelayMetrics(RoutingTable routes, SessionRegistry sessions) {
        this.routes = routes;
        this.sessions = sessions;
        for (RelayException.Reason reason : RelayException.Reason.values()) {
            rejected.put(reason.code(), new AtomicLong());
        }
    }

    public long liveSessions() {
        return sessions.liveCount();
    }

    public long agentsSeen() {
        return sessions.statsCount();
    }

    public Map<String, Long> routesByKind() {
        return routes.countByKind();
    }

    public long parkedRoutes() {
        return routes.parkedCount();
    }

    public long routesWithoutSession() {
        return routesWithoutSession.get();
    }

    public long activeStreams() {
        return activeStreams.get();
    }

    public long streamsOpened() {
        return streamsOpened.get();
    }

    public long bytesIn() {
        return bytesIn.get();
    }

    public long bytesOut() {
        return bytesOut.get();
    }

    public Map<String, Long> rejectedByReason() {
        Map<String, Long> out = new LinkedHashMap<>();
        for (RelayException.Reason reason : RelayException.Reason.values()) {
            out.put(reason.code(), rejected.get(reason.code()).get());
        }
        return out;
    }

    public long authFailures() {
        return authFailures.get();
    }

    public long scaleUpSignals() {
        return scaleUpSignals.get();
    }

    public long sessionsSwept() {
        return sessionsSwept.get();
    }

    void streamOpened() {
        streamsOpened.incrementAndGet();
        activeStreams.incrementAndGet();
    }

    void streamClosed() {
        activeStreams.decrementAndGet();
    }

    void addBytes(long in, long out) {
        bytesIn.addAndGet(in);
        bytesOut.addAndGet(out);
    }

    void rejected(RelayException.Reason reason) {
        rejected.get(reason.code()).incrementAndGet();
    }

    void authFailure() {
        authFailures.incrementAndGet();
    }

    void scaleUpSignal() {
        scaleUpSignals.incrementAndGet();
    }

    void sessionsSwept(int count) {
        sessionsSwept.addAndGet(count);
    }

    void routesWithoutSession(long count) {
        routesWithoutSession.set(count);
    }
}
