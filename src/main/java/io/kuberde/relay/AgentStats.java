package io.kuberde.relay;

import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Per-identity activity counters. They outlive sessions so the controller still sees the last
 * activity of a workload whose agent went away.
 */
public final class AgentStats {
    static final long ACTIVITY_THROTTLE_MS = 1_000L;

    private final String identity;
    private final Clock clock;
    private final AtomicInteger activeConnections = new AtomicInteger();
    private final AtomicLong bytesIn = new AtomicLong();
    private final AtomicLong bytesOut = new AtomicLong();
    private final AtomicLong lastActivityMs;
    private volatile boolean online;
    private volatile Instant connectedAt;

    AgentStats(String identity, Clock clock) {
        this.identity = identity;
        this.clock = clock;
        this.lastActivityMs = new AtomicLong(clock.millis());
    }

    public String identity() {
        return identity;
    }

    public boolean online() {
        return online;
    }

    public Instant lastActivity() {
        return Instant.ofEpochMilli(lastActivityMs.get());
    }

    public int activeConnections() {
        return activeConnections.get();
    }

    public long bytesIn() {
        return bytesIn.get();
    }

    public long bytesOut() {
        return bytesOut.get();
    }

    public Instant connectedAt() {
        return connectedAt;
    }

    void markOnline() {
        online = true;
        connectedAt = clock.instant();
    }

    void markOffline() {
        online = false;
    }

    /**
     * Records a user connection; opening a stream always counts as activity.
     */
    void streamOpened() {
        activeConnections.incrementAndGet();
        lastActivityMs.set(clock.millis());
    }

    void streamClosed() {
        activeConnections.updateAndGet(n -> Math.max(0, n - 1));
    }

    void addTraffic(long in, long out) {
        if (in > 0) {
            bytesIn.addAndGet(in);
        }
        if (out > 0) {
            bytesOut.addAndGet(out);
        }
        touch();
    }

    /**
     * Bumps the activity time at most once per second.
     */
    void touch() {
        long now = clock.millis();
        long last = lastActivityMs.get();
        if (now - last >= ACTIVITY_THROTTLE_MS) {
            lastActivityMs.compareAndSet(last, now);
        }
    }

    public Map<String, Object> toMap() {
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("agentID", identity);
        out.put("online", online);
        out.put("lastActivity", lastActivity().toString());
        out.put("hasActiveSession", activeConnections.get() > 0);
        out.put("activeConnections", activeConnections.get());
        out.put("bytesIn", bytesIn.get());
        out.put("bytesOut", bytesOut.get());
        out.put("connectedAt", connectedAt == null ? null : connectedAt.toString());
        return out;
    }
}
