package io.kuberde.relay;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * At most one live session per identity. A session is reachable under its workload identity and
 * each per-service alias; admitting a new session evicts the older session of the same workload.
 * Stats are kept per workload identity and survive disconnects.
 */
public final class SessionRegistry {
    private final Map<String, AgentSession> byKey = new HashMap<>();
    private final Map<String, AgentStats> stats = new LinkedHashMap<>();
    private final Clock clock;

    public SessionRegistry(Clock clock) {
        this.clock = clock == null ? Clock.systemUTC() : clock;
    }

    /**
     * Registers {@code session} and returns the sessions it superseded. The caller closes them
     * outside the registry lock.
     *
     * <p>Only an older session of the same workload identity is superseded. A workload identity
     * always takes its key, leaving the other session's alias unrouted; an alias already held by
     * another workload's open session is not taken.
     */
    public synchronized List<AgentSession> admit(AgentSession session) {
        Set<AgentSession> superseded = new LinkedHashSet<>();
        for (String key : session.keys()) {
            AgentSession previous = byKey.get(key);
            if (previous != null && previous != session && previous.identity().equals(session.identity())) {
                superseded.add(previous);
            }
        }
        for (AgentSession previous : superseded) {
            byKey.values().removeIf(holder -> holder == previous);
        }
        for (String key : session.keys()) {
            AgentSession holder = byKey.get(key);
            if (holder != null && holder != session && holder.isOpen() && !key.equals(session.identity())) {
                System.err.println("WARN alias " + key + " of " + session.identity() + " is held by " + holder.identity()
                        + "; not routed to the new session");
                continue;
            }
            byKey.put(key, session);
        }
        statsFor(session.identity()).markOnline();
        return new ArrayList<>(superseded);
    }

    /**
     * Open session holding {@code identity} (a workload identity or a per-service alias).
     */
    public synchronized Optional<AgentSession> find(String identity) {
        AgentSession session = byKey.get(identity);
        if (session == null || !session.isOpen()) {
            return Optional.empty();
        }
        return Optional.of(session);
    }

    public boolean hasLiveSession(String identity) {
        return find(identity).isPresent();
    }

    /**
     * Removes {@code session} only if it still holds its keys; a newer session is left untouched.
     */
    public synchronized boolean remove(AgentSession session) {
        boolean removed = byKey.values().removeIf(holder -> holder == session);
        if (removed && !holdsIdentity(session.identity())) {
            AgentStats s = stats.get(session.identity());
            if (s != null) {
                s.markOffline();
            }
        }
        return removed;
    }

    /**
     * Drops sessions that are closed, silent longer than {@code heartbeatWindow}, or whose
     * credential expired. Returned sessions still need to be closed by the caller.
     */
    public synchronized List<AgentSession> sweep(Duration heartbeatWindow) {
        Instant now = clock.instant();
        long windowMs = heartbeatWindow.toMillis();
        Set<AgentSession> dead = new LinkedHashSet<>();
        for (AgentSession session : byKey.values()) {
            if (!session.isOpen()
                    || (windowMs > 0 && session.mux().millisSinceLastFrame() > windowMs)
                    || session.credentialExpired(now)) {
                dead.add(session);
            }
        }
        for (AgentSession session : dead) {
            byKey.values().removeIf(holder -> holder == session);
            if (!holdsIdentity(session.identity())) {
                AgentStats s = stats.get(session.identity());
                if (s != null) {
                    s.markOffline();
                }
            }
        }
        for (AgentStats s : stats.values()) {
            if (s.online() && s.activeConnections() > 0) {
                s.touch();
            }
        }
        return new ArrayList<>(dead);
    }

    public synchronized List<AgentSession> sessions() {
        return new ArrayList<>(new LinkedHashSet<>(byKey.values()));
    }

    public synchronized int liveCount() {
        int count = 0;
        for (AgentSession session : new LinkedHashSet<>(byKey.values())) {
            if (session.isOpen()) {
                count++;
            }
        }
        return count;
    }

    /**
     * Stats for a workload identity or one of its per-service aliases.
     */
    public synchronized Optional<AgentStats> stats(String identity) {
        AgentStats direct = stats.get(identity);
        if (direct != null) {
            return Optional.of(direct);
        }
        AgentSession holder = byKey.get(identity);
        if (holder != null) {
            return Optional.ofNullable(stats.get(holder.identity()));
        }
        for (Map.Entry<String, AgentStats> entry : stats.entrySet()) {
            if (identity.startsWith(entry.getKey() + "-")) {
                return Optional.of(entry.getValue());
            }
        }
        return Optional.empty();
    }

    /**
     * Stats record for the session currently serving {@code identity}, created on first use.
     */
    synchronized AgentStats statsFor(String identity) {
        AgentSession holder = byKey.get(identity);
        String key = holder == null ? identity : holder.identity();
        return stats.computeIfAbsent(key, k -> new AgentStats(k, clock));
    }

    public synchronized int statsCount() {
        return stats.size();
    }

    private boolean holdsIdentity(String identity) {
        AgentSession holder = byKey.get(identity);
        return holder != null && holder.isOpen();
    }
}
