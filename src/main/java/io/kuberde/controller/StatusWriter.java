package io.kuberde.controller;

import io.kuberde.util.Backoff;

import java.util.Optional;
import java.util.function.UnaryOperator;

/**
 * Writes workload status with optimistic concurrency. On a conflict the resource is re-read and
 * the same change is applied to the fresh copy; nothing is written when the status would not
 * change.
 */
public final class StatusWriter {
    private final ClusterClient cluster;
    private final int attempts;
    private final Backoff backoff;

    public StatusWriter(ClusterClient cluster, int attempts, Backoff backoff) {
        this.cluster = cluster;
        this.attempts = Math.max(1, attempts);
        this.backoff = backoff;
    }

    /**
     * @return the workload as stored afterwards, or empty when it no longer exists
     */
    public Optional<AgentWorkload> update(AgentWorkload workload, UnaryOperator<AgentWorkload.Status> change)
            throws ClusterApiException, InterruptedException {
        AgentWorkload current = workload;
        for (int attempt = 0; ; attempt++) {
            AgentWorkload.Status next = change.apply(current.status());
            if (next.sameAs(current.status())) {
                return Optional.of(current);
            }
            try {
                return Optional.of(cluster.updateStatus(current, next));
            } catch (ReconcileConflictException e) {
                if (attempt + 1 >= attempts) {
                    throw e;
                }
                Thread.sleep(backoff.delayForAttempt(attempt).toMillis());
                Optional<AgentWorkload> fresh = cluster.getWorkload(current.namespace(), current.name());
                if (fresh.isEmpty()) {
                    return Optional.empty();
                }
                current = fresh.get();
            }
        }
    }
}
