package io.kuberde.controller;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * One resync tick: list every {@code RDEAgent} and reconcile each on the worker pool. A failing
 * workload is logged and retried next tick; an interrupted tick cancels what is left.
 */
public final class ControllerLoop {
    private final ClusterClient cluster;
    private final Reconciler reconciler;
    private final String namespace;
    private final ExecutorService workers;
    private final AtomicBoolean listedOnce = new AtomicBoolean(false);
    private final AtomicLong ticks = new AtomicLong();
    private final AtomicLong failures = new AtomicLong();

    public ControllerLoop(ClusterClient cluster, Reconciler reconciler, String namespace, ExecutorService workers) {
        this.cluster = cluster;
        this.reconciler = reconciler;
        this.namespace = namespace;
        this.workers = workers;
    }

    /**
     * Scheduler entry point; never throws.
     */
    public void tick() {
        try {
            runOnce();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } catch (IOException | RuntimeException e) {
            System.err.println("WARN controller tick failed: " + e.getMessage());
        }
    }

    /**
     * @return number of workloads reconciled without error
     */
    public int runOnce() throws IOException, InterruptedException {
        List<AgentWorkload> workloads = cluster.listWorkloads(namespace);
        listedOnce.set(true);
        ticks.incrementAndGet();
        List<Future<Reconciler.Outcome>> pending = new ArrayList<>();
        for (AgentWorkload workload : workloads) {
            pending.add(workers.submit(() -> reconciler.reconcile(workload)));
        }
        int ok = 0;
        try {
            for (int i = 0; i < pending.size(); i++) {
                try {
                    pending.get(i).get();
                    ok++;
                } catch (ExecutionException e) {
                    failures.incrementAndGet();
                    Throwable cause = e.getCause() == null ? e : e.getCause();
                    System.err.println("WARN reconcile of " + workloads.get(i).displayName() + " failed: " + cause.getMessage());
                }
            }
        } catch (InterruptedException e) {
            for (Future<Reconciler.Outcome> future : pending) {
                future.cancel(true);
            }
            throw e;
        }
        return ok;
    }

    public boolean ready() {
        return listedOnce.get();
    }

    public long ticks() {
        return ticks.get();
    }

    public long failures() {
        return failures.get();
    }
}
