package io.kuberde.controller;

import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import io.kuberde.auth.Authorizer;
import io.kuberde.auth.TokenVerifier;
import io.kuberde.config.ControllerConfig;
import io.kuberde.observability.AuditLogger;
import io.kuberde.util.HttpExchanges;

import java.io.Closeable;
import java.io.IOException;
import java.net.InetSocketAddress;
import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Controller process: the resync loop plus an HTTP server for probes and the scale-up hook.
 */
public final class ControllerServer implements Closeable {
    private final ControllerConfig config;
    private final ClusterClient cluster;
    private final AuditLogger audit;
    private final ScheduledExecutorService scheduler;
    private final ExecutorService workers;
    private final ExecutorService hooks;
    private final ControllerLoop loop;
    private final ScaleUpHandler scaleUp;
    private final AtomicBoolean closed = new AtomicBoolean(false);
    private HttpServer server;

    public ControllerServer(ControllerConfig config, ClusterClient cluster, RelayApi relay, TokenVerifier verifier, Clock clock) {
        this.config = config;
        this.cluster = cluster;
        this.audit = new AuditLogger(config.auditFile(), "controller", config.auditSigningSecret(), clock);
        this.scheduler = Executors.newSingleThreadScheduledExecutor(daemonThreads("controller-tick"));
        this.workers = Executors.newFixedThreadPool(config.workers(), daemonThreads("controller-worker"));
        this.hooks = Executors.newCachedThreadPool(daemonThreads("controller-hook"));
        StatusWriter statusWriter = new StatusWriter(cluster, config.statusRetries(), config.statusBackoff());
        Reconciler reconciler = new Reconciler(cluster, relay, statusWriter, new WorkloadValidator(config.defaultTtl()),
                config, audit, clock);
        this.loop = new ControllerLoop(cluster, reconciler, config.namespace(), workers);
        this.scaleUp = new ScaleUpHandler(cluster, reconciler, verifier, new Authorizer(), config.namespace(), hooks, audit);
    }

    public void start() throws IOException {
        server = HttpServer.create(new InetSocketAddress(config.bindHost(), config.port()), 0);
        server.createContext("/healthz", this::handleHealth);
        server.createContext("/readyz", this::handleReady);
        server.createContext("/hooks/scale-up", scaleUp::handle);
        server.setExecutor(hooks);
        server.start();
        long intervalMs = config.resyncInterval().toMillis();
        scheduler.scheduleWithFixedDelay(loop::tick, 0L, intervalMs, TimeUnit.MILLISECONDS);
        audit.log(AuditLogger.AuditEvent.of("controller.start", "system", config.namespace(), "ok", null, Map.of(
                "port", port(),
                "relay", config.relayMgmtUrl()
        )));
        System.out.println("Controller running: namespace=" + config.namespace()
                + ", port=" + port()
                + ", relay=" + config.relayMgmtUrl()
                + ", resync=" + config.resyncInterval().toSeconds() + "s"
                + ", workers=" + config.workers());
    }

    public int port() {
        return server.getAddress().getPort();
    }

    public ControllerLoop loop() {
        return loop;
    }

    void handleHealth(HttpExchange exchange) throws IOException {
        if (!HttpExchanges.allowMethods(exchange, "GET")) {
            return;
        }
        HttpExchanges.writeJson(exchange, Map.of("status", "ok", "time", Instant.now().toString()), 200);
    }

    void handleReady(HttpExchange exchange) throws IOException {
        if (!HttpExchanges.allowMethods(exchange, "GET")) {
            return;
        }
        if (!loop.ready()) {
            HttpExchanges.writeJson(exchange, Map.of("status", "starting"), 503);
            return;
        }
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", "ready");
        body.put("ticks", loop.ticks());
        body.put("failures", loop.failures());
        HttpExchanges.writeJson(exchange, body, 200);
    }

    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        if (server != null) {
            server.stop(0);
        }
        scheduler.shutdownNow();
        workers.shutdownNow();
        hooks.shutdownNow();
    }

    ClusterClient cluster() {
        return cluster;
    }

    private static ThreadFactory daemonThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, prefix + "-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }
}
