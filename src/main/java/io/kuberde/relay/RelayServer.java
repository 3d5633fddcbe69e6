package io.kuberde.relay;

import com.sun.net.httpserver.HttpServer;
import io.kuberde.auth.AuthHttpHandlers;
import io.kuberde.auth.Authorizer;
import io.kuberde.auth.ClientRegistry;
import io.kuberde.auth.OidcLoginFlow;
import io.kuberde.auth.SessionStore;
import io.kuberde.auth.TokenIssuer;
import io.kuberde.auth.TokenVerifier;
import io.kuberde.config.RelayConfig;
import io.kuberde.model.RouteEntry;
import io.kuberde.observability.AuditLogger;
import io.kuberde.security.TunnelTls;
import io.kuberde.util.Backoff;

import javax.net.ServerSocketFactory;
import javax.net.ssl.SSLContext;
import java.io.Closeable;
import java.io.IOException;
import java.net.InetSocketAddress;
import java.net.http.HttpClient;
import java.security.GeneralSecurityException;
import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Relay process: tunnel listener for agents, HTTP frontend and TCP route listeners for users, and
 * the management server. Owns the routing table and session registry.
 */
public final class RelayServer implements Closeable {
    private static final Duration SYSTEM_TOKEN_TTL = Duration.ofMinutes(10);

    private final RelayConfig config;
    private final TokenVerifier verifier;
    private final TokenIssuer issuer;
    private final ClientRegistry clients;
    private final SessionStore browserSessions;
    private final OidcLoginFlow oidc;
    private final Clock clock;
    private final Authorizer authorizer = new Authorizer();
    private final RoutingTable routes;
    private final SessionRegistry sessions;
    private final RelayMetrics metrics;
    private final AuditLogger audit;
    private final ExecutorService connections;
    private final ExecutorService bridges;
    private final ScheduledExecutorService scheduler;
    private final AtomicBoolean ready = new AtomicBoolean(false);
    private final AtomicBoolean closed = new AtomicBoolean(false);

    private SocketAcceptor tunnelAcceptor;
    private SocketAcceptor httpAcceptor;
    private TcpPortManager tcpPorts;
    private HttpServer mgmtServer;

    public RelayServer(
            RelayConfig config,
            TokenVerifier verifier,
            TokenIssuer issuer,
            ClientRegistry clients,
            SessionStore browserSessions,
            OidcLoginFlow oidc,
            Clock clock
    ) {
        this.config = config;
        this.verifier = verifier;
        this.issuer = issuer;
        this.clients = clients;
        this.browserSessions = browserSessions;
        this.oidc = oidc;
        this.clock = clock;
        this.routes = new RoutingTable(config::tcpPortAllowed, clock);
        this.sessions = new SessionRegistry(clock);
        this.metrics = new RelayMetrics(routes, sessions);
        this.audit = new AuditLogger(config.auditFile(), "relay", config.auditSigningSecret(), clock);
        this.connections = Executors.newCachedThreadPool(daemonThreads("relay-conn"));
        this.bridges = Executors.newCachedThreadPool(daemonThreads("relay-bridge"));
        this.scheduler = Executors.newScheduledThreadPool(2, daemonThreads("relay-sched"));
    }

    public void start() throws IOException, GeneralSecurityException {
        ServerSocketFactory factory = ServerSocketFactory.getDefault();
        if (config.tlsEnabled()) {
            SSLContext ssl = TunnelTls.serverContext(config.keystorePath(), config.keystorePass(), config.keystoreType());
            factory = ssl.getServerSocketFactory();
        }
        ScaleUpNotifier notifier = null;
        if (config.controllerUrl() != null && issuer != null) {
            notifier = new ScaleUpNotifier(
                    HttpClient.newBuilder().connectTimeout(Duration.ofSeconds(5)).build(),
                    config.controllerUrl(),
                    () -> issuer.issue(TokenIssuer.TokenRequest.system("kuberde-relay", SYSTEM_TOKEN_TTL)),
                    config.scaleUpDebounce(),
                    config.scaleUpRetries(),
                    Backoff.of(500L, 5_000L, 2.0d),
                    scheduler,
                    clock,
                    audit,
                    metrics::scaleUpSignal
            );
        }
        InboundRouter router = new InboundRouter(config, routes, sessions, metrics, notifier, verifier, authorizer, audit, bridges);
        TunnelListener tunnelListener = new TunnelListener(config, verifier, authorizer, sessions, router, metrics, audit, clock);
        tcpPorts = new TcpPortManager(config.bindHost(), connections, router);

        mgmtServer = HttpServer.create(new InetSocketAddress(config.bindHost(), config.mgmtPort()), 0);
        new ManagementApi(routes, sessions, tcpPorts, verifier, authorizer, metrics, audit, config.openProbes(), ready::get)
                .register(mgmtServer);
        if (issuer != null) {
            new AuthHttpHandlers(
                    issuer,
                    clients,
                    browserSessions,
                    verifier,
                    oidc,
                    config.agentDomain(),
                    config.tlsEnabled(),
                    AuthHttpHandlers.DEFAULT_SESSION_TTL,
                    audit,
                    metrics::authFailure
            ).register(mgmtServer);
        }
        mgmtServer.setExecutor(connections);
        mgmtServer.start();

        tunnelAcceptor = SocketAcceptor.start("tunnel", factory, config.bindHost(), config.tunnelPort(), connections, tunnelListener::handle);
        httpAcceptor = SocketAcceptor.start("http", factory, config.bindHost(), config.httpPort(), connections, router::handleHttp);

        long sweepMs = config.sweepInterval().toMillis();
        scheduler.scheduleWithFixedDelay(this::sweep, sweepMs, sweepMs, TimeUnit.MILLISECONDS);
        ready.set(true);
        audit.log(AuditLogger.AuditEvent.of("relay.start", "system", "relay", "ok", null, Map.of(
                "tunnelPort", tunnelPort(),
                "httpPort", httpPort(),
                "mgmtPort", mgmtPort(),
                "tls", config.tlsEnabled()
        )));
        System.out.println("Relay listening: tunnel=" + tunnelPort() + config.tunnelPath()
                + ", http=" + httpPort()
                + ", mgmt=" + mgmtPort()
                + ", tls=" + config.tlsEnabled()
                + ", agentDomain=" + (config.agentDomain().isEmpty() ? "-" : config.agentDomain())
                + ", tcpPorts=" + config.tcpPortMin() + "-" + config.tcpPortMax());
    }

    /**
     * One sweeper pass: close dead and expired sessions, then recount routes without a session.
     */
    void sweep() {
        try {
            List<AgentSession> dead = sessions.sweep(config.heartbeatWindow());
            for (AgentSession session : dead) {
                String reason = session.credentialExpired(clock.instant()) ? "credential expired" : "heartbeat missed";
                session.close(reason);
                audit.log(AuditLogger.AuditEvent.of("agent.swept", session.subject(), session.identity(), reason));
                System.out.println("agent " + session.identity() + " swept: " + reason);
            }
            metrics.sessionsSwept(dead.size());
            long orphaned = 0;
            for (RouteEntry entry : routes.listByPrefix("")) {
                if (!sessions.hasLiveSession(entry.agentId())) {
                    orphaned++;
                }
            }
            metrics.routesWithoutSession(orphaned);
            if (browserSessions != null) {
                browserSessions.purgeExpired();
            }
        } catch (RuntimeException e) {
            System.err.println("WARN relay sweep failed: " + e.getMessage());
        }
    }

    public int tunnelPort() {
        return tunnelAcceptor.port();
    }

    public int httpPort() {
        return httpAcceptor.port();
    }

    public int mgmtPort() {
        return mgmtServer.getAddress().getPort();
    }

    public RoutingTable routes() {
        return routes;
    }

    public SessionRegistry sessions() {
        return sessions;
    }

    public RelayMetrics metrics() {
        return metrics;
    }

    public AuditLogger audit() {
        return audit;
    }

    public boolean isReady() {
        return ready.get();
    }

    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        ready.set(false);
        if (tunnelAcceptor != null) {
            tunnelAcceptor.close();
        }
        if (httpAcceptor != null) {
            httpAcceptor.close();
        }
        if (tcpPorts != null) {
            tcpPorts.close();
        }
        if (mgmtServer != null) {
            mgmtServer.stop(0);
        }
        for (AgentSession session : sessions.sessions()) {
            session.close("relay shutting down");
        }
        scheduler.shutdownNow();
        bridges.shutdownNow();
        connections.shutdownNow();
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
