package io.kuberde.agent;

import io.kuberde.auth.AccessToken;
import io.kuberde.auth.AuthException;
import io.kuberde.auth.ClientCredentialsTokenSource;
import io.kuberde.auth.TokenSource;
import io.kuberde.config.AgentConfig;
import io.kuberde.config.RelayConfig;
import io.kuberde.mux.MuxSession;
import io.kuberde.security.TunnelTls;

import javax.net.SocketFactory;
import java.io.Closeable;
import java.io.IOException;
import java.net.http.HttpClient;
import java.security.GeneralSecurityException;
import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Consumer;

/**
 * The in-pod agent: a credential refresher, the tunnel client and the stream dispatcher wired
 * together. Refreshed credentials are pushed to the relay on the live session.
 */
public final class AgentRuntime implements Closeable {
    private final AgentConfig config;
    private final TokenSource tokenSource;
    private final Clock clock;
    private final ScheduledExecutorService scheduler;
    private final ExecutorService streams;
    private final AtomicReference<Throwable> fatal = new AtomicReference<>();
    private final Consumer<Throwable> onFatal;
    private TokenRefresher refresher;
    private TunnelClient client;

    public AgentRuntime(AgentConfig config, TokenSource tokenSource, Clock clock, Consumer<Throwable> onFatal) {
        this.config = config;
        this.tokenSource = tokenSource;
        this.clock = clock;
        this.onFatal = onFatal == null ? error -> { } : onFatal;
        AtomicInteger counter = new AtomicInteger();
        this.scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "agent-token-refresh");
            t.setDaemon(true);
            return t;
        });
        this.streams = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "agent-stream-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * Agent with a client-credentials token source built from the config.
     */
    public static AgentRuntime fromConfig(AgentConfig config, Consumer<Throwable> onFatal) {
        HttpClient http = HttpClient.newBuilder().connectTimeout(config.connectTimeout()).build();
        TokenSource source = new ClientCredentialsTokenSource(http, config.tokenUrl(), config.clientId(), config.clientSecret(),
                Clock.systemUTC());
        return new AgentRuntime(config, source, Clock.systemUTC(), onFatal);
    }

    /**
     * Fetches the first credential and builds the tunnel client. Fails when no credential could
     * be obtained within the retry budget.
     */
    public void start() throws IOException, AuthException, GeneralSecurityException {
        refresher = new TokenRefresher(
                tokenSource,
                config.refreshFraction(),
                config.refreshRetries(),
                config.refreshBackoff(),
                clock,
                scheduler,
                this::pushCredential,
                this::fail
        );
        AccessToken token = refresher.start();
        System.out.println("agent credential acquired, expires " + token.expiresAt());
        StreamDispatcher dispatcher = new StreamDispatcher(
                config.services(),
                config.localHost(),
                config.preambleTimeout(),
                config.localDialWindow(),
                config.localDialStep(),
                streams
        );
        SocketFactory sockets = SocketFactory.getDefault();
        if (config.tlsEnabled()) {
            sockets = TunnelTls.clientContext(config.truststorePath(), config.truststorePassword(), config.revocationFile())
                    .getSocketFactory();
        }
        client = new TunnelClient(
                config.serverUrl(),
                config.agentId(),
                config.services().names(),
                sockets,
                refresher,
                dispatcher,
                config.keepAliveInterval(),
                RelayConfig.DEFAULT_WRITE_TIMEOUT,
                config.reconnectBackoff(),
                config.connectTimeout()
        );
        client.addListener((previous, next) -> System.out.println("tunnel state " + previous + " -> " + next));
    }

    /**
     * Runs the tunnel loop on the calling thread until {@link #close()} or a fatal credential error.
     */
    public void run() {
        if (client == null) {
            throw new IllegalStateException("agent not started");
        }
        client.run();
    }

    public TunnelClient client() {
        return client;
    }

    public Throwable fatalError() {
        return fatal.get();
    }

    private void pushCredential(AccessToken token) {
        TunnelClient tunnel = client;
        MuxSession session = tunnel == null ? null : tunnel.currentSession();
        if (session == null) {
            return;
        }
        try {
            session.sendReauth(token.value());
        } catch (IOException e) {
            System.err.println("WARN pushing refreshed credential failed: " + e.getMessage());
        }
    }

    private void fail(Throwable error) {
        if (!fatal.compareAndSet(null, error)) {
            return;
        }
        System.err.println("ERROR agent credential could not be refreshed: " + error.getMessage());
        if (client != null) {
            client.shutdown();
        }
        onFatal.accept(error);
    }

    @Override
    public void close() {
        if (client != null) {
            client.shutdown();
        }
        if (refresher != null) {
            refresher.close();
        }
        scheduler.shutdownNow();
        streams.shutdownNow();
    }
}
