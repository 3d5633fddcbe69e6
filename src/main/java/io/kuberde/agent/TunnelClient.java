package io.kuberde.agent;

import io.kuberde.auth.AccessToken;
import io.kuberde.auth.AuthException;
import io.kuberde.mux.MuxConfig;
import io.kuberde.mux.MuxException;
import io.kuberde.mux.MuxSession;
import io.kuberde.mux.MuxStream;
import io.kuberde.tunnel.HandshakeRejectedException;
import io.kuberde.tunnel.TunnelHandshake;
import io.kuberde.tunnel.TunnelSockets;
import io.kuberde.util.Backoff;

import javax.net.SocketFactory;
import java.io.IOException;
import java.net.Socket;
import java.net.URI;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * Keeps one tunnel to the relay open: dial, upgrade with the current credential, accept streams
 * until the session dies, back off and start again. Only {@link #shutdown()} ends the loop.
 */
public final class TunnelClient {
    private static final Duration ACCEPT_POLL = Duration.ofSeconds(1);

    private final URI serverUrl;
    private final String agentId;
    private final List<String> services;
    private final SocketFactory socketFactory;
    private final TokenRefresher tokens;
    private final StreamDispatcher dispatcher;
    private final MuxConfig muxConfig;
    private final Backoff backoff;
    private final Duration connectTimeout;
    private final List<StateListener> listeners = new CopyOnWriteArrayList<>();
    private final CountDownLatch stopped = new CountDownLatch(1);
    private volatile ConnectionState state = ConnectionState.DISCONNECTED;
    private volatile MuxSession current;
    private volatile Thread runner;

    public TunnelClient(
            URI serverUrl,
            String agentId,
            List<String> services,
            SocketFactory socketFactory,
            TokenRefresher tokens,
            StreamDispatcher dispatcher,
            Duration keepAliveInterval,
            Duration writeTimeout,
            Backoff backoff,
            Duration connectTimeout
    ) {
        this.serverUrl = serverUrl;
        this.agentId = agentId;
        this.services = List.copyOf(services);
        this.socketFactory = socketFactory == null ? SocketFactory.getDefault() : socketFactory;
        this.tokens = tokens;
        this.dispatcher = dispatcher;
        this.muxConfig = MuxConfig.of(keepAliveInterval, keepAliveInterval.multipliedBy(3), writeTimeout);
        this.backoff = backoff;
        this.connectTimeout = connectTimeout;
    }

    public void addListener(StateListener listener) {
        listeners.add(listener);
    }

    public ConnectionState state() {
        return state;
    }

    /**
     * The live session, or {@code null} between connections.
     */
    public MuxSession currentSession() {
        MuxSession session = current;
        return session == null || session.isClosed() ? null : session;
    }

    /**
     * Runs the connect loop on the calling thread until {@link #shutdown()}.
     */
    public void run() {
        runner = Thread.currentThread();
        int attempt = 0;
        try {
            while (state != ConnectionState.SHUTDOWN) {
                long startedAt = System.currentTimeMillis();
                try {
                    connectOnce();
                } catch (HandshakeRejectedException e) {
                    System.err.println("WARN relay rejected the tunnel: " + e.getMessage());
                    if (e.unauthorized() && !refreshAfterRejection()) {
                        return;
                    }
                } catch (IOException e) {
                    if (state != ConnectionState.SHUTDOWN) {
                        System.err.println("WARN tunnel to " + serverUrl + " lost: " + e.getMessage());
                    }
                }
                if (state == ConnectionState.SHUTDOWN) {
                    return;
                }
                transition(ConnectionState.DISCONNECTED);
                if (System.currentTimeMillis() - startedAt > backoff.max().toMillis()) {
                    attempt = 0;
                }
                Duration delay = backoff.delayForAttempt(attempt++);
                System.out.println("reconnecting in " + delay.toMillis() + "ms (attempt " + attempt + ")");
                try {
                    if (stopped.await(delay.toMillis(), TimeUnit.MILLISECONDS)) {
                        return;
                    }
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    return;
                }
            }
        } finally {
            transition(ConnectionState.SHUTDOWN);
        }
    }

    public void shutdown() {
        transition(ConnectionState.SHUTDOWN);
        stopped.countDown();
        MuxSession session = current;
        if (session != null) {
            session.close(new MuxException("agent shutting down"));
        }
        Thread thread = runner;
        if (thread != null && thread != Thread.currentThread()) {
            thread.interrupt();
        }
    }

    private void connectOnce() throws IOException {
        transition(ConnectionState.CONNECTING);
        Socket socket = dial();
        MuxSession session;
        try {
            AccessToken token = tokens.current();
            if (token == null) {
                throw new IOException("no credential available");
            }
            TunnelHandshake.upgrade(socket, serverUrl, agentId, token.value(), services, connectTimeout);
            transition(ConnectionState.AUTHENTICATED);
            session = MuxSession.client(socket, muxConfig, agentId);
        } catch (IOException | RuntimeException e) {
            socket.close();
            throw e;
        }
        current = session;
        if (state == ConnectionState.SHUTDOWN) {
            session.close();
            return;
        }
        transition(ConnectionState.STREAMING);
        System.out.println("tunnel established: agent=" + agentId + " relay=" + serverUrl + " services=" + services);
        try {
            while (state != ConnectionState.SHUTDOWN) {
                MuxStream stream = session.acceptStream(ACCEPT_POLL);
                if (stream != null) {
                    dispatcher.dispatch(stream);
                }
            }
        } finally {
            session.close(new MuxException("tunnel loop ended"));
            current = null;
        }
    }

    Socket dial() throws IOException {
        return TunnelSockets.dial(socketFactory, serverUrl, connectTimeout);
    }

    private boolean refreshAfterRejection() {
        try {
            tokens.refreshNow();
            return true;
        } catch (IOException | AuthException e) {
            System.err.println("WARN credential refresh after rejection failed: " + e.getMessage());
            return false;
        }
    }

    private void transition(ConnectionState next) {
        ConnectionState previous;
        synchronized (this) {
            previous = state;
            if (previous == next || previous == ConnectionState.SHUTDOWN) {
                return;
            }
            state = next;
        }
        for (StateListener listener : listeners) {
            listener.onStateChange(previous, next);
        }
    }

    @FunctionalInterface
    public interface StateListener {
        void onStateChange(ConnectionState previous, ConnectionState next);
    }
}
