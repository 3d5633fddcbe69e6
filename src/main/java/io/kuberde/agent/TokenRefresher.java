package io.kuberde.agent;

import io.kuberde.auth.AccessToken;
import io.kuberde.auth.AuthException;
import io.kuberde.auth.TokenSource;
import io.kuberde.util.Backoff;

import java.io.Closeable;
import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;

/**
 * Keeps a machine credential fresh. A refresh is scheduled once {@code refreshFraction} of the
 * current token's validity has elapsed; failed attempts are retried with backoff, and running out
 * of attempts is reported to the fatal handler.
 */
public final class TokenRefresher implements Closeable {
    private final TokenSource source;
    private final double refreshFraction;
    private final int retries;
    private final Backoff backoff;
    private final Clock clock;
    private final ScheduledExecutorService scheduler;
    private final Consumer<AccessToken> onRefresh;
    private final Consumer<Throwable> onFatal;
    private volatile AccessToken current;
    private ScheduledFuture<?> pending;
    private volatile boolean closed;

    public TokenRefresher(
            TokenSource source,
            double refreshFraction,
            int retries,
            Backoff backoff,
            Clock clock,
            ScheduledExecutorService scheduler,
            Consumer<AccessToken> onRefresh,
            Consumer<Throwable> onFatal
    ) {
        if (refreshFraction <= 0.0d || refreshFraction >= 1.0d) {
            throw new IllegalArgumentException("refresh fraction must be in (0, 1)");
        }
        this.source = source;
        this.refreshFraction = refreshFraction;
        this.retries = Math.max(0, retries);
        this.backoff = backoff;
        this.clock = clock;
        this.scheduler = scheduler;
        this.onRefresh = onRefresh == null ? token -> { } : onRefresh;
        this.onFatal = onFatal == null ? error -> { } : onFatal;
    }

    /**
     * Fetches the first token (with the same retry budget) and schedules its refresh.
     */
    public AccessToken start() throws IOException, AuthException {
        AccessToken token = fetchWithRetries();
        current = token;
        schedule(token);
        return token;
    }

    public AccessToken current() {
        return current;
    }

    /**
     * Replaces the current token right away, for example after the relay rejected it. Failure
     * after all retries is fatal.
     */
    public AccessToken refreshNow() throws IOException, AuthException {
        try {
            AccessToken token = fetchWithRetries();
            install(token);
            return token;
        } catch (IOException | AuthException e) {
            onFatal.accept(e);
            throw e;
        }
    }

    AccessToken fetchWithRetries() throws IOException, AuthException {
        Exception last = null;
        for (int attempt = 0; attempt <= retries; attempt++) {
            if (closed) {
                throw new IOException("token refresher is closed");
            }
            try {
                return source.fetch();
            } catch (IOException | AuthException e) {
                last = e;
                System.err.println("WARN token fetch attempt " + (attempt + 1) + "/" + (retries + 1) + " failed: " + e.getMessage());
            }
            if (attempt < retries) {
                try {
                    Thread.sleep(backoff.delayForAttempt(attempt).toMillis());
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    throw new IOException("interrupted while refreshing token", e);
                }
            }
        }
        if (last instanceof AuthException) {
            throw (AuthException) last;
        }
        throw (IOException) last;
    }

    private void scheduledRefresh() {
        try {
            install(fetchWithRetries());
        } catch (IOException | AuthException e) {
            if (!closed) {
                System.err.println("WARN token refresh exhausted its retries: " + e.getMessage());
                onFatal.accept(e);
            }
        }
    }

    private void install(AccessToken token) {
        current = token;
        schedule(token);
        onRefresh.accept(token);
    }

    private synchronized void schedule(AccessToken token) {
        if (closed) {
            return;
        }
        if (pending != null) {
            pending.cancel(false);
        }
        long delayMs = Math.max(0L, Duration.between(clock.instant(), token.refreshAt(refreshFraction)).toMillis());
        try {
            pending = scheduler.schedule(this::scheduledRefresh, delayMs, TimeUnit.MILLISECONDS);
        } catch (RejectedExecutionException e) {
            System.err.println("WARN token refresh not scheduled: " + e.getMessage());
        }
    }

    @Override
    public synchronized void close() {
        closed = true;
        if (pending != null) {
            pending.cancel(false);
        }
    }
}
