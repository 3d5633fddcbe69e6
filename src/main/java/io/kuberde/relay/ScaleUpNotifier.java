package io.kuberde.relay;

import io.kuberde.auth.AuthException;
import io.kuberde.auth.TokenSource;
import io.kuberde.model.RouteEntry;
import io.kuberde.observability.AuditLogger;
import io.kuberde.util.Backoff;
import io.kuberde.util.Jsons;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Clock;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Asks the controller to wake an idle workload when traffic hits one of its parked routes. At most
 * one signal per identity is sent per debounce window; delivery is asynchronous and retried on
 * I/O errors and 5xx answers.
 */
public final class ScaleUpNotifier {
    public static final String HOOK_PATH = "/hooks/scale-up";
    private static final Duration REQUEST_TIMEOUT = Duration.ofSeconds(10);

    private final HttpClient http;
    private final URI hookUrl;
    private final TokenSource tokens;
    private final Duration debounce;
    private final int retries;
    private final Backoff backoff;
    private final ScheduledExecutorService scheduler;
    private final Clock clock;
    private final AuditLogger audit;
    private final Runnable onSignal;
    private final Map<String, Long> lastSignalMs = new ConcurrentHashMap<>();

    public ScaleUpNotifier(
            HttpClient http,
            String controllerUrl,
            TokenSource tokens,
            Duration debounce,
            int retries,
            Backoff backoff,
            ScheduledExecutorService scheduler,
            Clock clock,
            AuditLogger audit,
            Runnable onSignal
    ) {
        String base = controllerUrl.endsWith("/") ? controllerUrl.substring(0, controllerUrl.length() - 1) : controllerUrl;
        this.http = http;
        this.hookUrl = URI.create(base + HOOK_PATH);
        this.tokens = tokens;
        this.debounce = debounce;
        this.retries = Math.max(0, retries);
        this.backoff = backoff;
        this.scheduler = scheduler;
        this.clock = clock;
        this.audit = audit;
        this.onSignal = onSignal == null ? () -> { } : onSignal;
    }

    /**
     * @return {@code true} when a signal was queued, {@code false} when one was already sent for
     *     this identity within the debounce window
     */
    public boolean signal(RouteEntry parked, String traceId) {
        long now = clock.millis();
        String identity = parked.agentId();
        boolean[] accepted = {false};
        lastSignalMs.compute(identity, (k, last) -> {
            if (last != null && now - last < debounce.toMillis()) {
                return last;
            }
            accepted[0] = true;
            return now;
        });
        if (!accepted[0]) {
            return false;
        }
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("agentID", identity);
        body.put("key", parked.key());
        body.put("kind", parked.kind().wireName());
        body.put("requestedAt", clock.instant().toString());
        onSignal.run();
        schedule(body, traceId, 0, Duration.ZERO);
        return true;
    }

    private void schedule(Map<String, Object> body, String traceId, int attempt, Duration delay) {
        try {
            scheduler.schedule(() -> deliver(body, traceId, attempt), delay.toMillis(), TimeUnit.MILLISECONDS);
        } catch (RejectedExecutionException e) {
            System.err.println("WARN scale-up signal for " + body.get("agentID") + " dropped: relay is shutting down");
        }
    }

    private void deliver(Map<String, Object> body, String traceId, int attempt) {
        String identity = String.valueOf(body.get("agentID"));
        String failure;
        try {
            HttpRequest request = HttpRequest.newBuilder(hookUrl)
                    .timeout(REQUEST_TIMEOUT)
                    .header("Content-Type", "application/json")
                    .header("Authorization", "Bearer " + tokens.fetch().value())
                    .POST(HttpRequest.BodyPublishers.ofString(Jsons.toCompactJson(body)))
                    .build();
            HttpResponse<String> response = http.send(request, HttpResponse.BodyHandlers.ofString());
            int status = response.statusCode();
            if (status < 300) {
                audit.log(AuditLogger.AuditEvent.of("scale_up.signal", "relay", identity, "delivered", traceId,
                        Map.of("status", status, "attempt", attempt + 1)));
                return;
            }
            if (status < 500) {
                audit.log(AuditLogger.AuditEvent.of("scale_up.signal", "relay", identity, "rejected", traceId,
                        Map.of("status", status, "attempt", attempt + 1)));
                return;
            }
            failure = "controller answered " + status;
        } catch (IOException | AuthException e) {
            failure = e.getMessage();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return;
        }
        if (attempt < retries) {
            schedule(body, traceId, attempt + 1, backoff.delayForAttempt(attempt));
            return;
        }
        System.err.println("WARN scale-up signal for " + identity + " failed after " + (attempt + 1) + " attempts: " + failure);
        audit.log(AuditLogger.AuditEvent.of("scale_up.signal", "relay", identity, "failed", traceId,
                Map.of("attempts", attempt + 1, "error", String.valueOf(failure))));
        lastSignalMs.remove(identity);
    }
}
