package io.kuberde.relay;

import io.kuberde.MutableClock;
import io.kuberde.model.RouteKind;
import io.kuberde.observability.PrometheusFormatter;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.time.Instant;

final class RelayMetricsTest {

    @Test
    void exposesRoutesStreamsAndRejections() throws Exception {
        MutableClock clock = new MutableClock(Instant.parse("2025-03-01T10:00:00Z"));
        RoutingTable routes = new RoutingTable(null, clock);
        RelayMetrics metrics = new RelayMetrics(routes, new SessionRegistry(clock));
        routes.register(RouteKind.TCP, "30022", "user-alice-dev", "ssh", "controller");
        routes.register(RouteKind.HTTP, "ide.user-alice-dev", "user-alice-dev", "ide", "controller");
        routes.park(RouteKind.HTTP, "ide.user-alice-dev");
        metrics.streamOpened();
        metrics.streamOpened();
        metrics.streamClosed();
        metrics.addBytes(120, 4096);
        metrics.rejected(RelayException.Reason.NO_ROUTE);
        metrics.authFailure();

        String text = PrometheusFormatter.format(metrics);
        Assertions.assertTrue(text.contains("# TYPE kuberde_routes gauge\n"), text);
        Assertions.assertTrue(text.contains("kuberde_routes{kind=\"tcp\"} 1\n"), text);
        Assertions.assertTrue(text.contains("kuberde_routes_parked 1\n"), text);
        Assertions.assertTrue(text.contains("kuberde_streams_active 1\n"), text);
        Assertions.assertTrue(text.contains("kuberde_streams_total 2\n"), text);
        Assertions.assertTrue(text.contains("kuberde_bridge_bytes_total{direction=\"out\"} 4096\n"), text);
        Assertions.assertTrue(text.contains("kuberde_inbound_rejected_total{reason=\"no_route\"} 1\n"), text);
        Assertions.assertTrue(text.contains("kuberde_inbound_rejected_total{reason=\"timeout\"} 0\n"), text);
        Assertions.assertTrue(text.contains("kuberde_auth_failures_total 1\n"), text);
        Assertions.assertTrue(text.contains("kuberde_agent_sessions 0\n"), text);
        Assertions.assertEquals(1, text.split("# HELP kuberde_bridge_bytes_total ", -1).length - 1);
    }
}
