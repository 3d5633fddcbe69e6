package io.kuberde.observability;

import io.kuberde.relay.RelayMetrics;

import java.util.Map;

public final class PrometheusFormatter {
    private PrometheusFormatter() {
    }

    public static String format(RelayMetrics metrics) {
        StringBuilder sb = new StringBuilder();
        appendGauge(sb, "kuberde_agent_sessions", "Live agent sessions", null, null, metrics.liveSessions());
        appendGauge(sb, "kuberde_agents_seen", "Agent identities with recorded stats", null, null, metrics.agentsSeen());
        appendMapGauge(sb, "kuberde_routes", "Registered routes grouped by kind", "kind", metrics.routesByKind());
        appendGauge(sb, "kuberde_routes_parked", "Routes parked while their workload is idle", null, null, metrics.parkedRoutes());
        appendGauge(sb, "kuberde_routes_without_session", "Routes whose agent has no live session", null, null, metrics.routesWithoutSession());
        appendGauge(sb, "kuberde_streams_active", "Bridged streams currently open", null, null, metrics.activeStreams());
        appendCounter(sb, "kuberde_streams_total", "Streams opened towards agents", metrics.streamsOpened());
        appendCounter(sb, "kuberde_bridge_bytes_total", "Bytes bridged", "direction", "in", metrics.bytesIn());
        appendCounter(sb, "kuberde_bridge_bytes_total", "Bytes bridged", "direction", "out", metrics.bytesOut());
        appendMapCounter(sb, "kuberde_inbound_rejected_total", "Inbound connections rejected grouped by reason", "reason", metrics.rejectedByReason());
        appendCounter(sb, "kuberde_auth_failures_total", "Rejected credentials", null, null, metrics.authFailures());
        appendCounter(sb, "kuberde_scale_up_signals_total", "Scale-up signals sent to the controller", null, null, metrics.scaleUpSignals());
        appendCounter(sb, "kuberde_sessions_swept_total", "Sessions closed for missed heartbeats or expired credentials", null, null, metrics.sessionsSwept());
        return sb.toString();
    }

    private static void appendMapGauge(StringBuilder sb, String metric, String help, String label, Map<String, Long> values) {
        appendHeader(sb, metric, help, "gauge");
        appendSamples(sb, metric, label, values);
    }

    private static void appendMapCounter(StringBuilder sb, String metric, String help, String label, Map<String, Long> values) {
        appendHeader(sb, metric, help, "counter");
        appendSamples(sb, metric, label, values);
    }

    private static void appendSamples(StringBuilder sb, String metric, String label, Map<String, Long> values) {
        for (Map.Entry<String, Long> e : values.entrySet()) {
            sb.append(metric).append('{')
                    .append(label).append("=\"").append(escapeLabel(e.getKey())).append("\"}")
                    .append(' ').append(e.getValue()).append('\n');
        }
    }

    private static void appendGauge(StringBuilder sb, String metric, String help, String label, String labelValue, long value) {
        appendSample(sb, metric, help, "gauge", label, labelValue, value);
    }

    private static void appendCounter(StringBuilder sb, String metric, String help, long value) {
        appendSample(sb, metric, help, "counter", null, null, value);
    }

    private static void appendCounter(StringBuilder sb, String metric, String help, String label, String labelValue, long value) {
        appendSample(sb, metric, help, "counter", label, labelValue, value);
    }

    private static void appendSample(
            StringBuilder sb,
            String metric,
            String help,
            String type,
            String label,
            String labelValue,
            long value
    ) {
        if (sb.indexOf("# HELP " + metric + " ") < 0) {
            appendHeader(sb, metric, help, type);
        }
        sb.append(metric);
        if (label != null && labelValue != null) {
            sb.append('{').append(label).append("=\"").append(escapeLabel(labelValue)).append("\"}");
        }
        sb.append(' ').append(value).append('\n');
    }

    private static void appendHeader(StringBuilder sb, String metric, String help, String type) {
        sb.append("# HELP ").append(metric).append(' ').append(help).append('\n');
        sb.append("# TYPE ").append(metric).append(' ').append(type).append('\n');
    }

    private static String escapeLabel(String v) {
        return v.replace("\\", "\\\\").replace("\"", "\\\"").replace("\n", "\\n");
    }
}
