package io.kuberde.config;

import io.kuberde.util.Backoff;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;

public final class ControllerConfig {
    public static final String DEFAULT_NAMESPACE = "kuberde";
    public static final Duration DEFAULT_RESYNC_INTERVAL = Duration.ofSeconds(30);
    public static final String DEFAULT_AGENT_IMAGE = "kuberde/agent:latest";
    public static final int DEFAULT_STATUS_RETRIES = 3;
    public static final Duration DEFAULT_STATUS_BACKOFF_INITIAL = Duration.ofMillis(100);
    public static final Duration DEFAULT_STATUS_BACKOFF_MAX = Duration.ofSeconds(2);
    public static final Duration DEFAULT_TTL = Duration.ofHours(8);
    public static final String DEFAULT_DATA_ROOT = "data";

    private final String namespace;
    private final String relayMgmtUrl;
    private final String bindHost;
    private final int port;
    private final Duration resyncInterval;
    private final int workers;
    private final int tcpPortBase;
    private final int tcpPortRange;
    private final String agentImage;
    private final int statusRetries;
    private final Backoff statusBackoff;
    private final Duration defaultTtl;
    private final Path dataRoot;
    private final String auditSigningSecret;

    public ControllerConfig(
            String namespace,
            String relayMgmtUrl,
            String bindHost,
            int port,
            Duration resyncInterval,
            int workers,
            int tcpPortBase,
            int tcpPortRange,
            String agentImage,
            Duration defaultTtl,
            Path dataRoot,
            String auditSigningSecret
    ) {
        if (relayMgmtUrl == null || relayMgmtUrl.isBlank()) {
            throw new IllegalArgumentException("relay management URL is required");
        }
        if (tcpPortBase < 1 || tcpPortRange < 1 || tcpPortBase + tcpPortRange - 1 > 65535) {
            throw new IllegalArgumentException("Invalid TCP port allocation range: " + tcpPortBase + "+" + tcpPortRange);
        }
        this.namespace = namespace == null || namespace.isBlank() ? DEFAULT_NAMESPACE : namespace.trim();
        String mgmt = relayMgmtUrl.trim();
        this.relayMgmtUrl = mgmt.endsWith("/") ? mgmt.substring(0, mgmt.length() - 1) : mgmt;
        this.bindHost = bindHost == null || bindHost.isBlank() ? RelayConfig.DEFAULT_BIND_HOST : bindHost.trim();
        this.port = port;
        this.resyncInterval = resyncInterval == null ? DEFAULT_RESYNC_INTERVAL : resyncInterval;
        this.workers = Math.max(1, workers);
        this.tcpPortBase = tcpPortBase;
        this.tcpPortRange = tcpPortRange;
        this.agentImage = agentImage == null || agentImage.isBlank() ? DEFAULT_AGENT_IMAGE : agentImage.trim();
        this.statusRetries = DEFAULT_STATUS_RETRIES;
        this.statusBackoff = new Backoff(DEFAULT_STATUS_BACKOFF_INITIAL, DEFAULT_STATUS_BACKOFF_MAX, 2.0d);
        this.defaultTtl = defaultTtl == null ? DEFAULT_TTL : defaultTtl;
        this.dataRoot = (dataRoot == null ? Paths.get(DEFAULT_DATA_ROOT) : dataRoot).toAbsolutePath().normalize();
        this.auditSigningSecret = auditSigningSecret == null ? "" : auditSigningSecret.trim();
    }

    public String namespace() {
        return namespace;
    }

    public String relayMgmtUrl() {
        return relayMgmtUrl;
    }

    public String bindHost() {
        return bindHost;
    }

    public int port() {
        return port;
    }

    public Duration resyncInterval() {
        return resyncInterval;
    }

    public int workers() {
        return workers;
    }

    public int tcpPortBase() {
        return tcpPortBase;
    }

    public int tcpPortRange() {
        return tcpPortRange;
    }

    public String agentImage() {
        return agentImage;
    }

    public int statusRetries() {
        return statusRetries;
    }

    public Backoff statusBackoff() {
        return statusBackoff;
    }

    public Duration defaultTtl() {
        return defaultTtl;
    }

    public Path dataRoot() {
        return dataRoot;
    }

    public Path auditFile() {
        return dataRoot.resolve("audit").resolve("controller-audit.jsonl");
    }

    public String auditSigningSecret() {
        return auditSigningSecret;
    }
}
