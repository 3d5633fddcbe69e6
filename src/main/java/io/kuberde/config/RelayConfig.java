package io.kuberde.config;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;

public final class RelayConfig {
    public static final String DEFAULT_BIND_HOST = "0.0.0.0";
    public static final int DEFAULT_TUNNEL_PORT = 8081;
    public static final int DEFAULT_HTTP_PORT = 8080;
    public static final int DEFAULT_MGMT_PORT = 8090;
    public static final String DEFAULT_TUNNEL_PATH = "/ws";
    public static final int DEFAULT_TCP_PORT_MIN = 30000;
    public static final int DEFAULT_TCP_PORT_MAX = 32767;
    public static final Duration DEFAULT_KEEP_ALIVE_INTERVAL = Duration.ofSeconds(30);
    public static final Duration DEFAULT_HEARTBEAT_WINDOW = Duration.ofSeconds(90);
    public static final Duration DEFAULT_WRITE_TIMEOUT = Duration.ofSeconds(120);
    public static final Duration DEFAULT_STREAM_OPEN_TIMEOUT = Duration.ofSeconds(10);
    public static final Duration DEFAULT_HEAD_READ_TIMEOUT = Duration.ofSeconds(10);
    public static final int DEFAULT_MAX_HEAD_BYTES = 32 * 1024;
    public static final Duration DEFAULT_SWEEP_INTERVAL = Duration.ofSeconds(5);
    public static final Duration DEFAULT_SCALE_UP_DEBOUNCE = Duration.ofSeconds(30);
    public static final int DEFAULT_SCALE_UP_RETRIES = 3;
    public static final String DEFAULT_DATA_ROOT = "data";

    private final String bindHost;
    private final int tunnelPort;
    private final int httpPort;
    private final int mgmtPort;
    private final String tunnelPath;
    private final String agentDomain;
    private final int tcpPortMin;
    private final int tcpPortMax;
    private final Duration keepAliveInterval;
    private final Duration heartbeatWindow;
    private final Duration writeTimeout;
    private final Duration streamOpenTimeout;
    private final Duration headReadTimeout;
    private final int maxHeadBytes;
    private final Duration sweepInterval;
    private final Duration scaleUpDebounce;
    private final int scaleUpRetries;
    private final String controllerUrl;
    private final boolean openProbes;
    private final boolean requireBrowserSession;
    private final String loginUrl;
    private final Path dataRoot;
    private final String auditSigningSecret;
    private final String keystorePath;
    private final String keystorePass;
    private final String keystoreType;

    private RelayConfig(Builder b) {
        this.bindHost = blankToDefault(b.bindHost, DEFAULT_BIND_HOST);
        this.tunnelPort = checkPort("tunnel", b.tunnelPort);
        this.httpPort = checkPort("http", b.httpPort);
        this.mgmtPort = checkPort("mgmt", b.mgmtPort);
        String path = blankToDefault(b.tunnelPath, DEFAULT_TUNNEL_PATH);
        this.tunnelPath = path.startsWith("/") ? path : "/" + path;
        this.agentDomain = normalizeDomain(b.agentDomain);
        if (b.tcpPortMin < 1 || b.tcpPortMax > 65535 || b.tcpPortMin > b.tcpPortMax) {
            throw new IllegalArgumentException("Invalid TCP route port range: " + b.tcpPortMin + "-" + b.tcpPortMax);
        }
        this.tcpPortMin = b.tcpPortMin;
        this.tcpPortMax = b.tcpPortMax;
        this.keepAliveInterval = b.keepAliveInterval;
        this.heartbeatWindow = b.heartbeatWindow;
        if (heartbeatWindow.compareTo(keepAliveInterval) <= 0) {
            throw new IllegalArgumentException("heartbeat window must exceed the keep-alive interval");
        }
        this.writeTimeout = b.writeTimeout;
        this.streamOpenTimeout = b.streamOpenTimeout;
        this.headReadTimeout = b.headReadTimeout;
        this.maxHeadBytes = Math.max(1024, b.maxHeadBytes);
        this.sweepInterval = b.sweepInterval;
        this.scaleUpDebounce = b.scaleUpDebounce;
        this.scaleUpRetries = Math.max(1, b.scaleUpRetries);
        this.controllerUrl = b.controllerUrl == null || b.controllerUrl.isBlank() ? null : stripTrailingSlash(b.controllerUrl.trim());
        this.openProbes = b.openProbes;
        this.requireBrowserSession = b.requireBrowserSession;
        this.loginUrl = b.loginUrl == null || b.loginUrl.isBlank() ? "/auth/login" : b.loginUrl.trim();
        this.dataRoot = (b.dataRoot == null ? Paths.get(DEFAULT_DATA_ROOT) : b.dataRoot).toAbsolutePath().normalize();
        this.auditSigningSecret = b.auditSigningSecret == null ? "" : b.auditSigningSecret.trim();
        this.keystorePath = b.keystorePath == null || b.keystorePath.isBlank() ? null : b.keystorePath.trim();
        this.keystorePass = b.keystorePass;
        this.keystoreType = blankToDefault(b.keystoreType, "PKCS12");
    }

    public static Builder builder() {
        return new Builder();
    }

    public static RelayConfig defaults() {
        return builder().build();
    }

    public String bindHost() {
        return bindHost;
    }

    public int tunnelPort() {
        return tunnelPort;
    }

    public int httpPort() {
        return httpPort;
    }

    public int mgmtPort() {
        return mgmtPort;
    }

    public String tunnelPath() {
        return tunnelPath;
    }

    /**
     * Suffix stripped from inbound {@code Host} values, without a leading dot. Empty when the relay
     * resolves bare host prefixes.
     */
    public String agentDomain() {
        return agentDomain;
    }

    public int tcpPortMin() {
        return tcpPortMin;
    }

    public int tcpPortMax() {
        return tcpPortMax;
    }

    public Duration keepAliveInterval() {
        return keepAliveInterval;
    }

    public Duration heartbeatWindow() {
        return heartbeatWindow;
    }

    public Duration writeTimeout() {
        return writeTimeout;
    }

    public Duration streamOpenTimeout() {
        return streamOpenTimeout;
    }

    public Duration headReadTimeout() {
        return headReadTimeout;
    }

    public int maxHeadBytes() {
        return maxHeadBytes;
    }

    public Duration sweepInterval() {
        return sweepInterval;
    }

    public Duration scaleUpDebounce() {
        return scaleUpDebounce;
    }

    public int scaleUpRetries() {
        return scaleUpRetries;
    }

    public String controllerUrl() {
        return controllerUrl;
    }

    public boolean openProbes() {
        return openProbes;
    }

    public boolean requireBrowserSession() {
        return requireBrowserSession;
    }

    public String loginUrl() {
        return loginUrl;
    }

    public Path dataRoot() {
        return dataRoot;
    }

    public Path auditFile() {
        return dataRoot.resolve("audit").resolve("relay-audit.jsonl");
    }

    public String auditSigningSecret() {
        return auditSigningSecret;
    }

    public boolean tlsEnabled() {
        return keystorePath != null;
    }

    public String keystorePath() {
        return keystorePath;
    }

    public String keystorePass() {
        return keystorePass;
    }

    public String keystoreType() {
        return keystoreType;
    }

    public boolean tcpPortAllowed(int port) {
        return port >= tcpPortMin && port <= tcpPortMax;
    }

    private static int checkPort(String name, int port) {
        if (port < 0 || port > 65535) {
            throw new IllegalArgumentException("Invalid " + name + " port: " + port);
        }
        return port;
    }

    private static String normalizeDomain(String raw) {
        if (raw == null || raw.isBlank()) {
            return "";
        }
        String value = raw.trim().toLowerCase();
        while (value.startsWith(".")) {
            value = value.substring(1);
        }
        return value;
    }

    private static String stripTrailingSlash(String raw) {
        return raw.endsWith("/") ? raw.substring(0, raw.length() - 1) : raw;
    }

    private static String blankToDefault(String raw, String fallback) {
        return raw == null || raw.isBlank() ? fallback : raw.trim();
    }

    public static final class Builder {
        private String bindHost = DEFAULT_BIND_HOST;
        private int tunnelPort = DEFAULT_TUNNEL_PORT;
        private int httpPort = DEFAULT_HTTP_PORT;
        private int mgmtPort = DEFAULT_MGMT_PORT;
        private String tunnelPath = DEFAULT_TUNNEL_PATH;
        private String agentDomain;
        private int tcpPortMin = DEFAULT_TCP_PORT_MIN;
        private int tcpPortMax = DEFAULT_TCP_PORT_MAX;
        private Duration keepAliveInterval = DEFAULT_KEEP_ALIVE_INTERVAL;
        private Duration heartbeatWindow = DEFAULT_HEARTBEAT_WINDOW;
        private Duration writeTimeout = DEFAULT_WRITE_TIMEOUT;
        private Duration streamOpenTimeout = DEFAULT_STREAM_OPEN_TIMEOUT;
        private Duration headReadTimeout = DEFAULT_HEAD_READ_TIMEOUT;
        private int maxHeadBytes = DEFAULT_MAX_HEAD_BYTES;
        private Duration sweepInterval = DEFAULT_SWEEP_INTERVAL;
        private Duration scaleUpDebounce = DEFAULT_SCALE_UP_DEBOUNCE;
        private int scaleUpRetries = DEFAULT_SCALE_UP_RETRIES;
        private String controllerUrl;
        private boolean openProbes;
        private boolean requireBrowserSession;
        private String loginUrl;
        private Path dataRoot;
        private String auditSigningSecret;
        private String keystorePath;
        private String keystorePass;
        private String keystoreType;

        private Builder() {
        }

        public Builder bindHost(String value) {
            this.bindHost = value;
            return this;
        }

        public Builder tunnelPort(int value) {
            this.tunnelPort = value;
            return this;
        }

        public Builder httpPort(int value) {
            this.httpPort = value;
            return this;
        }

        public Builder mgmtPort(int value) {
            this.mgmtPort = value;
            return this;
        }

        public Builder tunnelPath(String value) {
            this.tunnelPath = value;
            return this;
        }

        public Builder agentDomain(String value) {
            this.agentDomain = value;
            return this;
        }

        public Builder tcpPortRange(int min, int max) {
            this.tcpPortMin = min;
            this.tcpPortMax = max;
            return this;
        }

        public Builder keepAliveInterval(Duration value) {
            this.keepAliveInterval = value;
            return this;
        }

        public Builder heartbeatWindow(Duration value) {
            this.heartbeatWindow = value;
            return this;
        }

        public Builder writeTimeout(Duration value) {
            this.writeTimeout = value;
            return this;
        }

        public Builder streamOpenTimeout(Duration value) {
            this.streamOpenTimeout = value;
            return this;
        }

        public Builder headReadTimeout(Duration value) {
            this.headReadTimeout = value;
            return this;
        }

        public Builder maxHeadBytes(int value) {
            this.maxHeadBytes = value;
            return this;
        }

        public Builder sweepInterval(Duration value) {
            this.sweepInterval = value;
            return this;
        }

        public Builder scaleUpDebounce(Duration value) {
            this.scaleUpDebounce = value;
            return this;
        }

        public Builder scaleUpRetries(int value) {
            this.scaleUpRetries = value;
            return this;
        }

        public Builder controllerUrl(String value) {
            this.controllerUrl = value;
            return this;
        }

        public Builder openProbes(boolean value) {
            this.openProbes = value;
            return this;
        }

        public Builder requireBrowserSession(boolean value) {
            this.requireBrowserSession = value;
            return this;
        }

        public Builder loginUrl(String value) {
            this.loginUrl = value;
            return this;
        }

        public Builder dataRoot(Path value) {
            this.dataRoot = value;
            return this;
        }

        public Builder auditSigningSecret(String value) {
            this.auditSigningSecret = value;
            return this;
        }

        public Builder keystore(String path, String pass, String type) {
            this.keystorePath = path;
            this.keystorePass = pass;
            this.keystoreType = type;
            return this;
        }

        public RelayConfig build() {
            return new RelayConfig(this);
        }
    }
}
