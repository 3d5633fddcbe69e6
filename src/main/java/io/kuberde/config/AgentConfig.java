package io.kuberde.config;

import io.kuberde.model.ServiceTable;
import io.kuberde.util.Backoff;
import io.kuberde.util.Durations;

import java.net.URI;
import java.time.Duration;
import java.util.Map;

/**
 * Agent bootstrap, read from the pod environment the controller renders.
 */
public final class AgentConfig {
    public static final String ENV_SERVER_URL = "SERVER_URL";
    public static final String ENV_AGENT_ID = "AGENT_ID";
    public static final String ENV_SERVICES = "KUBERDE_SERVICES";
    public static final String ENV_CLIENT_ID = "AUTH_CLIENT_ID";
    public static final String ENV_CLIENT_SECRET = "AUTH_CLIENT_SECRET";
    public static final String ENV_TOKEN_URL = "AUTH_TOKEN_URL";
    public static final String ENV_LOCAL_HOST = "LOCAL_HOST";
    public static final String ENV_TRUSTSTORE = "TLS_TRUSTSTORE";
    public static final String ENV_TRUSTSTORE_PASSWORD = "TLS_TRUSTSTORE_PASSWORD";
    public static final String ENV_REVOCATION_FILE = "TLS_REVOCATION_FILE";
    public static final String ENV_KEEP_ALIVE = "KEEP_ALIVE_INTERVAL";

    public static final String DEFAULT_LOCAL_HOST = "127.0.0.1";
    public static final Duration DEFAULT_BACKOFF_INITIAL = Duration.ofSeconds(1);
    public static final Duration DEFAULT_BACKOFF_MAX = Duration.ofSeconds(30);
    public static final double DEFAULT_BACKOFF_MULTIPLIER = 2.0d;
    public static final Duration DEFAULT_LOCAL_DIAL_WINDOW = Duration.ofSeconds(10);
    public static final Duration DEFAULT_LOCAL_DIAL_STEP = Duration.ofMillis(500);
    public static final Duration DEFAULT_PREAMBLE_TIMEOUT = Duration.ofSeconds(10);
    public static final Duration DEFAULT_CONNECT_TIMEOUT = Duration.ofSeconds(10);
    public static final double DEFAULT_REFRESH_FRACTION = 0.8d;
    public static final int DEFAULT_REFRESH_RETRIES = 5;

    private final URI serverUrl;
    private final String agentId;
    private final ServiceTable services;
    private final String clientId;
    private final String clientSecret;
    private final URI tokenUrl;
    private final String localHost;
    private final String truststorePath;
    private final String truststorePassword;
    private final String revocationFile;
    private final Duration keepAliveInterval;
    private final Backoff reconnectBackoff;
    private final Backoff refreshBackoff;
    private final Duration localDialWindow;
    private final Duration localDialStep;
    private final Duration preambleTimeout;
    private final Duration connectTimeout;
    private final double refreshFraction;
    private final int refreshRetries;

    public AgentConfig(
            URI serverUrl,
            String agentId,
            ServiceTable services,
            String clientId,
            String clientSecret,
            URI tokenUrl,
            String localHost,
            String truststorePath,
            String truststorePassword,
            String revocationFile,
            Duration keepAliveInterval,
            Backoff reconnectBackoff,
            Backoff refreshBackoff,
            Duration localDialWindow,
            Duration localDialStep,
            Duration preambleTimeout,
            Duration connectTimeout,
            double refreshFraction,
            int refreshRetries
    ) {
        if (serverUrl == null) {
            throw new IllegalArgumentException(ENV_SERVER_URL + " is required");
        }
        if (agentId == null || agentId.isBlank()) {
            throw new IllegalArgumentException(ENV_AGENT_ID + " is required");
        }
        if (services == null) {
            throw new IllegalArgumentException(ENV_SERVICES + " is required");
        }
        if (refreshFraction <= 0.0d || refreshFraction >= 1.0d) {
            throw new IllegalArgumentException("refresh fraction must be in (0,1)");
        }
        this.serverUrl = serverUrl;
        this.agentId = agentId.trim();
        this.services = services;
        this.clientId = clientId;
        this.clientSecret = clientSecret;
        this.tokenUrl = tokenUrl;
        this.localHost = localHost == null || localHost.isBlank() ? DEFAULT_LOCAL_HOST : localHost.trim();
        this.truststorePath = truststorePath == null || truststorePath.isBlank() ? null : truststorePath.trim();
        this.truststorePassword = truststorePassword;
        this.revocationFile = revocationFile == null || revocationFile.isBlank() ? null : revocationFile.trim();
        this.keepAliveInterval = keepAliveInterval == null ? RelayConfig.DEFAULT_KEEP_ALIVE_INTERVAL : keepAliveInterval;
        this.reconnectBackoff = reconnectBackoff;
        this.refreshBackoff = refreshBackoff;
        this.localDialWindow = localDialWindow;
        this.localDialStep = localDialStep;
        this.preambleTimeout = preambleTimeout;
        this.connectTimeout = connectTimeout;
        this.refreshFraction = refreshFraction;
        this.refreshRetries = Math.max(1, refreshRetries);
    }

    public static AgentConfig fromEnvironment(Map<String, String> env) {
        String server = required(env, ENV_SERVER_URL);
        String agentId = required(env, ENV_AGENT_ID);
        ServiceTable services = ServiceTable.parse(required(env, ENV_SERVICES));
        String clientId = required(env, ENV_CLIENT_ID);
        String clientSecret = required(env, ENV_CLIENT_SECRET);
        String tokenUrl = required(env, ENV_TOKEN_URL);
        return new AgentConfig(
                URI.create(server),
                agentId,
                services,
                clientId,
                clientSecret,
                URI.create(tokenUrl),
                env.get(ENV_LOCAL_HOST),
                env.get(ENV_TRUSTSTORE),
                env.get(ENV_TRUSTSTORE_PASSWORD),
                env.get(ENV_REVOCATION_FILE),
                Durations.parseOrDefault(env.get(ENV_KEEP_ALIVE), RelayConfig.DEFAULT_KEEP_ALIVE_INTERVAL),
                new Backoff(DEFAULT_BACKOFF_INITIAL, DEFAULT_BACKOFF_MAX, DEFAULT_BACKOFF_MULTIPLIER),
                new Backoff(DEFAULT_BACKOFF_INITIAL, DEFAULT_BACKOFF_MAX, DEFAULT_BACKOFF_MULTIPLIER),
                DEFAULT_LOCAL_DIAL_WINDOW,
                DEFAULT_LOCAL_DIAL_STEP,
                DEFAULT_PREAMBLE_TIMEOUT,
                DEFAULT_CONNECT_TIMEOUT,
                DEFAULT_REFRESH_FRACTION,
                DEFAULT_REFRESH_RETRIES
        );
    }

    public URI serverUrl() {
        return serverUrl;
    }

    public String agentId() {
        return agentId;
    }

    public ServiceTable services() {
        return services;
    }

    public String clientId() {
        return clientId;
    }

    public String clientSecret() {
        return clientSecret;
    }

    public URI tokenUrl() {
        return tokenUrl;
    }

    public String localHost() {
        return localHost;
    }

    public String truststorePath() {
        return truststorePath;
    }

    public String truststorePassword() {
        return truststorePassword;
    }

    public String revocationFile() {
        return revocationFile;
    }

    public Duration keepAliveInterval() {
        return keepAliveInterval;
    }

    public Backoff reconnectBackoff() {
        return reconnectBackoff;
    }

    public Backoff refreshBackoff() {
        return refreshBackoff;
    }

    public Duration localDialWindow() {
        return localDialWindow;
    }

    public Duration localDialStep() {
        return localDialStep;
    }

    public Duration preambleTimeout() {
        return preambleTimeout;
    }

    public Duration connectTimeout() {
        return connectTimeout;
    }

    public double refreshFraction() {
        return refreshFraction;
    }

    public int refreshRetries() {
        return refreshRetries;
    }

    public boolean tlsEnabled() {
        String scheme = serverUrl.getScheme();
        return "wss".equalsIgnoreCase(scheme) || "https".equalsIgnoreCase(scheme);
    }

    private static String required(Map<String, String> env, String key) {
        String value = env == null ? null : env.get(key);
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(key + " is required");
        }
        return value.trim();
    }
}
