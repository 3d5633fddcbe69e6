package io.kuberde.mux;

import java.time.Duration;

/**
 * @param heartbeatTimeout close the session when nothing was received for this long; zero disables
 */
public record MuxConfig(
        Duration keepAliveInterval,
        Duration heartbeatTimeout,
        Duration writeTimeout,
        int initialWindow,
        int maxFramePayload,
        int acceptBacklog
) {
    public static final int DEFAULT_WINDOW = 256 * 1024;
    public static final int DEFAULT_MAX_FRAME_PAYLOAD = 64 * 1024;
    public static final int DEFAULT_ACCEPT_BACKLOG = 256;
    public static final int MAX_REAUTH_PAYLOAD = 16 * 1024;

    public MuxConfig {
        if (keepAliveInterval == null || keepAliveInterval.isZero() || keepAliveInterval.isNegative()) {
            throw new IllegalArgumentException("keep-alive interval must be positive");
        }
        heartbeatTimeout = heartbeatTimeout == null ? Duration.ZERO : heartbeatTimeout;
        if (writeTimeout == null || writeTimeout.isZero() || writeTimeout.isNegative()) {
            throw new IllegalArgumentException("write timeout must be positive");
        }
        if (initialWindow < 1024) {
            throw new IllegalArgumentException("initial window too small: " + initialWindow);
        }
        if (maxFramePayload < 1 || maxFramePayload > initialWindow) {
            throw new IllegalArgumentException("max frame payload must be in [1, initialWindow]");
        }
        acceptBacklog = Math.max(1, acceptBacklog);
    }

    public static MuxConfig of(Duration keepAliveInterval, Duration heartbeatTimeout, Duration writeTimeout) {
        return new MuxConfig(keepAliveInterval, heartbeatTimeout, writeTimeout, DEFAULT_WINDOW,
                DEFAULT_MAX_FRAME_PAYLOAD, DEFAULT_ACCEPT_BACKLOG);
    }

    public int maxInboundPayload() {
        return Math.max(initialWindow, MAX_REAUTH_PAYLOAD);
    }
}
