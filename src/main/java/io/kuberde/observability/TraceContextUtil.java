package io.kuberde.observability;

import java.security.SecureRandom;
import java.util.HexFormat;

/**
 * W3C-style identifiers that tie audit rows of one inbound connection or one reconcile pass together.
 */
public final class TraceContextUtil {
    private static final SecureRandom RANDOM = new SecureRandom();

    private TraceContextUtil() {
    }

    public static String newTraceId() {
        return randomHex(16);
    }

    /**
     * First eight hex characters, for console lines.
     */
    public static String shortId(String traceId) {
        if (traceId == null) {
            return "-";
        }
        return traceId.length() <= 8 ? traceId : traceId.substring(0, 8);
    }

    private static String randomHex(int bytes) {
        byte[] value = new byte[bytes];
        RANDOM.nextBytes(value);
        return HexFormat.of().formatHex(value);
    }
}
