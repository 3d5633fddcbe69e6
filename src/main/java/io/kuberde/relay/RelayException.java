package io.kuberde.relay;

import java.io.IOException;

/**
 * Data-plane failure for one inbound connection. It closes that connection only.
 */
public final class RelayException extends IOException {
    private final Reason reason;

    public RelayException(Reason reason, String message) {
        super(message);
        this.reason = reason;
    }

    public RelayException(Reason reason, String message, Throwable cause) {
        super(message, cause);
        this.reason = reason;
    }

    public Reason reason() {
        return reason;
    }

    public enum Reason {
        NO_ROUTE("no_route"),
        AGENT_UNAVAILABLE("agent_unavailable"),
        TIMEOUT("timeout");

        private final String code;

        Reason(String code) {
            this.code = code;
        }

        public String code() {
            return code;
        }
    }
}
