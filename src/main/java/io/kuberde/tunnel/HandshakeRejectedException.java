package io.kuberde.tunnel;

import java.io.IOException;

/**
 * The relay answered the upgrade request with something other than {@code 101}.
 */
public final class HandshakeRejectedException extends IOException {
    private final int status;

    public HandshakeRejectedException(int status, String message) {
        super("handshake rejected with status " + status + (message == null || message.isBlank() ? "" : ": " + message));
        this.status = status;
    }

    public int status() {
        return status;
    }

    public boolean unauthorized() {
        return status == 401 || status == 403;
    }
}
