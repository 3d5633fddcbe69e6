package io.kuberde.mux;

import java.io.IOException;

/**
 * Protocol violation or session-level failure. Raised on any stream of the affected session.
 */
public class MuxException extends IOException {
    public MuxException(String message) {
        super(message);
    }

    public MuxException(String message, Throwable cause) {
        super(message, cause);
    }
}
