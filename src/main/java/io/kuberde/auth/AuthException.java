package io.kuberde.auth;

public final class AuthException extends Exception {
    public enum Kind {
        INVALID,
        EXPIRED
    }

    private final Kind kind;

    public AuthException(Kind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public AuthException(Kind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public static AuthException invalid(String message) {
        return new AuthException(Kind.INVALID, message);
    }

    public static AuthException expired(String message) {
        return new AuthException(Kind.EXPIRED, message);
    }

    public Kind kind() {
        return kind;
    }

    /**
     * Error code used in management API bodies.
     */
    public String errorCode() {
        return kind == Kind.EXPIRED ? "expired_token" : "invalid_token";
    }
}
