package io.kuberde.controller;

import java.io.IOException;

public final class RelayApiException extends IOException {
    private final int status;
    private final String error;

    public RelayApiException(int status, String error, String message) {
        super(message);
        this.status = status;
        this.error = error == null ? "" : error;
    }

    public int status() {
        return status;
    }

    public String error() {
        return error;
    }

    public boolean conflict() {
        return status == 409;
    }
}
