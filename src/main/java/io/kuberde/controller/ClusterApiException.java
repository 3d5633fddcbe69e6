package io.kuberde.controller;

import java.io.IOException;

/**
 * The cluster API answered with an error status or could not be reached.
 */
public class ClusterApiException extends IOException {
    private final int status;

    public ClusterApiException(int status, String message) {
        super(message);
        this.status = status;
    }

    public ClusterApiException(String message, Throwable cause) {
        super(message, cause);
        this.status = -1;
    }

    public int status() {
        return status;
    }
}
