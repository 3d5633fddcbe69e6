package io.kuberde.controller;

/**
 * An update lost an optimistic-concurrency race; re-read and try again.
 */
public final class ReconcileConflictException extends ClusterApiException {
    public ReconcileConflictException(String message) {
        super(409, message);
    }
}
