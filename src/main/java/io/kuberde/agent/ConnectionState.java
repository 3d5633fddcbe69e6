package io.kuberde.agent;

/**
 * Lifecycle of the agent's tunnel. {@code SHUTDOWN} is terminal.
 */
public enum ConnectionState {
    DISCONNECTED,
    CONNECTING,
    AUTHENTICATED,
    STREAMING,
    SHUTDOWN
}
