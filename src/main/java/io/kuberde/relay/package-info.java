/**
 * Relay server package.
 *
 * <p>{@link io.kuberde.relay.RelayServer} owns the listeners: agent tunnels, the HTTP frontend,
 * per-route TCP ports and the management API. {@link io.kuberde.relay.RoutingTable} and
 * {@link io.kuberde.relay.SessionRegistry} hold all routing state in memory.
 */
package io.kuberde.relay;
