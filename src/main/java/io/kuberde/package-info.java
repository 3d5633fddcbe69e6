/**
 * KubeRDE source tree root.
 *
 * <p>Primary entry points while reading code:
 *
 * <ul>
 *   <li>{@code io.kuberde.Main} bootstraps the CLI process.</li>
 *   <li>{@code io.kuberde.relay.RelayServer} accepts agent tunnels and routes user traffic into them.</li>
 *   <li>{@code io.kuberde.agent.AgentRuntime} keeps one tunnel open from a workload pod.</li>
 *   <li>{@code io.kuberde.controller.Reconciler} turns {@code RDEAgent} resources into deployments and routes.</li>
 *   <li>{@code io.kuberde.mux.MuxSession} is the stream multiplexer both ends of a tunnel share.</li>
 * </ul>
 */
package io.kuberde;
