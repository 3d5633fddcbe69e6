package io.kuberde.controller;

import com.fasterxml.jackson.databind.JsonNode;
import io.kuberde.model.AgentIdentity;

import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Typed view of an {@code RDEAgent} custom resource ({@code kuberde.io/v1beta1}, plural
 * {@code rdeagents}). Only the fields the controller reads are kept; values are raw so the
 * validator can report every problem at once.
 */
public record AgentWorkload(
        String namespace,
        String name,
        String uid,
        String resourceVersion,
        long generation,
        Instant creationTimestamp,
        Instant deletionTimestamp,
        List<String> finalizers,
        Spec spec,
        Status status
) {
    public static final String GROUP = "kuberde.io";
    public static final String VERSION = "v1beta1";
    public static final String PLURAL = "rdeagents";

    public AgentWorkload {
        finalizers = finalizers == null ? List.of() : List.copyOf(finalizers);
        status = status == null ? Status.initial() : status;
    }

    public boolean deleting() {
        return deletionTimestamp != null;
    }

    public boolean hasFinalizer(String finalizer) {
        return finalizers.contains(finalizer);
    }

    public AgentWorkload withStatus(Status next) {
        return new AgentWorkload(namespace, name, uid, resourceVersion, generation, creationTimestamp, deletionTimestamp,
                finalizers, spec, next);
    }

    /**
     * Workload identity, or {@code null} when owner or name cannot form one.
     */
    public String identityOrNull() {
        String owner = spec == null || spec.owner() == null ? "" : spec.owner().trim().toLowerCase(Locale.ROOT);
        String normalized = name == null ? "" : name.trim().toLowerCase(Locale.ROOT);
        if (!AgentIdentity.isValidOwner(owner) || !AgentIdentity.isValidLabel(normalized)) {
            return null;
        }
        return AgentIdentity.of(owner, normalized).value();
    }

    public String displayName() {
        return namespace + "/" + name;
    }

    public static AgentWorkload fromJson(JsonNode node) {
        JsonNode metadata = node.path("metadata");
        List<String> finalizers = new ArrayList<>();
        for (JsonNode item : metadata.path("finalizers")) {
            finalizers.add(item.asText());
        }
        return new AgentWorkload(
                metadata.path("namespace").asText(""),
                metadata.path("name").asText(""),
                metadata.path("uid").asText(""),
                metadata.path("resourceVersion").asText(""),
                metadata.path("generation").asLong(0L),
                parseInstant(metadata.path("creationTimestamp").asText(null)),
                parseInstant(metadata.path("deletionTimestamp").asText(null)),
                finalizers,
                Spec.fromJson(node.path("spec")),
                Status.fromJson(node.path("status"))
        );
    }

    static Instant parseInstant(String raw) {
        if (raw == null || raw.isBlank()) {
            return null;
        }
        try {
            return Instant.parse(raw.trim());
        } catch (DateTimeParseException e) {
            return null;
        }
    }

    private static List<String> strings(JsonNode node) {
        List<String> out = new ArrayList<>();
        for (JsonNode item : node) {
            out.add(item.asText());
        }
        return out;
    }

    public record Spec(
            String owner,
            String serverUrl,
            List<ServiceDecl> services,
            Container workloadContainer,
            String ttl,
            String authSecret
    ) {
        public Spec {
            services = services == null ? List.of() : List.copyOf(services);
        }

        static Spec fromJson(JsonNode node) {
            List<ServiceDecl> services = new ArrayList<>();
            for (JsonNode item : node.path("services")) {
                services.add(new ServiceDecl(
                        item.path("name").asText(""),
                        item.path("port").asInt(-1),
                        item.path("protocol").asText(""),
                        item.hasNonNull("externalPort") ? item.get("externalPort").asInt() : null
                ));
            }
            JsonNode container = node.path("workloadContainer");
            Container workload = container.isMissingNode() || container.isNull() ? null : Container.fromJson(container);
            return new Spec(
                    node.path("owner").asText(""),
                    node.path("serverUrl").asText(""),
                    services,
                    workload,
                    node.path("ttl").asText(""),
                    node.path("authSecret").asText("")
            );
        }
    }

    public record ServiceDecl(String name, int port, String protocol, Integer externalPort) {
    }

    public record Container(String image, List<String> command, List<String> args, List<Integer> ports, List<EnvVar> env) {
        public Container {
            command = command == null ? List.of() : List.copyOf(command);
            args = args == null ? List.of() : List.copyOf(args);
            ports = ports == null ? List.of() : List.copyOf(ports);
            env = env == null ? List.of() : List.copyOf(env);
        }

        static Container fromJson(JsonNode node) {
            List<Integer> ports = new ArrayList<>();
            for (JsonNode item : node.path("ports")) {
                ports.add(item.isObject() ? item.path("containerPort").asInt(-1) : item.asInt(-1));
            }
            List<EnvVar> env = new ArrayList<>();
            for (JsonNode item : node.path("env")) {
                env.add(new EnvVar(item.path("name").asText(""), item.path("value").asText("")));
            }
            return new Container(node.path("image").asText(""), strings(node.path("command")), strings(node.path("args")),
                    ports, env);
        }
    }

    public record EnvVar(String name, String value) {
    }

    /**
     * @param routes managed routes as {@code kind:key}, so routes of removed services can be found again
     */
    public record Status(
            WorkloadPhase phase,
            String message,
            Instant lastActivity,
            long observedGeneration,
            int replicas,
            List<String> routes
    ) {
        public Status {
            phase = phase == null ? WorkloadPhase.PENDING : phase;
            message = message == null ? "" : message;
            routes = routes == null ? List.of() : List.copyOf(routes);
        }

        public static Status initial() {
            return new Status(WorkloadPhase.PENDING, "", null, 0L, 0, List.of());
        }

        public Status withPhase(WorkloadPhase nextPhase, String nextMessage) {
            return new Status(nextPhase, nextMessage, lastActivity, observedGeneration, replicas, routes);
        }

        public Status withLastActivity(Instant next) {
            return new Status(phase, message, next, observedGeneration, replicas, routes);
        }

        public Status withObserved(long generation, int nextReplicas, List<String> nextRoutes) {
            return new Status(phase, message, lastActivity, generation, nextReplicas, nextRoutes);
        }

        public Map<String, Object> toJson() {
            Map<String, Object> out = new LinkedHashMap<>();
            out.put("phase", phase.wireName());
            out.put("message", message);
            out.put("lastActivity", lastActivity == null ? null : lastActivity.toString());
            out.put("observedGeneration", observedGeneration);
            out.put("replicas", replicas);
            out.put("routes", routes);
            return out;
        }

        static Status fromJson(JsonNode node) {
            if (node == null || node.isMissingNode() || node.isNull()) {
                return initial();
            }
            WorkloadPhase phase;
            try {
                phase = WorkloadPhase.fromString(node.path("phase").asText(""));
            } catch (IllegalArgumentException e) {
                phase = WorkloadPhase.PENDING;
            }
            return new Status(
                    phase,
                    node.path("message").asText(""),
                    parseInstant(node.path("lastActivity").asText(null)),
                    node.path("observedGeneration").asLong(0L),
                    node.path("replicas").asInt(0),
                    strings(node.path("routes"))
            );
        }

        /**
         * Same content; a write is needed only when this is {@code false}.
         */
        public boolean sameAs(Status other) {
            return other != null
                    && phase == other.phase
                    && message.equals(other.message)
                    && Objects.equals(lastActivity, other.lastActivity)
                    && observedGeneration == other.observedGeneration
                    && replicas == other.replicas
                    && routes.equals(other.routes);
        }
    }
}
