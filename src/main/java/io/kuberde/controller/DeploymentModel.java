package io.kuberde.controller;

import io.kuberde.config.AgentConfig;
import io.kuberde.model.ServiceSpec;
import io.kuberde.util.Hashing;
import io.kuberde.util.Jsons;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Desired deployment for one workload: the agent container next to the user's workload container,
 * one replica or none while idle. The spec hash annotation lets the reconciler replace the
 * deployment only when something other than the replica count changed.
 */
public record DeploymentModel(
        String namespace,
        String name,
        Map<String, String> labels,
        Map<String, String> annotations,
        int replicas,
        List<Map<String, Object>> containers
) {
    public static final String APP_LABEL = "app";
    public static final String APP_NAME = "kuberde-agent";
    public static final String INSTANCE_LABEL = "instance";
    public static final String AGENT_ID_ANNOTATION = "kuberde.io/agent-id";
    public static final String SPEC_HASH_ANNOTATION = "kuberde.io/spec-hash";
    public static final String AGENT_CONTAINER = "kuberde-agent";
    public static final String WORKLOAD_CONTAINER = "workload";

    public DeploymentModel {
        labels = Map.copyOf(labels);
        annotations = Map.copyOf(annotations);
        containers = List.copyOf(containers);
    }

    public static DeploymentModel desired(WorkloadValidator.Validated workload, String agentImage, int replicas) {
        String identity = workload.identity().value();
        Map<String, String> labels = new LinkedHashMap<>();
        labels.put(APP_LABEL, APP_NAME);
        labels.put(INSTANCE_LABEL, instanceHash(identity));

        List<Map<String, Object>> containers = new ArrayList<>();
        containers.add(agentContainer(workload, agentImage));
        containers.add(workloadContainer(workload));

        Map<String, Object> hashed = new LinkedHashMap<>();
        hashed.put("labels", labels);
        hashed.put("containers", containers);
        Map<String, String> annotations = new LinkedHashMap<>();
        annotations.put(AGENT_ID_ANNOTATION, identity);
        annotations.put(SPEC_HASH_ANNOTATION, Hashing.sha256Hex(Jsons.toCompactJson(hashed)));
        return new DeploymentModel(workload.workload().namespace(), identity, labels, annotations, replicas, containers);
    }

    public static String instanceHash(String identity) {
        return Hashing.sha256Hex(identity).substring(0, 10);
    }

    public String specHash() {
        return annotations.get(SPEC_HASH_ANNOTATION);
    }

    public DeploymentModel withReplicas(int next) {
        return new DeploymentModel(namespace, name, labels, annotations, next, containers);
    }

    /**
     * {@code apps/v1} Deployment manifest.
     */
    public Map<String, Object> toManifest(String resourceVersion) {
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("name", name);
        metadata.put("namespace", namespace);
        metadata.put("labels", labels);
        metadata.put("annotations", annotations);
        if (resourceVersion != null && !resourceVersion.isBlank()) {
            metadata.put("resourceVersion", resourceVersion);
        }
        Map<String, Object> podSpec = new LinkedHashMap<>();
        podSpec.put("containers", containers);
        Map<String, Object> template = new LinkedHashMap<>();
        template.put("metadata", Map.of("labels", labels, "annotations", Map.of(AGENT_ID_ANNOTATION, name)));
        template.put("spec", podSpec);
        Map<String, Object> spec = new LinkedHashMap<>();
        spec.put("replicas", replicas);
        spec.put("selector", Map.of("matchLabels", labels));
        spec.put("template", template);
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("apiVersion", "apps/v1");
        out.put("kind", "Deployment");
        out.put("metadata", metadata);
        out.put("spec", spec);
        return out;
    }

    private static Map<String, Object> agentContainer(WorkloadValidator.Validated workload, String agentImage) {
        String secret = workload.workload().spec().authSecret().trim();
        List<Map<String, Object>> env = new ArrayList<>();
        env.add(plainEnv(AgentConfig.ENV_SERVER_URL, workload.serverUrl().toString()));
        env.add(plainEnv(AgentConfig.ENV_AGENT_ID, workload.identity().value()));
        env.add(plainEnv(AgentConfig.ENV_SERVICES, workload.services().toJson()));
        env.add(secretEnv(AgentConfig.ENV_CLIENT_ID, secret, "client-id"));
        env.add(secretEnv(AgentConfig.ENV_CLIENT_SECRET, secret, "client-secret"));
        env.add(secretEnv(AgentConfig.ENV_TOKEN_URL, secret, "token-url"));
        Map<String, Object> container = new LinkedHashMap<>();
        container.put("name", AGENT_CONTAINER);
        container.put("image", agentImage);
        container.put("args", List.of("agent"));
        container.put("env", env);
        return container;
    }

    private static Map<String, Object> workloadContainer(WorkloadValidator.Validated workload) {
        AgentWorkload.Container spec = workload.container();
        Set<Integer> ports = new LinkedHashSet<>();
        for (ServiceSpec service : workload.services().specs()) {
            ports.add(service.port());
        }
        ports.addAll(spec.ports());
        List<Map<String, Object>> portList = new ArrayList<>();
        for (Integer port : ports) {
            Map<String, Object> entry = new LinkedHashMap<>();
            entry.put("containerPort", port);
            entry.put("protocol", "TCP");
            portList.add(entry);
        }
        List<Map<String, Object>> env = new ArrayList<>();
        for (AgentWorkload.EnvVar var : spec.env()) {
            env.add(plainEnv(var.name(), var.value()));
        }
        Map<String, Object> container = new LinkedHashMap<>();
        container.put("name", WORKLOAD_CONTAINER);
        container.put("image", spec.image());
        if (!spec.command().isEmpty()) {
            container.put("command", spec.command());
        }
        if (!spec.args().isEmpty()) {
            container.put("args", spec.args());
        }
        container.put("ports", portList);
        if (!env.isEmpty()) {
            container.put("env", env);
        }
        return container;
    }

    private static Map<String, Object> plainEnv(String name, String value) {
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("name", name);
        out.put("value", value == null ? "" : value);
        return out;
    }

    private static Map<String, Object> secretEnv(String name, String secret, String key) {
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("name", name);
        Map<String, Object> ref = new LinkedHashMap<>();
        ref.put("name", secret);
        ref.put("key", key);
        out.put("valueFrom", Map.of("secretKeyRef", ref));
        return out;
    }
}
