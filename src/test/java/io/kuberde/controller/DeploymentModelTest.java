package io.kuberde.controller;

import io.kuberde.config.AgentConfig;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Map;

final class DeploymentModelTest {
    private final WorkloadValidator validator = new WorkloadValidator(Duration.ofHours(8));

    @Test
    void rendersAgentSidecarNextToWorkload() throws Exception {
        DeploymentModel model = DeploymentModel.desired(
                validator.validate(ReconcilerTest.workload("8h", ReconcilerTest.ideServices())), "kuberde/agent:1.0", 1);

        Assertions.assertEquals("user-alice-dev", model.name());
        Assertions.assertEquals("kuberde", model.namespace());
        Assertions.assertEquals(DeploymentModel.APP_NAME, model.labels().get(DeploymentModel.APP_LABEL));
        Assertions.assertEquals(10, model.labels().get(DeploymentModel.INSTANCE_LABEL).length());
        Assertions.assertEquals("user-alice-dev", model.annotations().get(DeploymentModel.AGENT_ID_ANNOTATION));

        Map<String, Object> agent = model.containers().get(0);
        Assertions.assertEquals(DeploymentModel.AGENT_CONTAINER, agent.get("name"));
        Assertions.assertEquals("kuberde/agent:1.0", agent.get("image"));
        String env = agent.get("env").toString();
        Assertions.assertTrue(env.contains(AgentConfig.ENV_AGENT_ID), env);
        Assertions.assertTrue(env.contains("secretKeyRef"), env);
        Assertions.assertTrue(env.contains("alice-agent-credentials"), env);

        Map<String, Object> workload = model.containers().get(1);
        Assertions.assertEquals("ghcr.io/acme/ide:1.4", workload.get("image"));
        List<?> ports = (List<?>) workload.get("ports");
        Assertions.assertEquals(2, ports.size());
    }

    @Test
    void specHashIgnoresReplicaCountButTracksContainers() throws Exception {
        WorkloadValidator.Validated validated = validator.validate(ReconcilerTest.workload("8h", ReconcilerTest.ideServices()));
        DeploymentModel active = DeploymentModel.desired(validated, "kuberde/agent:1.0", 1);
        DeploymentModel idle = DeploymentModel.desired(validated, "kuberde/agent:1.0", 0);
        DeploymentModel upgraded = DeploymentModel.desired(validated, "kuberde/agent:1.1", 1);

        Assertions.assertEquals(active.specHash(), idle.specHash());
        Assertions.assertNotEquals(active.specHash(), upgraded.specHash());
        Assertions.assertEquals(0, active.withReplicas(0).replicas());
    }

    @Test
    void manifestCarriesSelectorAndResourceVersion() throws Exception {
        DeploymentModel model = DeploymentModel.desired(
                validator.validate(ReconcilerTest.workload("8h", ReconcilerTest.ideServices())), "kuberde/agent:1.0", 0);
        Map<String, Object> manifest = model.toManifest("42");
        Assertions.assertEquals("apps/v1", manifest.get("apiVersion"));
        Assertions.assertEquals("Deployment", manifest.get("kind"));
        Map<?, ?> metadata = (Map<?, ?>) manifest.get("metadata");
        Assertions.assertEquals("42", metadata.get("resourceVersion"));
        Map<?, ?> spec = (Map<?, ?>) manifest.get("spec");
        Assertions.assertEquals(0, spec.get("replicas"));
        Assertions.assertEquals(Map.of("matchLabels", model.labels()), spec.get("selector"));
        Assertions.assertFalse(((Map<?, ?>) model.toManifest(null).get("metadata")).containsKey("resourceVersion"));
    }
}
