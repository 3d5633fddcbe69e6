package io.kuberde.controller;

import java.util.List;
import java.util.Optional;

/**
 * The slice of the Kubernetes API the controller needs. Updates carry the resource version they
 * were computed from and fail with {@link ReconcileConflictException} when it is stale.
 */
public interface ClusterClient {
    List<AgentWorkload> listWorkloads(String namespace) throws ClusterApiException;

    Optional<AgentWorkload> getWorkload(String namespace, String name) throws ClusterApiException;

    AgentWorkload updateStatus(AgentWorkload workload, AgentWorkload.Status status) throws ClusterApiException;

    AgentWorkload updateFinalizers(AgentWorkload workload, List<String> finalizers) throws ClusterApiException;

    Optional<ObservedDeployment> getDeployment(String namespace, String name) throws ClusterApiException;

    /**
     * Creates the deployment when {@code existing} is {@code null}, replaces it otherwise.
     */
    void applyDeployment(DeploymentModel desired, ObservedDeployment existing) throws ClusterApiException;

    void scaleDeployment(String namespace, String name, int replicas) throws ClusterApiException;

    void deleteDeployment(String namespace, String name) throws ClusterApiException;

    record ObservedDeployment(String namespace, String name, int replicas, String specHash, String resourceVersion) {
    }
}
