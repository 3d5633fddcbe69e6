package io.kuberde.controller;

import com.fasterxml.jackson.databind.JsonNode;
import io.kuberde.util.Jsons;

import javax.net.ssl.SSLContext;
import javax.net.ssl.TrustManagerFactory;
import java.io.IOException;
import java.io.InputStream;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.GeneralSecurityException;
import java.security.KeyStore;
import java.security.cert.Certificate;
import java.security.cert.CertificateFactory;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * {@link ClusterClient} over the Kubernetes REST API. In a pod it authenticates with the mounted
 * service-account token and trusts the mounted cluster CA.
 */
public final class KubernetesClusterClient implements ClusterClient {
    public static final Path SERVICE_ACCOUNT_DIR = Path.of("/var/run/secrets/kubernetes.io/serviceaccount");
    private static final String MERGE_PATCH = "application/merge-patch+json";
    private static final Duration REQUEST_TIMEOUT = Duration.ofSeconds(30);

    private final HttpClient http;
    private final String apiServer;
    private final Path tokenFile;

    public KubernetesClusterClient(HttpClient http, String apiServer, Path tokenFile) {
        this.http = http;
        this.apiServer = apiServer.endsWith("/") ? apiServer.substring(0, apiServer.length() - 1) : apiServer;
        this.tokenFile = tokenFile;
    }

    /**
     * Client for the cluster this process runs in.
     */
    public static KubernetesClusterClient inCluster() throws IOException, GeneralSecurityException {
        String host = System.getenv("KUBERNETES_SERVICE_HOST");
        String port = System.getenv("KUBERNETES_SERVICE_PORT");
        if (host == null || host.isBlank()) {
            throw new IllegalStateException("KUBERNETES_SERVICE_HOST is not set; not running in a cluster");
        }
        String hostPart = host.contains(":") ? "[" + host + "]" : host;
        String server = "https://" + hostPart + ":" + (port == null || port.isBlank() ? "443" : port.trim());
        HttpClient client = HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(10))
                .sslContext(clusterTrust(SERVICE_ACCOUNT_DIR.resolve("ca.crt")))
                .build();
        return new KubernetesClusterClient(client, server, SERVICE_ACCOUNT_DIR.resolve("token"));
    }

    static SSLContext clusterTrust(Path caFile) throws IOException, GeneralSecurityException {
        KeyStore trust = KeyStore.getInstance(KeyStore.getDefaultType());
        trust.load(null, null);
        try (InputStream in = Files.newInputStream(caFile)) {
            int i = 0;
            for (Certificate cert : CertificateFactory.getInstance("X.509").generateCertificates(in)) {
                trust.setCertificateEntry("cluster-ca-" + i++, cert);
            }
        }
        TrustManagerFactory tmf = TrustManagerFactory.getInstance(TrustManagerFactory.getDefaultAlgorithm());
        tmf.init(trust);
        SSLContext ssl = SSLContext.getInstance("TLS");
        ssl.init(null, tmf.getTrustManagers(), null);
        return ssl;
    }

    @Override
    public List<AgentWorkload> listWorkloads(String namespace) throws ClusterApiException {
        JsonNode list = send("GET", workloadsPath(namespace), null, null);
        List<AgentWorkload> out = new ArrayList<>();
        for (JsonNode item : list.path("items")) {
            out.add(AgentWorkload.fromJson(item));
        }
        return out;
    }

    @Override
    public Optional<AgentWorkload> getWorkload(String namespace, String name) throws ClusterApiException {
        JsonNode node = sendOptional("GET", workloadsPath(namespace) + "/" + encode(name));
        return node == null ? Optional.empty() : Optional.of(AgentWorkload.fromJson(node));
    }

    @Override
    public AgentWorkload updateStatus(AgentWorkload workload, AgentWorkload.Status status) throws ClusterApiException {
        Map<String, Object> patch = new LinkedHashMap<>();
        patch.put("metadata", Map.of("resourceVersion", workload.resourceVersion()));
        patch.put("status", status.toJson());
        JsonNode node = send("PATCH", workloadsPath(workload.namespace()) + "/" + encode(workload.name()) + "/status",
                MERGE_PATCH, Jsons.toCompactJson(patch));
        return AgentWorkload.fromJson(node);
    }

    @Override
    public AgentWorkload updateFinalizers(AgentWorkload workload, List<String> finalizers) throws ClusterApiException {
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("resourceVersion", workload.resourceVersion());
        metadata.put("finalizers", finalizers);
        JsonNode node = send("PATCH", workloadsPath(workload.namespace()) + "/" + encode(workload.name()),
                MERGE_PATCH, Jsons.toCompactJson(Map.of("metadata", metadata)));
        return AgentWorkload.fromJson(node);
    }

    @Override
    public Optional<ObservedDeployment> getDeployment(String namespace, String name) throws ClusterApiException {
        JsonNode node = sendOptional("GET", deploymentsPath(namespace) + "/" + encode(name));
        if (node == null) {
            return Optional.empty();
        }
        JsonNode metadata = node.path("metadata");
        return Optional.of(new ObservedDeployment(
                namespace,
                name,
                node.path("spec").path("replicas").asInt(1),
                metadata.path("annotations").path(DeploymentModel.SPEC_HASH_ANNOTATION).asText(""),
                metadata.path("resourceVersion").asText("")
        ));
    }

    @Override
    public void applyDeployment(DeploymentModel desired, ObservedDeployment existing) throws ClusterApiException {
        if (existing == null) {
            send("POST", deploymentsPath(desired.namespace()), "application/json",
                    Jsons.toCompactJson(desired.toManifest(null)));
            return;
        }
        send("PUT", deploymentsPath(desired.namespace()) + "/" + encode(desired.name()), "application/json",
                Jsons.toCompactJson(desired.toManifest(existing.resourceVersion())));
    }

    @Override
    public void scaleDeployment(String namespace, String name, int replicas) throws ClusterApiException {
        send("PATCH", deploymentsPath(namespace) + "/" + encode(name) + "/scale", MERGE_PATCH,
                Jsons.toCompactJson(Map.of("spec", Map.of("replicas", replicas))));
    }

    @Override
    public void deleteDeployment(String namespace, String name) throws ClusterApiException {
        sendOptional("DELETE", deploymentsPath(namespace) + "/" + encode(name));
    }

    private JsonNode sendOptional(String method, String path) throws ClusterApiException {
        try {
            return send(method, path, null, null);
        } catch (ClusterApiException e) {
            if (e.status() == 404) {
                return null;
            }
            throw e;
        }
    }

    private JsonNode send(String method, String path, String contentType, String body) throws ClusterApiException {
        HttpRequest.Builder builder = HttpRequest.newBuilder(URI.create(apiServer + path))
                .timeout(REQUEST_TIMEOUT)
                .header("Accept", "application/json");
        String token = readToken();
        if (token != null) {
            builder.header("Authorization", "Bearer " + token);
        }
        if (body == null) {
            builder.method(method, HttpRequest.BodyPublishers.noBody());
        } else {
            builder.header("Content-Type", contentType);
            builder.method(method, HttpRequest.BodyPublishers.ofString(body));
        }
        HttpResponse<String> response;
        try {
            response = http.send(builder.build(), HttpResponse.BodyHandlers.ofString());
        } catch (IOException e) {
            throw new ClusterApiException(method + " " + path + " failed: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ClusterApiException("interrupted during " + method + " " + path, e);
        }
        int status = response.statusCode();
        if (status == 409) {
            throw new ReconcileConflictException(method + " " + path + " conflicted: " + statusMessage(response.body()));
        }
        if (status >= 300) {
            throw new ClusterApiException(status, method + " " + path + " answered " + status + ": " + statusMessage(response.body()));
        }
        try {
            String text = response.body();
            return text == null || text.isBlank() ? Jsons.mapper().createObjectNode() : Jsons.mapper().readTree(text);
        } catch (IOException e) {
            throw new ClusterApiException("unreadable response from " + method + " " + path, e);
        }
    }

    private String readToken() throws ClusterApiException {
        if (tokenFile == null || !Files.exists(tokenFile)) {
            return null;
        }
        try {
            // Projected tokens rotate; read on every call.
            return Files.readString(tokenFile, StandardCharsets.UTF_8).trim();
        } catch (IOException e) {
            throw new ClusterApiException("cannot read service account token " + tokenFile, e);
        }
    }

    private static String statusMessage(String body) {
        if (body == null || body.isBlank()) {
            return "";
        }
        try {
            JsonNode node = Jsons.mapper().readTree(body);
            String message = node.path("message").asText("");
            return message.isEmpty() ? body : message;
        } catch (IOException e) {
            return body;
        }
    }

    private static String workloadsPath(String namespace) {
        return "/apis/" + AgentWorkload.GROUP + "/" + AgentWorkload.VERSION + "/namespaces/" + encode(namespace)
                + "/" + AgentWorkload.PLURAL;
    }

    private static String deploymentsPath(String namespace) {
        return "/apis/apps/v1/namespaces/" + encode(namespace) + "/deployments";
    }

    private static String encode(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8);
    }
}
