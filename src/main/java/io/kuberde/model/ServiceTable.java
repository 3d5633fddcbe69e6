package io.kuberde.model;

import com.fasterxml.jackson.databind.JsonNode;
import io.kuberde.util.Jsons;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Immutable selector table shipped to the agent in {@code KUBERDE_SERVICES}. Accepts either
 * {@code {"services":[...]}} or a bare array; each element is {@code {name, port, protocol}}.
 */
public final class ServiceTable {
    private final Map<String, ServiceSpec> services;

    private ServiceTable(Map<String, ServiceSpec> services) {
        this.services = Collections.unmodifiableMap(services);
    }

    public static ServiceTable of(List<ServiceSpec> specs) {
        if (specs == null || specs.isEmpty()) {
            throw new IllegalArgumentException("service table is empty");
        }
        LinkedHashMap<String, ServiceSpec> out = new LinkedHashMap<>();
        for (ServiceSpec spec : specs) {
            if (spec == null || spec.name() == null || !AgentIdentity.isValidLabel(spec.name())) {
                throw new IllegalArgumentException("Invalid service name: " + (spec == null ? null : spec.name()));
            }
            if (spec.port() < 1 || spec.port() > 65535) {
                throw new IllegalArgumentException("Invalid port for service " + spec.name() + ": " + spec.port());
            }
            if (out.putIfAbsent(spec.name(), spec) != null) {
                throw new IllegalArgumentException("Duplicate service name: " + spec.name());
            }
        }
        return new ServiceTable(out);
    }

    public static ServiceTable parse(String json) {
        if (json == null || json.isBlank()) {
            throw new IllegalArgumentException("service table is empty");
        }
        JsonNode root;
        try {
            root = Jsons.mapper().readTree(json);
        } catch (Exception e) {
            throw new IllegalArgumentException("Malformed service table JSON", e);
        }
        JsonNode items = root != null && root.isObject() ? root.path("services") : root;
        if (items == null || !items.isArray()) {
            throw new IllegalArgumentException("service table must be a JSON array or {\"services\":[...]}");
        }
        List<ServiceSpec> specs = new ArrayList<>();
        for (JsonNode item : items) {
            String name = item.path("name").asText("").trim();
            int port = item.path("port").asInt(-1);
            ServiceProtocol protocol = ServiceProtocol.fromString(item.path("protocol").asText(""));
            Integer external = item.hasNonNull("externalPort") ? item.get("externalPort").asInt() : null;
            specs.add(new ServiceSpec(name, port, protocol, external));
        }
        return of(specs);
    }

    public Optional<ServiceSpec> find(String name) {
        if (name == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(services.get(name));
    }

    public List<String> names() {
        return List.copyOf(services.keySet());
    }

    public List<ServiceSpec> specs() {
        return List.copyOf(services.values());
    }

    public int size() {
        return services.size();
    }

    public String toJson() {
        List<Map<String, Object>> rows = new ArrayList<>();
        for (ServiceSpec spec : services.values()) {
            Map<String, Object> row = new LinkedHashMap<>();
            row.put("name", spec.name());
            row.put("port", spec.port());
            row.put("protocol", spec.protocol().wireName());
            rows.add(row);
        }
        return Jsons.toCompactJson(Map.of("services", rows));
    }
}
