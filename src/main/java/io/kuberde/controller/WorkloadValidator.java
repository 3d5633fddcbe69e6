package io.kuberde.controller;

import io.kuberde.model.AgentIdentity;
import io.kuberde.model.ServiceProtocol;
import io.kuberde.model.ServiceSpec;
import io.kuberde.model.ServiceTable;
import io.kuberde.util.Durations;

import java.net.URI;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Checks an {@code RDEAgent} before anything is created for it and collects every problem found.
 */
public final class WorkloadValidator {
    static final int MAX_DEPLOYMENT_NAME = 63;

    private final Duration defaultTtl;

    public WorkloadValidator(Duration defaultTtl) {
        this.defaultTtl = defaultTtl;
    }

    public Validated validate(AgentWorkload workload) throws InvalidResourceException {
        List<String> problems = new ArrayList<>();
        AgentWorkload.Spec spec = workload.spec();
        String owner = spec.owner() == null ? "" : spec.owner().trim().toLowerCase(Locale.ROOT);
        String name = workload.name() == null ? "" : workload.name().trim().toLowerCase(Locale.ROOT);
        if (owner.isEmpty()) {
            problems.add("spec.owner is required");
        } else if (!AgentIdentity.isValidOwner(owner)) {
            problems.add("spec.owner must be a DNS label without '-': " + spec.owner());
        }
        if (!AgentIdentity.isValidLabel(name)) {
            problems.add("metadata.name is not a valid DNS label: " + workload.name());
        }
        AgentIdentity identity = null;
        if (problems.isEmpty()) {
            identity = AgentIdentity.of(owner, name);
            if (identity.value().length() > MAX_DEPLOYMENT_NAME) {
                problems.add("workload identity " + identity.value() + " exceeds " + MAX_DEPLOYMENT_NAME + " characters");
            }
        }

        String serverUrl = spec.serverUrl() == null ? "" : spec.serverUrl().trim();
        if (serverUrl.isEmpty()) {
            problems.add("spec.serverUrl is required");
        } else if (!validServerUrl(serverUrl)) {
            problems.add("spec.serverUrl must be a ws, wss, http or https URL: " + serverUrl);
        }
        if (spec.authSecret() == null || spec.authSecret().isBlank()) {
            problems.add("spec.authSecret is required");
        }

        List<ServiceSpec> services = new ArrayList<>();
        Set<String> seen = new HashSet<>();
        if (spec.services().isEmpty()) {
            problems.add("spec.services must list at least one service");
        }
        for (AgentWorkload.ServiceDecl decl : spec.services()) {
            String serviceName = decl.name() == null ? "" : decl.name().trim();
            if (!AgentIdentity.isValidLabel(serviceName)) {
                problems.add("invalid service name: '" + serviceName + "'");
                continue;
            }
            if (!seen.add(serviceName)) {
                problems.add("duplicate service name: " + serviceName);
                continue;
            }
            if (decl.port() < 1 || decl.port() > 65535) {
                problems.add("service " + serviceName + " port out of range: " + decl.port());
                continue;
            }
            ServiceProtocol protocol;
            try {
                protocol = ServiceProtocol.fromString(decl.protocol());
            } catch (IllegalArgumentException e) {
                problems.add("service " + serviceName + " has unknown protocol: " + decl.protocol());
                continue;
            }
            if (decl.externalPort() != null) {
                if (protocol == ServiceProtocol.HTTP) {
                    problems.add("service " + serviceName + " is HTTP and cannot request an external port");
                    continue;
                }
                if (decl.externalPort() < 1 || decl.externalPort() > 65535) {
                    problems.add("service " + serviceName + " external port out of range: " + decl.externalPort());
                    continue;
                }
            }
            services.add(new ServiceSpec(serviceName, decl.port(), protocol, decl.externalPort()));
        }

        Duration ttl = defaultTtl;
        if (spec.ttl() != null && !spec.ttl().isBlank()) {
            try {
                ttl = Durations.parse(spec.ttl());
                if (ttl.isNegative()) {
                    problems.add("spec.ttl must not be negative: " + spec.ttl());
                }
            } catch (IllegalArgumentException e) {
                problems.add("spec.ttl is not a duration: " + spec.ttl());
            }
        }

        AgentWorkload.Container container = spec.workloadContainer();
        if (container == null || container.image() == null || container.image().isBlank()) {
            problems.add("spec.workloadContainer.image is required");
        } else {
            for (Integer port : container.ports()) {
                if (port == null || port < 1 || port > 65535) {
                    problems.add("workload container port out of range: " + port);
                }
            }
            for (AgentWorkload.EnvVar env : container.env()) {
                if (env.name() == null || env.name().isBlank()) {
                    problems.add("workload container env entry without a name");
                }
            }
        }

        if (!problems.isEmpty()) {
            throw new InvalidResourceException(problems);
        }
        return new Validated(workload, identity, ServiceTable.of(services), ttl, URI.create(serverUrl), container);
    }

    private static boolean validServerUrl(String raw) {
        try {
            URI uri = URI.create(raw);
            String scheme = uri.getScheme() == null ? "" : uri.getScheme().toLowerCase(Locale.ROOT);
            return uri.getHost() != null && Set.of("ws", "wss", "http", "https").contains(scheme);
        } catch (IllegalArgumentException e) {
            return false;
        }
    }

    /**
     * A workload that passed validation, with its derived identity and parsed values.
     *
     * @param ttl idle period before scale-down; zero disables idling
     */
    public record Validated(
            AgentWorkload workload,
            AgentIdentity identity,
            ServiceTable services,
            Duration ttl,
            URI serverUrl,
            AgentWorkload.Container container
    ) {
        public String serviceIdentity(String service) {
            return identity.forService(service).value();
        }
    }
}
