package io.kuberde.auth;

import com.fasterxml.jackson.databind.JsonNode;
import io.kuberde.util.Durations;
import io.kuberde.util.Hashing;
import io.kuberde.util.Jsons;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HexFormat;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Machine clients allowed to exchange a client secret for a token. Secrets are stored as sha256 hex.
 *
 * <pre>
 * {"clients":[{"clientId":"agent-alice-dev","secretSha256":"...","kind":"agent",
 *   "subject":"agent-alice-dev","roles":[],"agentId":"user-alice-dev","ttl":"1h"}]}
 * </pre>
 */
public final class ClientRegistry {
    public static final Duration DEFAULT_TOKEN_TTL = Duration.ofHours(1);

    private final Map<String, ClientRecord> clients;

    private ClientRegistry(Map<String, ClientRecord> clients) {
        this.clients = Map.copyOf(clients);
    }

    public static ClientRegistry empty() {
        return new ClientRegistry(Map.of());
    }

    public static ClientRegistry load(Path file) throws IOException {
        return parse(Files.readString(file, StandardCharsets.UTF_8));
    }

    public static ClientRegistry parse(String json) throws IOException {
        JsonNode root = Jsons.mapper().readTree(json);
        JsonNode items = root.path("clients");
        if (!items.isArray()) {
            throw new IOException("client registry has no clients array");
        }
        Map<String, ClientRecord> out = new LinkedHashMap<>();
        for (JsonNode item : items) {
            String clientId = item.path("clientId").asText("").trim();
            String secretSha256 = item.path("secretSha256").asText("").trim().toLowerCase();
            if (clientId.isEmpty() || secretSha256.length() != 64) {
                throw new IOException("client entry needs clientId and a 64-char secretSha256");
            }
            List<String> roles = new ArrayList<>();
            for (JsonNode role : item.path("roles")) {
                roles.add(role.asText());
            }
            ActorKind kind;
            try {
                kind = ActorKind.fromString(item.path("kind").asText("agent"));
            } catch (IllegalArgumentException e) {
                throw new IOException("client " + clientId + ": " + e.getMessage(), e);
            }
            if (kind == ActorKind.SESSION || kind == ActorKind.USER) {
                throw new IOException("client " + clientId + " must be of kind agent or system");
            }
            String subject = item.path("subject").asText(clientId).trim();
            String agentId = item.path("agentId").asText("").trim();
            Duration ttl = Durations.parseOrDefault(item.path("ttl").asText(""), DEFAULT_TOKEN_TTL);
            if (out.putIfAbsent(clientId, new ClientRecord(clientId, secretSha256, kind, subject, roles,
                    agentId.isEmpty() ? null : agentId, ttl)) != null) {
                throw new IOException("duplicate clientId: " + clientId);
            }
        }
        return new ClientRegistry(out);
    }

    public Optional<ClientRecord> authenticate(String clientId, String clientSecret) {
        if (clientId == null || clientSecret == null) {
            return Optional.empty();
        }
        ClientRecord record = clients.get(clientId.trim());
        if (record == null) {
            return Optional.empty();
        }
        byte[] presented = Hashing.sha256(clientSecret.getBytes(StandardCharsets.UTF_8));
        byte[] stored = HexFormat.of().parseHex(record.secretSha256());
        return Hashing.constantTimeEquals(presented, stored) ? Optional.of(record) : Optional.empty();
    }

    public int size() {
        return clients.size();
    }

    public static String hashSecret(String secret) {
        return Hashing.sha256Hex(secret);
    }

    public record ClientRecord(
            String clientId,
            String secretSha256,
            ActorKind kind,
            String subject,
            List<String> roles,
            String agentId,
            Duration ttl
    ) {
        public TokenIssuer.TokenRequest toTokenRequest() {
            return new TokenIssuer.TokenRequest(subject, subject, kind, roles, agentId, null, ttl);
        }
    }
}
