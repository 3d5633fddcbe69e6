package io.kuberde.observability;

import com.fasterxml.jackson.databind.JsonNode;
import io.kuberde.security.SensitiveDataMasker;
import io.kuberde.util.Hashing;
import io.kuberde.util.Jsons;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Append-only JSON-lines audit trail. Each row carries the hash of the previous row, so truncation
 * or edits in the middle of the file are detectable with {@link #verify(Path, String)}.
 */
public final class AuditLogger {
    private final Path auditFile;
    private final String component;
    private final String signingSecret;
    private final Clock clock;
    private String previousHash;

    public AuditLogger(Path auditFile, String component, String signingSecret) {
        this(auditFile, component, signingSecret, Clock.systemUTC());
    }

    public AuditLogger(Path auditFile, String component, String signingSecret, Clock clock) {
        this.auditFile = auditFile;
        this.component = component == null || component.isBlank() ? "kuberde" : component.trim();
        this.signingSecret = signingSecret == null ? "" : signingSecret.trim();
        this.clock = clock;
        try {
            Files.createDirectories(auditFile.toAbsolutePath().getParent());
            if (!Files.exists(auditFile)) {
                try {
                    Files.createFile(auditFile);
                } catch (FileAlreadyExistsException ignored) {
                    // Created concurrently by another process sharing the data root.
                }
            }
        } catch (IOException e) {
            throw new RuntimeException("Failed to initialize audit log file: " + auditFile, e);
        }
        this.previousHash = loadLastHash(auditFile);
    }

    public synchronized void log(AuditEvent event) {
        Instant now = clock.instant();
        Map<String, Object> row = new LinkedHashMap<>();
        row.put("timestamp", now.toString());
        row.put("component", component);
        row.put("action", event.action());
        row.put("actor", event.actor());
        row.put("resource", event.resource());
        row.put("result", event.result());
        row.put("trace_id", event.traceId());
        row.put("details", sanitizeDetails(event.details()));
        row.put("prev_hash", previousHash);
        String rowHash = Hashing.sha256Hex(Jsons.toCompactJson(row));
        row.put("hash", rowHash);
        if (!signingSecret.isBlank()) {
            row.put("signature", Hashing.hmacSha256Hex(signingSecret, rowHash));
        }
        String line = Jsons.toCompactJson(row) + System.lineSeparator();
        try {
            Files.writeString(auditFile, line, StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE, StandardOpenOption.APPEND, StandardOpenOption.WRITE);
            previousHash = rowHash;
        } catch (IOException e) {
            throw new RuntimeException("Failed to write audit log", e);
        }
    }

    public synchronized String currentHash() {
        return previousHash;
    }

    public Path auditFile() {
        return auditFile;
    }

    /**
     * Re-computes the hash chain and, when a secret is given, every signature.
     *
     * @return number of verified rows
     * @throws IllegalStateException on the first broken link
     */
    public static int verify(Path auditFile, String signingSecret) throws IOException {
        String expectedPrev = "";
        int lineNo = 0;
        for (String line : Files.readAllLines(auditFile, StandardCharsets.UTF_8)) {
            if (line == null || line.isBlank()) {
                continue;
            }
            lineNo++;
            JsonNode node = Jsons.mapper().readTree(line);
            String hash = node.path("hash").asText("");
            String signature = node.path("signature").asText("");
            Map<String, Object> row = new LinkedHashMap<>();
            List<String> fields = List.of("timestamp", "component", "action", "actor", "resource", "result",
                    "trace_id", "details", "prev_hash");
            for (String field : fields) {
                JsonNode value = node.get(field);
                row.put(field, value == null || value.isNull() ? null : value);
            }
            if (!expectedPrev.equals(node.path("prev_hash").asText(""))) {
                throw new IllegalStateException("Audit chain broken at row " + lineNo + ": prev_hash mismatch");
            }
            if (!Hashing.sha256Hex(Jsons.toCompactJson(row)).equals(hash)) {
                throw new IllegalStateException("Audit chain broken at row " + lineNo + ": hash mismatch");
            }
            if (signingSecret != null && !signingSecret.isBlank()
                    && !Hashing.hmacSha256Hex(signingSecret.trim(), hash).equals(signature)) {
                throw new IllegalStateException("Audit chain broken at row " + lineNo + ": bad signature");
            }
            expectedPrev = hash;
        }
        return lineNo;
    }

    private static String loadLastHash(Path auditFile) {
        try {
            String last = "";
            for (String line : Files.readAllLines(auditFile, StandardCharsets.UTF_8)) {
                if (line != null && !line.isBlank()) {
                    last = line;
                }
            }
            if (last.isBlank()) {
                return "";
            }
            return Jsons.mapper().readTree(last).path("hash").asText("");
        } catch (IOException e) {
            System.err.println("WARN audit chain could not be resumed from " + auditFile + ": " + e.getMessage());
            return "";
        }
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> sanitizeDetails(Map<String, Object> input) {
        if (input == null || input.isEmpty()) {
            return Map.of();
        }
        JsonNode node = Jsons.mapper().valueToTree(input);
        return Jsons.mapper().convertValue(SensitiveDataMasker.masked(node), Map.class);
    }

    public record AuditEvent(
            String action,
            String actor,
            String resource,
            String result,
            String traceId,
            Map<String, Object> details
    ) {
        public static AuditEvent of(String action, String actor, String resource, String result) {
            return new AuditEvent(action, actor, resource, result, null, Map.of());
        }

        public static AuditEvent of(
                String action,
                String actor,
                String resource,
                String result,
                String traceId,
                Map<String, Object> details
        ) {
            return new AuditEvent(
                    action,
                    actor == null || actor.isBlank() ? "system" : actor.trim(),
                    resource,
                    result,
                    traceId,
                    details == null ? Map.of() : details
            );
        }
    }
}
