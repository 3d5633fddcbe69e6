package io.kuberde.auth;

import com.fasterxml.jackson.databind.JsonNode;
import io.kuberde.util.Jsons;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.attribute.PosixFilePermissions;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Credential kept by {@code kuberde login} for later {@code kuberde connect} calls.
 *
 * @param expiresAt {@code null} when the provider did not say
 */
public record StoredToken(String accessToken, String tokenType, Instant expiresAt, String refreshToken) {
    public static final String DEFAULT_FILE = ".kuberde/token.json";

    public StoredToken {
        if (accessToken == null || accessToken.isBlank()) {
            throw new IllegalArgumentException("access token is required");
        }
        tokenType = tokenType == null || tokenType.isBlank() ? "Bearer" : tokenType;
    }

    public static Path defaultPath() {
        return Paths.get(System.getProperty("user.home"), DEFAULT_FILE);
    }

    /**
     * Wraps a bearer token obtained elsewhere; its {@code exp} claim is read without verification.
     */
    public static StoredToken fromBearer(String token) throws AuthException {
        JsonNode exp = JwtCodec.parse(token.trim()).claims().path("exp");
        Instant expiresAt = exp.canConvertToLong() ? Instant.ofEpochSecond(exp.asLong()) : null;
        return new StoredToken(token.trim(), "Bearer", expiresAt, null);
    }

    public boolean expired(Instant now) {
        return expiresAt != null && !now.isBefore(expiresAt);
    }

    public static Optional<StoredToken> load(Path file) throws IOException {
        if (!Files.exists(file)) {
            return Optional.empty();
        }
        JsonNode node = Jsons.mapper().readTree(Files.readString(file, StandardCharsets.UTF_8));
        String access = node.path("access_token").asText("");
        if (access.isBlank()) {
            throw new IOException("no access_token in " + file);
        }
        Instant expiry = null;
        String rawExpiry = node.path("expiry").asText("");
        if (!rawExpiry.isEmpty()) {
            try {
                expiry = Instant.parse(rawExpiry);
            } catch (DateTimeParseException e) {
                throw new IOException("unreadable expiry in " + file + ": " + rawExpiry, e);
            }
        }
        String refresh = node.path("refresh_token").asText("");
        return Optional.of(new StoredToken(access, node.path("token_type").asText("Bearer"), expiry,
                refresh.isEmpty() ? null : refresh));
    }

    /**
     * Writes the token readable by the current user only, where the file system supports it.
     */
    public void save(Path file) throws IOException {
        Path parent = file.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("access_token", accessToken);
        out.put("token_type", tokenType);
        if (expiresAt != null) {
            out.put("expiry", expiresAt.toString());
        }
        if (refreshToken != null) {
            out.put("refresh_token", refreshToken);
        }
        Files.writeString(file, Jsons.toJson(out), StandardCharsets.UTF_8);
        if (FileSystems.getDefault().supportedFileAttributeViews().contains("posix")) {
            Files.setPosixFilePermissions(file, PosixFilePermissions.fromString("rw-------"));
        }
    }

    @Override
    public String toString() {
        return "StoredToken{type=" + tokenType + ", expiresAt=" + expiresAt + "}";
    }
}
