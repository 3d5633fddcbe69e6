package io.kuberde.util;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.util.Base64;
import java.util.HexFormat;

public final class Hashing {
    private static final Base64.Encoder URL_ENCODER = Base64.getUrlEncoder().withoutPadding();
    private static final Base64.Decoder URL_DECODER = Base64.getUrlDecoder();

    private Hashing() {
    }

    public static String sha256Hex(String value) {
        return HexFormat.of().formatHex(sha256(value.getBytes(StandardCharsets.UTF_8)));
    }

    public static byte[] sha256(byte[] value) {
        try {
            return MessageDigest.getInstance("SHA-256").digest(value);
        } catch (Exception e) {
            throw new RuntimeException("Failed to compute sha256", e);
        }
    }

    public static byte[] hmacSha256(byte[] key, byte[] value) {
        try {
            Mac mac = Mac.getInstance("HmacSHA256");
            mac.init(new SecretKeySpec(key, "HmacSHA256"));
            return mac.doFinal(value);
        } catch (Exception e) {
            throw new RuntimeException("Failed to compute hmac-sha256", e);
        }
    }

    public static String hmacSha256Hex(String secret, String value) {
        return HexFormat.of().formatHex(hmacSha256(
                secret.getBytes(StandardCharsets.UTF_8),
                value.getBytes(StandardCharsets.UTF_8)
        ));
    }

    public static String base64Url(byte[] value) {
        return URL_ENCODER.encodeToString(value);
    }

    public static byte[] fromBase64Url(String value) {
        return URL_DECODER.decode(value);
    }

    public static boolean constantTimeEquals(byte[] a, byte[] b) {
        if (a == null || b == null) {
            return false;
        }
        return MessageDigest.isEqual(a, b);
    }

    /**
     * Non-negative value of the first eight bytes of sha256(value), for stable bucketing.
     */
    public static long stableBucket(String value, long range) {
        if (range <= 0) {
            throw new IllegalArgumentException("range must be positive");
        }
        byte[] digest = sha256(value.getBytes(StandardCharsets.UTF_8));
        long acc = 0L;
        for (int i = 0; i < 8; i++) {
            acc = (acc << 8) | (digest[i] & 0xFFL);
        }
        return Math.floorMod(acc, range);
    }
}
