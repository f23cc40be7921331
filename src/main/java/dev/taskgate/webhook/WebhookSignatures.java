package dev.taskgate.webhook;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.util.HexFormat;

/**
 * HMAC-SHA256 helpers shared by the provider handlers.
 * Uses constant-time comparison to prevent timing attacks.
 */
public final class WebhookSignatures {

    private static final String HMAC_SHA256 = "HmacSHA256";

    private WebhookSignatures() {
    }

    public static String hmacSha256Hex(String secret, byte[] payload) {
        try {
            Mac mac = Mac.getInstance(HMAC_SHA256);
            mac.init(new SecretKeySpec(secret.getBytes(StandardCharsets.UTF_8), HMAC_SHA256));
            return HexFormat.of().formatHex(mac.doFinal(payload));
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("HmacSHA256 unavailable", e);
        }
    }

    /**
     * True iff {@code supplied} equals {@code prefix + hex(HMAC(secret, payload))}.
     * Null or blank inputs never match.
     */
    public static boolean matches(String secret, byte[] payload, String prefix, String supplied) {
        if (supplied == null || supplied.isBlank()) return false;
        if (secret == null || secret.isBlank()) return false;
        String expected = prefix + hmacSha256Hex(secret, payload);
        return MessageDigest.isEqual(
                expected.getBytes(StandardCharsets.UTF_8),
                supplied.getBytes(StandardCharsets.UTF_8));
    }
}
