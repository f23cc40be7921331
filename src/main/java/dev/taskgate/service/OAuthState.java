package dev.taskgate.service;

import dev.taskgate.exception.OAuthFlowException;
import dev.taskgate.webhook.WebhookSignatures;

import java.nio.charset.StandardCharsets;
import java.security.SecureRandom;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Base64;
import java.util.HexFormat;

/**
 * The {@code state} round-tripped through the provider's authorize page. It carries the
 * caller's redirect target, a nonce and the issue time, signed with HMAC-SHA256 so a
 * callback cannot be pointed at another redirect or replayed after the TTL.
 *
 * <p>Wire form: {@code base64url(redirectUri).nonce.issuedAtSeconds.hexSignature}
 */
public record OAuthState(String redirectUri, String nonce, Instant issuedAt) {
    private static final SecureRandom RANDOM = new SecureRandom();

    public static OAuthState issue(String redirectUri, Instant now) {
        byte[] nonce = new byte[16];
        RANDOM.nextBytes(nonce);
        return new OAuthState(redirectUri, HexFormat.of().formatHex(nonce), now.truncatedTo(ChronoUnit.SECONDS));
    }

    public String encode(String signingKey) {
        String payload = Base64.getUrlEncoder().withoutPadding()
                .encodeToString(redirectUri.getBytes(StandardCharsets.UTF_8))
                + "." + nonce + "." + issuedAt.getEpochSecond();
        return payload + "." + WebhookSignatures.hmacSha256Hex(signingKey, payload.getBytes(StandardCharsets.UTF_8));
    }

    /**
     * @throws OAuthFlowException if the state is malformed, forged or older than {@code ttl}
     */
    public static OAuthState decode(String encoded, String signingKey, Instant now, Duration ttl) {
        int cut = encoded == null ? -1 : encoded.lastIndexOf('.');
        if (cut < 0) throw new OAuthFlowException("Invalid state parameter");
        String payload = encoded.substring(0, cut);
        if (!WebhookSignatures.matches(signingKey, payload.getBytes(StandardCharsets.UTF_8), "",
                encoded.substring(cut + 1)))
            throw new OAuthFlowException("Invalid state parameter");

        String[] parts = payload.split("\\.");
        if (parts.length != 3) throw new OAuthFlowException("Invalid state parameter");
        try {
            String redirectUri = new String(Base64.getUrlDecoder().decode(parts[0]), StandardCharsets.UTF_8);
            Instant issuedAt = Instant.ofEpochSecond(Long.parseLong(parts[2]));
            if (issuedAt.plus(ttl).isBefore(now)) throw new OAuthFlowException("Expired state parameter");
            return new OAuthState(redirectUri, parts[1], issuedAt);
        } catch (IllegalArgumentException e) {
            throw new OAuthFlowException("Invalid state parameter", e);
        }
    }
}
