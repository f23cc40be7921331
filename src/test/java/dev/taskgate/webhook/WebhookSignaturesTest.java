package dev.taskgate.webhook;

import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.assertThat;

class WebhookSignaturesTest {

    private static final byte[] BODY = "{\"hello\":\"world\"}".getBytes(StandardCharsets.UTF_8);

    @Test
    void hmacMatchesKnownVector() {
        String hex = WebhookSignatures.hmacSha256Hex("key",
                "The quick brown fox jumps over the lazy dog".getBytes(StandardCharsets.UTF_8));
        assertThat(hex).isEqualTo("f7bc83f430538424b13298e6aa6fb143ef4d59a14946175997479dbc2d1a3cd8");
    }

    @Test
    void acceptsMatchingPrefixedSignature() {
        String signature = "sha256=" + WebhookSignatures.hmacSha256Hex("s3cret", BODY);
        assertThat(WebhookSignatures.matches("s3cret", BODY, "sha256=", signature)).isTrue();
    }

    @Test
    void rejectsWrongSecretOrTamperedBody() {
        String signature = "sha256=" + WebhookSignatures.hmacSha256Hex("s3cret", BODY);
        assertThat(WebhookSignatures.matches("other", BODY, "sha256=", signature)).isFalse();
        assertThat(WebhookSignatures.matches("s3cret", "{}".getBytes(StandardCharsets.UTF_8), "sha256=", signature))
                .isFalse();
    }

    @Test
    void everySingleByteMutationInvalidatesTheSignature() {
        String signature = "sha256=" + WebhookSignatures.hmacSha256Hex("s3cret", BODY);
        for (int i = 0; i < BODY.length; i++) {
            for (int bit = 0; bit < 8; bit++) {
                byte[] mutated = BODY.clone();
                mutated[i] ^= (byte) (1 << bit);
                assertThat(WebhookSignatures.matches("s3cret", mutated, "sha256=", signature))
                        .as("byte %d bit %d", i, bit)
                        .isFalse();
            }
        }
        assertThat(WebhookSignatures.matches("s3cret", BODY, "sha256=", signature)).isTrue();
    }

    @Test
    void rejectsMissingSignatureOrBlankSecret() {
        assertThat(WebhookSignatures.matches("s3cret", BODY, "sha256=", null)).isFalse();
        assertThat(WebhookSignatures.matches("s3cret", BODY, "sha256=", "")).isFalse();
        String signature = "sha256=" + WebhookSignatures.hmacSha256Hex("x", BODY);
        assertThat(WebhookSignatures.matches("  ", BODY, "sha256=", signature)).isFalse();
        assertThat(WebhookSignatures.matches(null, BODY, "sha256=", signature)).isFalse();
    }
}
