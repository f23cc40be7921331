package dev.taskgate.service;

import dev.taskgate.exception.OAuthFlowException;
import dev.taskgate.support.Fixtures;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class OAuthStateTest {

    private static final String KEY = "client-secret";
    private static final Duration TTL = Duration.ofMinutes(10);

    @Test
    void roundTripsRedirectAndNonce() {
        OAuthState issued = OAuthState.issue("https://app.example/done?x=1", Fixtures.NOW);

        OAuthState decoded = OAuthState.decode(issued.encode(KEY), KEY, Fixtures.NOW.plusSeconds(30), TTL);

        assertThat(decoded).isEqualTo(issued);
        assertThat(decoded.nonce()).hasSize(32);
    }

    @Test
    void rejectsStateSignedWithAnotherKey() {
        String encoded = OAuthState.issue("https://app.example/done", Fixtures.NOW).encode("attacker");

        assertThatThrownBy(() -> OAuthState.decode(encoded, KEY, Fixtures.NOW, TTL))
                .isInstanceOf(OAuthFlowException.class);
    }

    @Test
    void rejectsSwappedRedirect() {
        String encoded = OAuthState.issue("https://app.example/done", Fixtures.NOW).encode(KEY);
        String forged = OAuthState.issue("https://evil.example/", Fixtures.NOW).encode(KEY);
        String spliced = forged.substring(0, forged.indexOf('.')) + encoded.substring(encoded.indexOf('.'));

        assertThatThrownBy(() -> OAuthState.decode(spliced, KEY, Fixtures.NOW, TTL))
                .isInstanceOf(OAuthFlowException.class);
    }

    @Test
    void rejectsExpiredOrMalformedState() {
        String encoded = OAuthState.issue("https://app.example/done", Fixtures.NOW).encode(KEY);

        assertThatThrownBy(() -> OAuthState.decode(encoded, KEY, Fixtures.NOW.plus(TTL).plusSeconds(1), TTL))
                .isInstanceOf(OAuthFlowException.class)
                .hasMessageContaining("Expired");
        assertThatThrownBy(() -> OAuthState.decode("garbage", KEY, Fixtures.NOW, TTL))
                .isInstanceOf(OAuthFlowException.class);
        assertThatThrownBy(() -> OAuthState.decode(null, KEY, Fixtures.NOW, TTL))
                .isInstanceOf(OAuthFlowException.class);
    }
}
