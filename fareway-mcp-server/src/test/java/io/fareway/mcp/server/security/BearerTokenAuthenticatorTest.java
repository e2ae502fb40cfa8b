package io.fareway.mcp.server.security;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

class BearerTokenAuthenticatorTest {

    @Test
    void shouldClassifyCredentials() {
        BearerTokenAuthenticator authenticator = new BearerTokenAuthenticator("secret123");

        assertThat(authenticator.authenticate(null)).isEqualTo(BearerTokenAuthenticator.Outcome.MISSING);
        assertThat(authenticator.authenticate("Basic c2VjcmV0")).isEqualTo(BearerTokenAuthenticator.Outcome.MISSING);
        assertThat(authenticator.authenticate("Bearer secret124")).isEqualTo(BearerTokenAuthenticator.Outcome.REJECTED);
        assertThat(authenticator.authenticate("Bearer secret123")).isEqualTo(BearerTokenAuthenticator.Outcome.ADMITTED);
    }

    @Test
    void shouldAdmitEveryoneWhenNoSecretConfigured() {
        BearerTokenAuthenticator authenticator = new BearerTokenAuthenticator("");

        assertThat(authenticator.enabled()).isFalse();
        assertThat(authenticator.authenticate(null)).isEqualTo(BearerTokenAuthenticator.Outcome.ADMITTED);
    }
}
