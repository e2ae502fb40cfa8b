package io.fareway.mcp.server.security;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;

public final class BearerTokenAuthenticator {
    private static final String PREFIX = "Bearer ";

    private final byte[] secret;

    public BearerTokenAuthenticator(String secret) {
        String value = secret == null ? "" : secret.trim();
        this.secret = value.getBytes(StandardCharsets.UTF_8);
    }

    public boolean enabled() {
        return secret.length > 0;
    }

    public Outcome authenticate(String authorizationHeader) {
        if (!enabled()) {
            return Outcome.ADMITTED;
        }
        if (authorizationHeader == null || !authorizationHeader.startsWith(PREFIX)) {
            return Outcome.MISSING;
        }
        byte[] presented = authorizationHeader.substring(PREFIX.length()).trim().getBytes(StandardCharsets.UTF_8);
        return MessageDigest.isEqual(secret, presented) ? Outcome.ADMITTED : Outcome.REJECTED;
    }

    public enum Outcome {
        ADMITTED,
        MISSING,
        REJECTED
    }
}
