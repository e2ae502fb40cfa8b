package io.fareway.core.config;

import java.time.Duration;

public record StoreConfig(
    Backend backend,
    String url,
    String serviceKey,
    Duration timeout
) {
    public enum Backend {
        POSTGREST,
        JDBC
    }
}
