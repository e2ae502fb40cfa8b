package io.fareway.core.config;

import java.time.Duration;

public record CacheConfig(
    boolean enabled,
    String redisUrl,
    long defaultTtlSeconds,
    Duration timeout
) {
    /**
     * Caching needs both the switch and a backend URL; otherwise the no-op cache is used.
     */
    public boolean active() {
        return enabled && redisUrl != null && !redisUrl.isBlank();
    }
}
