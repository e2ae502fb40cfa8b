package io.fareway.core.tool;

/**
 * Per-tool caching rule. {@code ttlSeconds} of {@code null} means the process-wide default.
 */
public record CachePolicy(boolean enabled, String keyPrefix, Long ttlSeconds) {
    private static final CachePolicy NONE = new CachePolicy(false, null, null);

    public CachePolicy {
        if (enabled && (keyPrefix == null || keyPrefix.isBlank())) {
            throw new IllegalArgumentException("keyPrefix is required when caching is enabled");
        }
        if (ttlSeconds != null && ttlSeconds <= 0) {
            throw new IllegalArgumentException("ttlSeconds must be positive");
        }
    }

    public static CachePolicy none() {
        return NONE;
    }

    public static CachePolicy withDefaultTtl(String keyPrefix) {
        return new CachePolicy(true, keyPrefix, null);
    }

    public static CachePolicy withTtl(String keyPrefix, long ttlSeconds) {
        return new CachePolicy(true, keyPrefix, ttlSeconds);
    }

    public long ttlOr(long fallbackSeconds) {
        return ttlSeconds == null ? fallbackSeconds : ttlSeconds;
    }
}
