package io.fareway.core.cache;

import java.util.Optional;

public final class NoopResponseCache implements ResponseCache {
    @Override
    public Optional<String> get(String key) {
        return Optional.empty();
    }

    @Override
    public void set(String key, String value, long ttlSeconds) {
    }

    @Override
    public void clearByPrefix(String prefix) {
    }

    @Override
    public boolean enabled() {
        return false;
    }
}
