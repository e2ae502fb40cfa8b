package io.fareway.core.cache;

import java.util.Optional;

/**
 * Read-through cache for serialized tool payloads. Implementations never throw from these
 * methods: a backend failure behaves like a miss (reads) or a no-op (writes).
 */
public interface ResponseCache extends AutoCloseable {
    Optional<String> get(String key);

    void set(String key, String value, long ttlSeconds);

    void clearByPrefix(String prefix);

    boolean enabled();

    @Override
    default void close() {
    }
}
