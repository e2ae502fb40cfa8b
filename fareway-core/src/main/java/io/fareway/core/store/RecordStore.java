package io.fareway.core.store;

import io.fareway.core.model.Deadline;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Read-only access to the backing data store. Implementations must be safe for concurrent use
 * and must bound every call by their own timeout and the caller's deadline.
 */
public interface RecordStore extends AutoCloseable {
    List<Map<String, Object>> select(Query query, Deadline deadline) throws RecordStoreException;

    Optional<Map<String, Object>> selectOne(String table, String id, Deadline deadline) throws RecordStoreException;

    /**
     * Connectivity probe used by start-up and the liveness endpoint. Never throws.
     */
    boolean ping();

    @Override
    default void close() {
    }
}
