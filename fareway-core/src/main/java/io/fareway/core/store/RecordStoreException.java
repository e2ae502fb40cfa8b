package io.fareway.core.store;

public final class RecordStoreException extends Exception {
    public RecordStoreException(String message) {
        super(message);
    }

    public RecordStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
