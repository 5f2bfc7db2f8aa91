package com.inboxsync.ingestion.store;

/**
 * Thrown when previously synchronized identities cannot be read. Aborts a run before any mutation.
 */
public class StoreUnavailableException extends RuntimeException {

    public StoreUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
