package com.inboxsync.ingestion.store;

/**
 * Thrown when an identity append did not complete. None of the batch counts as recorded.
 */
public class StoreWriteFailedException extends RuntimeException {

    public StoreWriteFailedException(String message, Throwable cause) {
        super(message, cause);
    }
}
