package com.inboxsync.ingestion.job;

/**
 * A sync run was requested while another run in this process is still active.
 */
public class SyncAlreadyRunningException extends RuntimeException {

    public SyncAlreadyRunningException() {
        super("A sync run is already in progress");
    }
}
