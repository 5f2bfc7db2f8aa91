package com.inboxsync.domain;

public enum SyncTrigger {
    SCHEDULED,
    MANUAL,
    STARTUP
}
