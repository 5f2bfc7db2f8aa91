package com.inboxsync.common;

/**
 * Classification of a failed remote call. Drives retry decisions in {@link RetryPolicy}.
 */
public enum FailureKind {
    /** Rate limiting, 5xx, connection reset. Retried with backoff. */
    TRANSIENT,
    /** Auth, permission, validation. Never retried. */
    PERMANENT,
    /** The addressed item no longer exists. Never retried; callers treat it as a per-item skip. */
    NOT_FOUND
}
