package com.inboxsync.common;

/**
 * Thrown when a call to a remote system (mailbox, spreadsheet, token endpoint) fails.
 * Carries the {@link FailureKind} so retry and skip decisions live in one place.
 */
public class RemoteCallException extends RuntimeException {

    private final FailureKind kind;
    private final Integer statusCode;

    public RemoteCallException(FailureKind kind, String message) {
        this(kind, null, message, null);
    }

    public RemoteCallException(FailureKind kind, Integer statusCode, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
        this.statusCode = statusCode;
    }

    public static RemoteCallException transientFailure(String message, Throwable cause) {
        return new RemoteCallException(FailureKind.TRANSIENT, null, message, cause);
    }

    public static RemoteCallException permanent(String message) {
        return new RemoteCallException(FailureKind.PERMANENT, message);
    }

    public static RemoteCallException notFound(String message) {
        return new RemoteCallException(FailureKind.NOT_FOUND, 404, message, null);
    }

    public FailureKind getKind() {
        return kind;
    }

    /** HTTP status when the failure came from an HTTP response; null otherwise. */
    public Integer getStatusCode() {
        return statusCode;
    }

    public boolean isRetryable() {
        return kind == FailureKind.TRANSIENT;
    }
}
