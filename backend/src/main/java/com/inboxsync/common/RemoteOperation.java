package com.inboxsync.common;

/**
 * A fallible call to a remote system. Wrapped by {@link RetryPolicy#execute(String, RemoteOperation)}.
 */
@FunctionalInterface
public interface RemoteOperation<T> {

    T call();
}
