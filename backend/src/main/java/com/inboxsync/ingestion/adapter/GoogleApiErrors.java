package com.inboxsync.ingestion.adapter;

import com.inboxsync.common.FailureKind;
import com.inboxsync.common.RemoteCallException;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.Exceptions;

import java.util.concurrent.TimeoutException;

/**
 * Maps WebClient failures from Google APIs onto {@link FailureKind}:
 * 429 and 5xx and I/O errors are transient, 404 is not-found, every other 4xx is permanent.
 */
public final class GoogleApiErrors {

    private GoogleApiErrors() {
    }

    public static RuntimeException translate(String description, Throwable error) {
        Throwable cause = Exceptions.unwrap(error);
        if (cause instanceof RemoteCallException rce) {
            return rce;
        }
        if (cause instanceof WebClientResponseException wre) {
            int status = wre.getStatusCode().value();
            return new RemoteCallException(kindForStatus(status), status,
                    description + " failed with HTTP " + status, wre);
        }
        if (cause instanceof WebClientRequestException || cause instanceof TimeoutException) {
            return RemoteCallException.transientFailure(description + " failed: " + cause.getMessage(), cause);
        }
        if (cause instanceof RuntimeException re) {
            return re;
        }
        return new IllegalStateException(description + " failed", cause);
    }

    static FailureKind kindForStatus(int status) {
        if (status == 429 || status >= 500) {
            return FailureKind.TRANSIENT;
        }
        if (status == 404) {
            return FailureKind.NOT_FOUND;
        }
        return FailureKind.PERMANENT;
    }
}
