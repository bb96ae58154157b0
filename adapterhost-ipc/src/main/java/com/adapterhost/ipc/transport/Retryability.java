package com.adapterhost.ipc.transport;

import com.adapterhost.codec.RemoteAdapterException;

import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;

/**
 * Classifies call failures. Transport failures (including timeouts and an open circuit) may succeed
 * when retried; errors raised by the adapter itself are not retried.
 */
public final class Retryability {

    private Retryability() {
    }

    public static boolean isRetryable(Throwable error) {
        Throwable e = unwrap(error);
        if (e instanceof RemoteAdapterException) return false;
        return e instanceof TransportException;
    }

    /** Strips {@link CompletionException} and {@link ExecutionException} wrappers. */
    public static Throwable unwrap(Throwable error) {
        Throwable e = error;
        while ((e instanceof CompletionException || e instanceof ExecutionException) && e.getCause() != null) {
            e = e.getCause();
        }
        return e;
    }
}
