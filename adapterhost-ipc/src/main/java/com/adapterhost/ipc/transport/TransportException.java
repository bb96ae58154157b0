package com.adapterhost.ipc.transport;

/**
 * The call could not be completed by the transport: connection failure, write failure, dropped
 * connection or closed transport. Retryable.
 */
public class TransportException extends RuntimeException {

    public TransportException(String message) {
        super(message);
    }

    public TransportException(String message, Throwable cause) {
        super(message, cause);
    }
}
