package com.adapterhost.codec;

/**
 * Thrown when a wire value is malformed: an invalid tagged payload, or a tree that does not bind
 * to the requested type.
 */
public final class DeserializationException extends RuntimeException {

    public DeserializationException(String message) {
        super(message);
    }

    public DeserializationException(String message, Throwable cause) {
        super(message, cause);
    }
}
