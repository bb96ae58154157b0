package com.adapterhost.codec;

/**
 * Thrown when a value cannot be represented on the wire: circular references, non-finite numbers,
 * or objects Jackson has no serializer for.
 */
public final class SerializationException extends RuntimeException {

    private final String location;

    public SerializationException(String message, String location) {
        super(location != null ? message + " at " + location : message);
        this.location = location;
    }

    public SerializationException(String message, String location, Throwable cause) {
        super(location != null ? message + " at " + location : message, cause);
        this.location = location;
    }

    /** JSON-path-like location of the offending value (e.g. {@code $.items[2]}), or null. */
    public String getLocation() {
        return location;
    }
}
