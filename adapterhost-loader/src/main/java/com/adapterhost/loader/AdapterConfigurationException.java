package com.adapterhost.loader;

/**
 * Base class for configuration errors found while loading adapters. Loading stops at the first one.
 */
public class AdapterConfigurationException extends RuntimeException {

    private final String token;

    public AdapterConfigurationException(String token, String message) {
        super(message);
        this.token = token;
    }

    public AdapterConfigurationException(String token, String message, Throwable cause) {
        super(message, cause);
        this.token = token;
    }

    /** Token of the adapter the problem was found on, or null when it concerns the whole set. */
    public String getToken() {
        return token;
    }
}
