package com.adapterhost.loader;

/** An adapter factory threw or returned null. Loading stops; adapters created so far are discarded. */
public final class AdapterInstantiationException extends AdapterConfigurationException {

    public AdapterInstantiationException(String token, String message, Throwable cause) {
        super(token, "Failed to create adapter '" + token + "': " + message, cause);
    }
}
