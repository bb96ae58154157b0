package com.adapterhost.ipc.dispatch;

import java.util.Optional;
import java.util.function.Function;

/**
 * Builds an endpoint for adapter instances implementing a capability interface.
 *
 * @param capability interface the instance must implement
 * @param factory    maps the instance to its method table
 */
public record EndpointBinder<T>(Class<T> capability, Function<T, AdapterEndpoint> factory) {

    public static <T> EndpointBinder<T> of(Class<T> capability, Function<T, AdapterEndpoint> factory) {
        return new EndpointBinder<>(capability, factory);
    }

    public Optional<AdapterEndpoint> bind(Object instance) {
        if (!capability.isInstance(instance)) {
            return Optional.empty();
        }
        return Optional.of(factory.apply(capability.cast(instance)));
    }
}
