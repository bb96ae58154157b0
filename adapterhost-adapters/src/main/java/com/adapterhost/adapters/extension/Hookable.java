package com.adapterhost.adapters.extension;

import java.util.Set;
import java.util.function.Consumer;

/**
 * An adapter that exposes named hooks other adapters can attach listeners to.
 */
public interface Hookable {

    /** Names of the hooks this adapter fires. */
    Set<String> hookNames();

    /**
     * Attaches a listener to a hook. Listeners fire in registration order.
     *
     * @throws IllegalArgumentException if the hook is not one of {@link #hookNames()}
     */
    void registerHook(String hookName, Consumer<Object> listener);
}
