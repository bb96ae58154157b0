package com.adapterhost.adapters.extension;

import java.util.Optional;
import java.util.function.Consumer;

/**
 * An adapter whose methods can be attached to another adapter's hook. The loader looks up the
 * method named in the manifest's {@code extends} declaration and registers it on the target.
 */
public interface ExtensionAdapter {

    /** The named method bound to this instance, or empty when there is no such method. */
    Optional<Consumer<Object>> extensionMethod(String methodName);
}
