package com.adapterhost.loader;

import com.adapterhost.adapters.manifest.ExtensionPoint;

/**
 * Receives the outcome of extension wiring. Implementations must not throw; the loader catches and
 * logs anything they do throw and carries on.
 */
public interface ExtensionWiringObserver {

    void onConnected(ExtensionConnection connection);

    /** The extension could not be attached and was left unwired. */
    void onSkipped(String extensionToken, ExtensionPoint point, String reason);
}
