package com.adapterhost.loader;

import com.adapterhost.adapters.manifest.ExtensionPoint;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Default observer: connections at info, skips at warn. */
public final class LoggingExtensionWiringObserver implements ExtensionWiringObserver {

    private static final Logger log = LoggerFactory.getLogger(LoggingExtensionWiringObserver.class);

    @Override
    public void onConnected(ExtensionConnection connection) {
        log.info("Connected extension {}", connection);
    }

    @Override
    public void onSkipped(String extensionToken, ExtensionPoint point, String reason) {
        log.warn("Skipping extension {} ({}): {}", extensionToken, point, reason);
    }
}
