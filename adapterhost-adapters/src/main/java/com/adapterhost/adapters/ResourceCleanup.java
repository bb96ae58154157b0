package com.adapterhost.adapters;

/**
 * Contract for resource cleanup when the host is shutting down.
 * Adapters that hold resources (connections, threads, files) implement this and release them in
 * {@link #onExit()}. The host calls {@code onExit()} on loaded adapters in reverse load order, so an
 * adapter is cleaned up before the adapters it depends on.
 */
public interface ResourceCleanup {

    /**
     * Called once when the host is shutting down. Exceptions are logged by the host and do not
     * stop the remaining adapters from cleaning up.
     */
    void onExit();
}
