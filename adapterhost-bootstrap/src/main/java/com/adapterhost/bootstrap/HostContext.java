package com.adapterhost.bootstrap;

import com.adapterhost.config.HostConfig;
import com.adapterhost.ipc.metrics.IpcMetrics;
import com.adapterhost.ipc.server.AdapterRpcServer;

/**
 * Running adapter host returned by {@link AdapterHostBootstrap#initialize}: the loaded adapters and
 * the RPC server exposing them.
 */
public interface HostContext extends AutoCloseable {

    HostConfig getConfig();

    AdapterContainer container();

    AdapterRpcServer server();

    IpcMetrics getMetrics();

    /**
     * Stops the server, then calls {@link com.adapterhost.adapters.ResourceCleanup#onExit()} on every
     * adapter that implements it, in reverse load order. A failing cleanup is logged and the rest still
     * run. Idempotent.
     */
    @Override
    void close();
}
