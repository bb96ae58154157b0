package com.adapterhost.bootstrap;

import com.adapterhost.adapters.ResourceCleanup;
import com.adapterhost.config.HostConfig;
import com.adapterhost.ipc.bulk.BulkTransfer;
import com.adapterhost.ipc.metrics.IpcMetrics;
import com.adapterhost.ipc.server.AdapterRpcServer;
import com.adapterhost.loader.LoadedAdapters;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.atomic.AtomicBoolean;

final class HostContextImpl implements HostContext {

    private static final Logger log = LoggerFactory.getLogger(HostContextImpl.class);

    private final HostConfig config;
    private final AdapterContainer container;
    private final AdapterRpcServer server;
    private final BulkTransfer bulk;
    private final IpcMetrics metrics;
    private final AtomicBoolean closed = new AtomicBoolean();

    HostContextImpl(HostConfig config, AdapterContainer container, AdapterRpcServer server, BulkTransfer bulk, IpcMetrics metrics) {
        this.config = config;
        this.container = container;
        this.server = server;
        this.bulk = bulk;
        this.metrics = metrics;
    }

    @Override
    public HostConfig getConfig() {
        return config;
    }

    @Override
    public AdapterContainer container() {
        return container;
    }

    @Override
    public AdapterRpcServer server() {
        return server;
    }

    @Override
    public IpcMetrics getMetrics() {
        return metrics;
    }

    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) return;
        server.close();
        bulk.cleanup();
        runCleanup(container.loaded());
        log.info("Adapter host stopped");
    }

    static void runCleanup(LoadedAdapters loaded) {
        int cleaned = 0;
        for (String token : loaded.getShutdownOrder()) {
            Object adapter = loaded.get(token);
            if (!(adapter instanceof ResourceCleanup)) continue;
            try {
                ((ResourceCleanup) adapter).onExit();
                cleaned++;
            } catch (RuntimeException e) {
                log.warn("Cleanup of adapter {} failed: {}", token, e.getMessage(), e);
            }
        }
        log.debug("Ran cleanup on {} adapter(s)", cleaned);
    }
}
