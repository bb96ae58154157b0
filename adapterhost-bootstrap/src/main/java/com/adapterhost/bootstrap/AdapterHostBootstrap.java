package com.adapterhost.bootstrap;

import com.adapterhost.codec.WireCodec;
import com.adapterhost.config.HostConfig;
import com.adapterhost.ipc.bulk.BulkTransfer;
import com.adapterhost.ipc.dispatch.AdapterDispatcher;
import com.adapterhost.ipc.dispatch.StandardEndpoints;
import com.adapterhost.ipc.metrics.IpcMetrics;
import com.adapterhost.ipc.server.AdapterRpcServer;
import com.adapterhost.ipc.server.LoggingRpcServerListener;
import com.adapterhost.ipc.server.RpcServerOptions;
import com.adapterhost.loader.AdapterConfig;
import com.adapterhost.loader.AdapterLoader;
import com.adapterhost.loader.AdapterModuleResolver;
import com.adapterhost.loader.LoadedAdapters;
import com.adapterhost.loader.ServiceLoaderModuleResolver;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.Map;

/**
 * Host-side bootstrap: loads the configured adapters, exposes every instance that has a remote
 * endpoint, and starts the RPC server on the configured socket. The caller owns the returned
 * {@link HostContext} and closes it on shutdown.
 */
public final class AdapterHostBootstrap {

    private static final Logger log = LoggerFactory.getLogger(AdapterHostBootstrap.class);

    private AdapterHostBootstrap() {
    }

    /** Resolves modules through {@link ServiceLoaderModuleResolver} on the context class loader. */
    public static HostContext initialize(HostConfig config, Map<String, AdapterConfig> configs) {
        return initialize(config, configs, new ServiceLoaderModuleResolver());
    }

    public static HostContext initialize(HostConfig config, Map<String, AdapterConfig> configs, AdapterModuleResolver resolver) {
        return initialize(config, configs, resolver, IpcMetrics.simple());
    }

    public static HostContext initialize(HostConfig config, Map<String, AdapterConfig> configs,
                                         AdapterModuleResolver resolver, MeterRegistry registry) {
        return initialize(config, configs, resolver, new IpcMetrics(registry));
    }

    /**
     * @throws com.adapterhost.loader.AdapterConfigurationException if the configuration set cannot be loaded
     * @throws UncheckedIOException if the server socket cannot be bound; adapters already created are
     *                              cleaned up first
     */
    public static HostContext initialize(HostConfig config, Map<String, AdapterConfig> configs,
                                         AdapterModuleResolver resolver, IpcMetrics metrics) {
        log.info("Bootstrap: loading {} adapter(s) with {}", configs.size(), config);
        LoadedAdapters loaded = new AdapterLoader(resolver).load(configs);

        WireCodec codec = WireCodec.shared();
        BulkTransfer bulk = new BulkTransfer(config.getBulkDirectory(), config.getBulkThresholdBytes(), codec.mapper());
        AdapterDispatcher dispatcher = AdapterDispatcher.fromInstances(codec, bulk, loaded.getInstances(), StandardEndpoints.binders());

        AdapterRpcServer server = new AdapterRpcServer(dispatcher, codec,
                new RpcServerOptions(config.getSocketPath(), config.getDispatchThreads(), config.getMaxFrameBytes()),
                new LoggingRpcServerListener(), metrics);
        try {
            server.start();
        } catch (IOException e) {
            log.error("Bootstrap: cannot start adapter RPC server on {}: {}", config.getSocketPath(), e.getMessage());
            HostContextImpl.runCleanup(loaded);
            throw new UncheckedIOException("Cannot start adapter RPC server on " + config.getSocketPath(), e);
        }
        log.info("Bootstrap: adapter host ready; exposed={} loadOrder={}", dispatcher.exposedAdapters(), loaded.getLoadOrder());
        return new HostContextImpl(config, new AdapterContainer(loaded), server, bulk, metrics);
    }
}
