package com.adapterhost.bootstrap;

import com.adapterhost.codec.WireCodec;
import com.adapterhost.config.HostConfig;
import com.adapterhost.ipc.metrics.IpcMetrics;
import com.adapterhost.ipc.transport.TransportOptions;
import com.adapterhost.ipc.transport.UnixSocketTransport;
import com.adapterhost.proxy.ProxyAdapters;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Sandbox-side bootstrap: a {@link UnixSocketTransport} to the host socket and the standard proxies
 * over it. No I/O happens until the first proxy call.
 */
public final class SandboxBootstrap {

    private static final Logger log = LoggerFactory.getLogger(SandboxBootstrap.class);

    private SandboxBootstrap() {
    }

    public static SandboxContext connect(HostConfig config) {
        return connect(config, IpcMetrics.simple());
    }

    public static SandboxContext connect(HostConfig config, IpcMetrics metrics) {
        TransportOptions options = transportOptions(config).metrics(metrics).build();
        UnixSocketTransport transport = new UnixSocketTransport(options);
        log.info("Sandbox: adapter transport to {} (callTimeout={}, circuit={}/{}ms)", config.getSocketPath(),
                config.getCallTimeout() != null ? config.getCallTimeout().toMillis() + "ms" : "per-operation",
                config.getCircuitFailureThreshold(), config.getCircuitCooldown().toMillis());
        return new SandboxContext(transport, ProxyAdapters.create(transport, options.getCodec()));
    }

    static TransportOptions.Builder transportOptions(HostConfig config) {
        return TransportOptions.builder(config.getSocketPath())
                .callTimeout(config.getCallTimeout())
                .failureThreshold(config.getCircuitFailureThreshold())
                .cooldown(config.getCircuitCooldown())
                .bulkThresholdBytes(config.getBulkThresholdBytes())
                .bulkDirectory(config.getBulkDirectory())
                .maxFrameBytes(config.getMaxFrameBytes())
                .codec(WireCodec.shared());
    }
}
