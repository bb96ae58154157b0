package com.adapterhost.bootstrap;

import com.adapterhost.ipc.transport.AdapterTransport;
import com.adapterhost.proxy.ProxyAdapters;

/**
 * Sandbox-side handle: the transport to the host and the proxies that use it. Closing it closes the
 * transport; calls still pending fail with a {@link com.adapterhost.ipc.transport.TransportException}.
 */
public final class SandboxContext implements AutoCloseable {

    private final AdapterTransport transport;
    private final ProxyAdapters adapters;

    SandboxContext(AdapterTransport transport, ProxyAdapters adapters) {
        this.transport = transport;
        this.adapters = adapters;
    }

    public AdapterTransport transport() {
        return transport;
    }

    public ProxyAdapters adapters() {
        return adapters;
    }

    @Override
    public void close() {
        transport.close();
    }
}
