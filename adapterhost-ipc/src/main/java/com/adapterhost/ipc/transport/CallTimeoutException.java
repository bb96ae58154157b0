package com.adapterhost.ipc.transport;

import java.time.Duration;

/** No response arrived within the call's timeout budget. */
public final class CallTimeoutException extends TransportException {

    private final String adapter;
    private final String method;
    private final Duration timeout;

    public CallTimeoutException(String adapter, String method, Duration timeout) {
        super("Adapter call " + adapter + "." + method + " timed out after " + timeout.toMillis() + "ms");
        this.adapter = adapter;
        this.method = method;
        this.timeout = timeout;
    }

    public String getAdapter() {
        return adapter;
    }

    public String getMethod() {
        return method;
    }

    public Duration getTimeout() {
        return timeout;
    }
}
