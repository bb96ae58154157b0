package com.adapterhost.ipc.transport;

import com.adapterhost.ipc.protocol.CallContext;

import java.time.Duration;

/**
 * Per-call settings. Null fields fall back to the transport's configuration.
 *
 * @param timeout explicit budget for this call, or null
 * @param context correlation data sent with the call, or null
 */
public record CallOptions(Duration timeout, CallContext context) {

    private static final CallOptions DEFAULTS = new CallOptions(null, null);

    public CallOptions {
        if (timeout != null && (timeout.isNegative() || timeout.isZero())) {
            throw new IllegalArgumentException("timeout must be positive");
        }
    }

    public static CallOptions defaults() {
        return DEFAULTS;
    }

    public static CallOptions timeout(Duration timeout) {
        return new CallOptions(timeout, null);
    }

    public CallOptions withTimeout(Duration newTimeout) {
        return new CallOptions(newTimeout, context);
    }

    public CallOptions withContext(CallContext newContext) {
        return new CallOptions(timeout, newContext);
    }
}
