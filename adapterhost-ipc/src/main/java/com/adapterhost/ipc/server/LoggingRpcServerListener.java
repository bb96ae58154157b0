package com.adapterhost.ipc.server;

import com.adapterhost.ipc.protocol.AdapterCall;
import com.adapterhost.ipc.protocol.AdapterResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Default listener: writes server events to the log. */
public final class LoggingRpcServerListener implements RpcServerListener {

    private static final Logger log = LoggerFactory.getLogger(LoggingRpcServerListener.class);

    @Override
    public void onProtocolVersionMismatch(int received, int expected, AdapterCall call) {
        log.warn("Protocol version mismatch on {} ({}): sandbox sent {}, host speaks {}",
                call.operation(), call.requestId(), received, expected);
    }

    @Override
    public void onCallFailed(AdapterCall call, AdapterResponse response) {
        log.debug("Call {} ({}) returned error {}", call.operation(), call.requestId(), response.error());
    }

    @Override
    public void onMalformedFrame(String connectionId, Exception error) {
        log.warn("Skipping malformed frame on {}: {}", connectionId, error.getMessage());
    }
}
