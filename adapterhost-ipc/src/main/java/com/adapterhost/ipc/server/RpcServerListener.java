package com.adapterhost.ipc.server;

import com.adapterhost.ipc.protocol.AdapterCall;
import com.adapterhost.ipc.protocol.AdapterResponse;

/**
 * Observer for server-side events that do not stop request handling. Methods may be called from the
 * socket thread or from dispatch workers.
 */
public interface RpcServerListener {

    RpcServerListener NOOP = new RpcServerListener() { };

    /** The call carried a protocol version other than the server's; it is still dispatched. */
    default void onProtocolVersionMismatch(int received, int expected, AdapterCall call) {
    }

    /** The call produced an error response. */
    default void onCallFailed(AdapterCall call, AdapterResponse response) {
    }

    /** A frame could not be decoded as a call and was skipped. */
    default void onMalformedFrame(String connectionId, Exception error) {
    }
}
