package com.adapterhost.proxy;

import com.adapterhost.adapters.AdapterTokens;
import com.adapterhost.adapters.logging.AdapterLogger;
import com.adapterhost.adapters.logging.LogLevel;
import com.adapterhost.codec.WireCodec;
import com.adapterhost.ipc.transport.AdapterTransport;
import com.adapterhost.ipc.transport.CallOptions;

import java.util.Map;

/** Forwards log records to the host logger, where hook listeners (ring buffer, persistence) see them. */
public final class LoggerProxy extends RemoteAdapter implements AdapterLogger {

    public LoggerProxy(AdapterTransport transport, WireCodec codec) {
        this(AdapterTokens.LOGGER, transport, codec, null);
    }

    public LoggerProxy(String token, AdapterTransport transport, WireCodec codec, CallOptions callOptions) {
        super(token, transport, codec, callOptions);
    }

    @Override
    public void log(LogLevel level, String message, Map<String, Object> fields) {
        invoke("log", level, message, fields);
    }
}
