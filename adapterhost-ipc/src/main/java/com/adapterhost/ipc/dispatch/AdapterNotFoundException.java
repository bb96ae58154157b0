package com.adapterhost.ipc.dispatch;

import com.adapterhost.codec.CodedError;

/** The call named an adapter the host does not expose. */
public final class AdapterNotFoundException extends RuntimeException implements CodedError {

    public static final String CODE = "ADAPTER_NOT_FOUND";

    private final String adapter;

    public AdapterNotFoundException(String adapter) {
        super("Adapter not found: " + adapter);
        this.adapter = adapter;
    }

    public String getAdapter() {
        return adapter;
    }

    @Override
    public String getCode() {
        return CODE;
    }
}
