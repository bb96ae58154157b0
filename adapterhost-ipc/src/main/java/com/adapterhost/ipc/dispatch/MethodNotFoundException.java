package com.adapterhost.ipc.dispatch;

import com.adapterhost.codec.CodedError;

/** The adapter exists but has no such method. */
public final class MethodNotFoundException extends RuntimeException implements CodedError {

    public static final String CODE = "METHOD_NOT_FOUND";

    private final String adapter;
    private final String method;

    public MethodNotFoundException(String adapter, String method) {
        super("Method not found: " + adapter + "." + method);
        this.adapter = adapter;
        this.method = method;
    }

    public String getAdapter() {
        return adapter;
    }

    public String getMethod() {
        return method;
    }

    @Override
    public String getCode() {
        return CODE;
    }
}
