package com.adapterhost.codec;

import java.util.Objects;

/**
 * An error raised by an adapter on the other side of the wire, rebuilt from its serialized form.
 * Name, message and code are preserved; the remote stack is kept as text. Never retried.
 */
public class RemoteAdapterException extends RuntimeException implements CodedError {

    private final String name;
    private final String code;
    private final String remoteStack;

    public RemoteAdapterException(String name, String message, String code, String remoteStack) {
        super(message != null ? message : "");
        this.name = name != null && !name.isBlank() ? name : "Error";
        this.code = code;
        this.remoteStack = remoteStack;
    }

    /** Simple class name (or error name) of the original exception. */
    public String getName() {
        return name;
    }

    @Override
    public String getCode() {
        return code;
    }

    /** Stack trace text of the original exception, or null when the sender did not include one. */
    public String getRemoteStack() {
        return remoteStack;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder(name);
        if (code != null) {
            sb.append(" [").append(code).append(']');
        }
        return sb.append(": ").append(getMessage()).toString();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof RemoteAdapterException)) return false;
        RemoteAdapterException that = (RemoteAdapterException) o;
        return name.equals(that.name) && Objects.equals(getMessage(), that.getMessage()) && Objects.equals(code, that.code);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, getMessage(), code);
    }
}
