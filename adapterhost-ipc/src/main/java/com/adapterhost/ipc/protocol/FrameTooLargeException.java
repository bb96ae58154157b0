package com.adapterhost.ipc.protocol;

/** More than the allowed number of bytes arrived without a frame delimiter. */
public final class FrameTooLargeException extends ProtocolException {

    private final int limit;

    public FrameTooLargeException(int limit) {
        super("Frame exceeds " + limit + " bytes without a delimiter");
        this.limit = limit;
    }

    public int getLimit() {
        return limit;
    }
}
