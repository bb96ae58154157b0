package com.adapterhost.ipc.server;

import java.nio.file.Path;
import java.util.Objects;

/**
 * @param socketPath      filesystem path of the listening socket
 * @param dispatchThreads worker threads running adapter methods
 * @param maxFrameBytes   largest accepted inbound frame; a connection exceeding it is closed
 */
public record RpcServerOptions(Path socketPath, int dispatchThreads, int maxFrameBytes) {

    public static final int DEFAULT_DISPATCH_THREADS = 8;
    public static final int DEFAULT_MAX_FRAME_BYTES = 64 * 1024 * 1024;

    public RpcServerOptions {
        Objects.requireNonNull(socketPath, "socketPath");
        if (dispatchThreads <= 0) throw new IllegalArgumentException("dispatchThreads must be positive");
        if (maxFrameBytes <= 0) throw new IllegalArgumentException("maxFrameBytes must be positive");
    }

    public static RpcServerOptions of(Path socketPath) {
        return new RpcServerOptions(socketPath, DEFAULT_DISPATCH_THREADS, DEFAULT_MAX_FRAME_BYTES);
    }
}
