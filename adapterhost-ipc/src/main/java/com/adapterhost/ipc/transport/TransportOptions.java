package com.adapterhost.ipc.transport;

import com.adapterhost.codec.WireCodec;
import com.adapterhost.ipc.bulk.BulkTransfer;
import com.adapterhost.ipc.metrics.IpcMetrics;
import com.adapterhost.ipc.protocol.CallContext;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.Executor;
import java.util.concurrent.ForkJoinPool;
import java.util.function.LongSupplier;

/**
 * Settings for {@link UnixSocketTransport}. Build with {@link #builder(Path)}.
 */
public final class TransportOptions {

    public static final int DEFAULT_FAILURE_THRESHOLD = 5;
    public static final Duration DEFAULT_COOLDOWN = Duration.ofSeconds(30);
    public static final int DEFAULT_MAX_FRAME_BYTES = 64 * 1024 * 1024;

    private final Path socketPath;
    private final Duration callTimeout;
    private final OperationTimeouts operationTimeouts;
    private final int failureThreshold;
    private final Duration cooldown;
    private final int bulkThresholdBytes;
    private final Path bulkDirectory;
    private final int maxFrameBytes;
    private final IpcMetrics metrics;
    private final WireCodec codec;
    private final LongSupplier clock;
    private final Executor callbackExecutor;
    private final CallContext defaultContext;

    private TransportOptions(Builder b) {
        this.socketPath = b.socketPath;
        this.callTimeout = b.callTimeout;
        this.operationTimeouts = b.operationTimeouts;
        this.failureThreshold = b.failureThreshold;
        this.cooldown = b.cooldown;
        this.bulkThresholdBytes = b.bulkThresholdBytes;
        this.bulkDirectory = b.bulkDirectory;
        this.maxFrameBytes = b.maxFrameBytes;
        this.metrics = b.metrics != null ? b.metrics : IpcMetrics.simple();
        this.codec = b.codec;
        this.clock = b.clock;
        this.callbackExecutor = b.callbackExecutor;
        this.defaultContext = b.defaultContext;
    }

    public static Builder builder(Path socketPath) {
        return new Builder(socketPath);
    }

    public Path getSocketPath() {
        return socketPath;
    }

    /** Transport-wide timeout overriding the operation table, or null. */
    public Duration getCallTimeout() {
        return callTimeout;
    }

    public OperationTimeouts getOperationTimeouts() {
        return operationTimeouts;
    }

    public int getFailureThreshold() {
        return failureThreshold;
    }

    public Duration getCooldown() {
        return cooldown;
    }

    public int getBulkThresholdBytes() {
        return bulkThresholdBytes;
    }

    public Path getBulkDirectory() {
        return bulkDirectory;
    }

    public int getMaxFrameBytes() {
        return maxFrameBytes;
    }

    public IpcMetrics getMetrics() {
        return metrics;
    }

    public WireCodec getCodec() {
        return codec;
    }

    public LongSupplier getClock() {
        return clock;
    }

    public Executor getCallbackExecutor() {
        return callbackExecutor;
    }

    public CallContext getDefaultContext() {
        return defaultContext;
    }

    public static final class Builder {
        private final Path socketPath;
        private Duration callTimeout;
        private OperationTimeouts operationTimeouts = OperationTimeouts.defaults();
        private int failureThreshold = DEFAULT_FAILURE_THRESHOLD;
        private Duration cooldown = DEFAULT_COOLDOWN;
        private int bulkThresholdBytes = BulkTransfer.DEFAULT_THRESHOLD_BYTES;
        private Path bulkDirectory = Paths.get(System.getProperty("java.io.tmpdir"));
        private int maxFrameBytes = DEFAULT_MAX_FRAME_BYTES;
        private IpcMetrics metrics;
        private WireCodec codec = WireCodec.shared();
        private LongSupplier clock = System::currentTimeMillis;
        private Executor callbackExecutor = ForkJoinPool.commonPool();
        private CallContext defaultContext;

        private Builder(Path socketPath) {
            this.socketPath = Objects.requireNonNull(socketPath, "socketPath");
        }

        public Builder callTimeout(Duration callTimeout) {
            this.callTimeout = callTimeout;
            return this;
        }

        public Builder operationTimeouts(OperationTimeouts operationTimeouts) {
            this.operationTimeouts = Objects.requireNonNull(operationTimeouts, "operationTimeouts");
            return this;
        }

        public Builder failureThreshold(int failureThreshold) {
            this.failureThreshold = failureThreshold;
            return this;
        }

        public Builder cooldown(Duration cooldown) {
            this.cooldown = Objects.requireNonNull(cooldown, "cooldown");
            return this;
        }

        public Builder bulkThresholdBytes(int bulkThresholdBytes) {
            this.bulkThresholdBytes = bulkThresholdBytes;
            return this;
        }

        public Builder bulkDirectory(Path bulkDirectory) {
            this.bulkDirectory = Objects.requireNonNull(bulkDirectory, "bulkDirectory");
            return this;
        }

        public Builder maxFrameBytes(int maxFrameBytes) {
            this.maxFrameBytes = maxFrameBytes;
            return this;
        }

        public Builder metrics(IpcMetrics metrics) {
            this.metrics = metrics;
            return this;
        }

        public Builder codec(WireCodec codec) {
            this.codec = Objects.requireNonNull(codec, "codec");
            return this;
        }

        /** Millisecond clock used by the circuit breaker. */
        public Builder clock(LongSupplier clock) {
            this.clock = Objects.requireNonNull(clock, "clock");
            return this;
        }

        /** Executor completing call futures; keeps caller callbacks off the socket thread. */
        public Builder callbackExecutor(Executor callbackExecutor) {
            this.callbackExecutor = Objects.requireNonNull(callbackExecutor, "callbackExecutor");
            return this;
        }

        /** Context sent with calls that do not carry their own. */
        public Builder defaultContext(CallContext defaultContext) {
            this.defaultContext = defaultContext;
            return this;
        }

        public TransportOptions build() {
            if (failureThreshold <= 0) throw new IllegalArgumentException("failureThreshold must be positive");
            if (bulkThresholdBytes <= 0) throw new IllegalArgumentException("bulkThresholdBytes must be positive");
            if (maxFrameBytes <= 0) throw new IllegalArgumentException("maxFrameBytes must be positive");
            if (callTimeout != null && (callTimeout.isZero() || callTimeout.isNegative())) {
                throw new IllegalArgumentException("callTimeout must be positive");
            }
            return new TransportOptions(this);
        }
    }
}
