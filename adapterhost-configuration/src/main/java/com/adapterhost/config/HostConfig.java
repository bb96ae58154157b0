package com.adapterhost.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.Map;
import java.util.Objects;

/**
 * Settings shared by the host and the sandbox, loaded from environment variables.
 * <p>
 * Socket: ADAPTERHOST_SOCKET_PATH. Transport: ADAPTERHOST_CALL_TIMEOUT_MS (overrides the per-operation
 * timeout table when set), ADAPTERHOST_CIRCUIT_FAILURE_THRESHOLD, ADAPTERHOST_CIRCUIT_COOLDOWN_MS.
 * Bulk transfer: ADAPTERHOST_BULK_THRESHOLD_BYTES, ADAPTERHOST_BULK_DIR. Server: ADAPTERHOST_DISPATCH_THREADS,
 * ADAPTERHOST_MAX_FRAME_BYTES.
 */
public final class HostConfig {

    private static final Logger log = LoggerFactory.getLogger(HostConfig.class);

    static final String ENV_SOCKET_PATH = "ADAPTERHOST_SOCKET_PATH";
    static final String ENV_CALL_TIMEOUT_MS = "ADAPTERHOST_CALL_TIMEOUT_MS";
    static final String ENV_BULK_THRESHOLD_BYTES = "ADAPTERHOST_BULK_THRESHOLD_BYTES";
    static final String ENV_BULK_DIR = "ADAPTERHOST_BULK_DIR";
    static final String ENV_CIRCUIT_FAILURE_THRESHOLD = "ADAPTERHOST_CIRCUIT_FAILURE_THRESHOLD";
    static final String ENV_CIRCUIT_COOLDOWN_MS = "ADAPTERHOST_CIRCUIT_COOLDOWN_MS";
    static final String ENV_DISPATCH_THREADS = "ADAPTERHOST_DISPATCH_THREADS";
    static final String ENV_MAX_FRAME_BYTES = "ADAPTERHOST_MAX_FRAME_BYTES";

    public static final String DEFAULT_SOCKET_PATH = "/tmp/adapterhost-ipc.sock";
    public static final int DEFAULT_BULK_THRESHOLD_BYTES = 1_000_000;
    public static final int DEFAULT_CIRCUIT_FAILURE_THRESHOLD = 5;
    public static final long DEFAULT_CIRCUIT_COOLDOWN_MS = 30_000L;
    public static final int DEFAULT_DISPATCH_THREADS = 8;
    public static final int DEFAULT_MAX_FRAME_BYTES = 64 * 1024 * 1024;

    private final Path socketPath;
    private final Duration callTimeout;
    private final int bulkThresholdBytes;
    private final Path bulkDirectory;
    private final int circuitFailureThreshold;
    private final Duration circuitCooldown;
    private final int dispatchThreads;
    private final int maxFrameBytes;

    private HostConfig(Builder b) {
        this.socketPath = b.socketPath;
        this.callTimeout = b.callTimeout;
        this.bulkThresholdBytes = b.bulkThresholdBytes;
        this.bulkDirectory = b.bulkDirectory != null ? b.bulkDirectory : Paths.get(System.getProperty("java.io.tmpdir"));
        this.circuitFailureThreshold = b.circuitFailureThreshold;
        this.circuitCooldown = b.circuitCooldown;
        this.dispatchThreads = b.dispatchThreads;
        this.maxFrameBytes = b.maxFrameBytes;
    }

    public static HostConfig fromEnvironment() {
        return fromMap(System.getenv());
    }

    /** Same as {@link #fromEnvironment()} but reading from {@code env}; invalid numbers fall back to defaults. */
    public static HostConfig fromMap(Map<String, String> env) {
        Builder b = builder()
                .socketPath(Paths.get(get(env, ENV_SOCKET_PATH, DEFAULT_SOCKET_PATH)))
                .bulkThresholdBytes(parseInt(env, ENV_BULK_THRESHOLD_BYTES, DEFAULT_BULK_THRESHOLD_BYTES))
                .circuitFailureThreshold(parseInt(env, ENV_CIRCUIT_FAILURE_THRESHOLD, DEFAULT_CIRCUIT_FAILURE_THRESHOLD))
                .circuitCooldown(Duration.ofMillis(parseLong(env, ENV_CIRCUIT_COOLDOWN_MS, DEFAULT_CIRCUIT_COOLDOWN_MS)))
                .dispatchThreads(parseInt(env, ENV_DISPATCH_THREADS, DEFAULT_DISPATCH_THREADS))
                .maxFrameBytes(parseInt(env, ENV_MAX_FRAME_BYTES, DEFAULT_MAX_FRAME_BYTES));
        String bulkDir = get(env, ENV_BULK_DIR, null);
        if (bulkDir != null) b.bulkDirectory(Paths.get(bulkDir));
        long timeoutMs = parseLong(env, ENV_CALL_TIMEOUT_MS, -1L);
        if (timeoutMs > 0) b.callTimeout(Duration.ofMillis(timeoutMs));
        return b.build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return builder()
                .socketPath(socketPath)
                .callTimeout(callTimeout)
                .bulkThresholdBytes(bulkThresholdBytes)
                .bulkDirectory(bulkDirectory)
                .circuitFailureThreshold(circuitFailureThreshold)
                .circuitCooldown(circuitCooldown)
                .dispatchThreads(dispatchThreads)
                .maxFrameBytes(maxFrameBytes);
    }

    /** Unix domain socket the host listens on and sandboxes connect to. Default {@value #DEFAULT_SOCKET_PATH}. */
    public Path getSocketPath() {
        return socketPath;
    }

    /** Transport-wide call timeout, or null to use the per-operation table. */
    public Duration getCallTimeout() {
        return callTimeout;
    }

    /** Serialized size above which arguments and results go through a temp file. Default 1,000,000. */
    public int getBulkThresholdBytes() {
        return bulkThresholdBytes;
    }

    public Path getBulkDirectory() {
        return bulkDirectory;
    }

    /** Consecutive transport failures that open the circuit. Default 5. */
    public int getCircuitFailureThreshold() {
        return circuitFailureThreshold;
    }

    /** Time the circuit stays open before one trial call. Default 30 s. */
    public Duration getCircuitCooldown() {
        return circuitCooldown;
    }

    public int getDispatchThreads() {
        return dispatchThreads;
    }

    public int getMaxFrameBytes() {
        return maxFrameBytes;
    }

    @Override
    public String toString() {
        return "HostConfig{socket=" + socketPath + ", callTimeout=" + callTimeout + ", bulkThreshold=" + bulkThresholdBytes
                + ", circuit=" + circuitFailureThreshold + "/" + circuitCooldown.toMillis() + "ms, dispatchThreads=" + dispatchThreads + "}";
    }

    private static String get(Map<String, String> env, String key, String defaultValue) {
        String v = env.get(key);
        return (v != null && !v.isBlank()) ? v.trim() : defaultValue;
    }

    private static int parseInt(Map<String, String> env, String key, int defaultValue) {
        String v = env.get(key);
        if (v == null || v.isBlank()) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(v.trim());
        } catch (NumberFormatException e) {
            log.warn("Ignoring invalid {}={}; using {}", key, v, defaultValue);
            return defaultValue;
        }
    }

    private static long parseLong(Map<String, String> env, String key, long defaultValue) {
        String v = env.get(key);
        if (v == null || v.isBlank()) {
            return defaultValue;
        }
        try {
            return Long.parseLong(v.trim());
        } catch (NumberFormatException e) {
            log.warn("Ignoring invalid {}={}; using {}", key, v, defaultValue);
            return defaultValue;
        }
    }

    public static final class Builder {
        private Path socketPath = Paths.get(DEFAULT_SOCKET_PATH);
        private Duration callTimeout;
        private int bulkThresholdBytes = DEFAULT_BULK_THRESHOLD_BYTES;
        private Path bulkDirectory;
        private int circuitFailureThreshold = DEFAULT_CIRCUIT_FAILURE_THRESHOLD;
        private Duration circuitCooldown = Duration.ofMillis(DEFAULT_CIRCUIT_COOLDOWN_MS);
        private int dispatchThreads = DEFAULT_DISPATCH_THREADS;
        private int maxFrameBytes = DEFAULT_MAX_FRAME_BYTES;

        public Builder socketPath(Path socketPath) {
            this.socketPath = Objects.requireNonNull(socketPath, "socketPath");
            return this;
        }

        public Builder callTimeout(Duration callTimeout) {
            this.callTimeout = callTimeout;
            return this;
        }

        public Builder bulkThresholdBytes(int bulkThresholdBytes) {
            this.bulkThresholdBytes = bulkThresholdBytes;
            return this;
        }

        public Builder bulkDirectory(Path bulkDirectory) {
            this.bulkDirectory = bulkDirectory;
            return this;
        }

        public Builder circuitFailureThreshold(int circuitFailureThreshold) {
            this.circuitFailureThreshold = circuitFailureThreshold;
            return this;
        }

        public Builder circuitCooldown(Duration circuitCooldown) {
            this.circuitCooldown = Objects.requireNonNull(circuitCooldown, "circuitCooldown");
            return this;
        }

        public Builder dispatchThreads(int dispatchThreads) {
            this.dispatchThreads = dispatchThreads;
            return this;
        }

        public Builder maxFrameBytes(int maxFrameBytes) {
            this.maxFrameBytes = maxFrameBytes;
            return this;
        }

        /** @throws IllegalArgumentException if a numeric setting is not positive */
        public HostConfig build() {
            requirePositive(bulkThresholdBytes, ENV_BULK_THRESHOLD_BYTES);
            requirePositive(circuitFailureThreshold, ENV_CIRCUIT_FAILURE_THRESHOLD);
            requirePositive(dispatchThreads, ENV_DISPATCH_THREADS);
            requirePositive(maxFrameBytes, ENV_MAX_FRAME_BYTES);
            if (circuitCooldown.isNegative()) {
                throw new IllegalArgumentException(ENV_CIRCUIT_COOLDOWN_MS + " must not be negative");
            }
            if (callTimeout != null && (callTimeout.isZero() || callTimeout.isNegative())) {
                throw new IllegalArgumentException(ENV_CALL_TIMEOUT_MS + " must be positive");
            }
            return new HostConfig(this);
        }

        private static void requirePositive(long value, String name) {
            if (value <= 0) {
                throw new IllegalArgumentException(name + " must be positive, got " + value);
            }
        }
    }
}
