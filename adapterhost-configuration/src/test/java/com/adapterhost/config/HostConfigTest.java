package com.adapterhost.config;

import org.junit.jupiter.api.Test;

import java.nio.file.Paths;
import java.time.Duration;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;

class HostConfigTest {

    @Test
    void fromMap_emptyUsesDefaults() {
        HostConfig config = HostConfig.fromMap(Map.of());

        assertEquals(Paths.get(HostConfig.DEFAULT_SOCKET_PATH), config.getSocketPath());
        assertNull(config.getCallTimeout());
        assertEquals(1_000_000, config.getBulkThresholdBytes());
        assertEquals(5, config.getCircuitFailureThreshold());
        assertEquals(Duration.ofSeconds(30), config.getCircuitCooldown());
        assertEquals(Paths.get(System.getProperty("java.io.tmpdir")), config.getBulkDirectory());
    }

    @Test
    void fromMap_readsOverrides() {
        HostConfig config = HostConfig.fromMap(Map.of(
                HostConfig.ENV_SOCKET_PATH, "/run/host.sock",
                HostConfig.ENV_CALL_TIMEOUT_MS, "2500",
                HostConfig.ENV_BULK_THRESHOLD_BYTES, "4096",
                HostConfig.ENV_BULK_DIR, "/var/tmp/bulk",
                HostConfig.ENV_CIRCUIT_FAILURE_THRESHOLD, "3",
                HostConfig.ENV_CIRCUIT_COOLDOWN_MS, "1000",
                HostConfig.ENV_DISPATCH_THREADS, "2"));

        assertEquals(Paths.get("/run/host.sock"), config.getSocketPath());
        assertEquals(Duration.ofMillis(2500), config.getCallTimeout());
        assertEquals(4096, config.getBulkThresholdBytes());
        assertEquals(Paths.get("/var/tmp/bulk"), config.getBulkDirectory());
        assertEquals(3, config.getCircuitFailureThreshold());
        assertEquals(Duration.ofSeconds(1), config.getCircuitCooldown());
        assertEquals(2, config.getDispatchThreads());
    }

    @Test
    void fromMap_invalidNumberFallsBackToDefault() {
        HostConfig config = HostConfig.fromMap(Map.of(HostConfig.ENV_CIRCUIT_FAILURE_THRESHOLD, "many"));

        assertEquals(HostConfig.DEFAULT_CIRCUIT_FAILURE_THRESHOLD, config.getCircuitFailureThreshold());
    }

    @Test
    void build_rejectsNonPositiveThreshold() {
        assertThrows(IllegalArgumentException.class, () -> HostConfig.builder().circuitFailureThreshold(0).build());
    }

    @Test
    void toBuilder_copiesEverySetting() {
        HostConfig original = HostConfig.builder().socketPath(Paths.get("/tmp/x.sock")).callTimeout(Duration.ofSeconds(3)).build();

        HostConfig copy = original.toBuilder().dispatchThreads(1).build();

        assertEquals(original.getSocketPath(), copy.getSocketPath());
        assertEquals(original.getCallTimeout(), copy.getCallTimeout());
        assertEquals(1, copy.getDispatchThreads());
    }
}
