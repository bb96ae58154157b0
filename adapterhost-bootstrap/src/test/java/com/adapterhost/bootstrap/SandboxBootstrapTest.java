package com.adapterhost.bootstrap;

import com.adapterhost.config.HostConfig;
import com.adapterhost.ipc.transport.TransportOptions;
import com.adapterhost.ipc.transport.UnixSocketTransport;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SandboxBootstrapTest {

    @Test
    void transportOptions_mirrorHostConfig() {
        HostConfig config = HostConfig.fromMap(Map.of(
                "ADAPTERHOST_SOCKET_PATH", "/tmp/custom.sock",
                "ADAPTERHOST_CALL_TIMEOUT_MS", "2500",
                "ADAPTERHOST_CIRCUIT_FAILURE_THRESHOLD", "3",
                "ADAPTERHOST_CIRCUIT_COOLDOWN_MS", "1000",
                "ADAPTERHOST_BULK_THRESHOLD_BYTES", "4096",
                "ADAPTERHOST_BULK_DIR", "/tmp/bulk"));

        TransportOptions options = SandboxBootstrap.transportOptions(config).build();

        assertEquals(Paths.get("/tmp/custom.sock"), options.getSocketPath());
        assertEquals(Duration.ofMillis(2500), options.getCallTimeout());
        assertEquals(3, options.getFailureThreshold());
        assertEquals(Duration.ofSeconds(1), options.getCooldown());
        assertEquals(4096, options.getBulkThresholdBytes());
        assertEquals(Path.of("/tmp/bulk"), options.getBulkDirectory());
    }

    @Test
    void connect_isLazyUntilFirstCall() {
        HostConfig config = HostConfig.builder().socketPath(Paths.get("/tmp/adapterhost-test-absent.sock")).build();

        try (SandboxContext sandbox = SandboxBootstrap.connect(config)) {
            UnixSocketTransport transport = assertInstanceOf(UnixSocketTransport.class, sandbox.transport());
            assertFalse(transport.isConnected());
            assertEquals(9, sandbox.adapters().asMap().size());
        }
    }

    @Test
    void close_closesTransport() {
        SandboxContext sandbox = SandboxBootstrap.connect(HostConfig.builder().build());
        sandbox.close();
        assertTrue(sandbox.transport().isClosed());
    }
}
