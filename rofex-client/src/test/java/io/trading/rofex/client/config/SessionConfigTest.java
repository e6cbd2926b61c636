package io.trading.rofex.client.config;

import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class SessionConfigTest {

    @Test
    void testDefaults() {
        SessionConfig config = SessionConfig.defaults();

        assertEquals(5000, config.loginTimeoutMs());
        assertEquals(10, config.reconnectMaxRetries());
        assertEquals(1000, config.reconnectInitialDelayMs());
        assertEquals(60000, config.reconnectMaxDelayMs());
        assertEquals(1.5, config.backoffMultiplier());
        assertFalse(config.enableCompression());
    }

    @Test
    void testValidation() {
        assertThrows(IllegalArgumentException.class, () -> SessionConfig.builder().loginTimeoutMs(0).build());
        assertThrows(IllegalArgumentException.class, () -> SessionConfig.builder().reconnectMaxRetries(-2).build());
        assertThrows(IllegalArgumentException.class,
            () -> SessionConfig.builder().reconnectInitialDelayMs(5000).reconnectMaxDelayMs(1000).build());
        assertThrows(IllegalArgumentException.class, () -> SessionConfig.builder().backoffMultiplier(0.5).build());
        assertThrows(IllegalArgumentException.class, () -> SessionConfig.builder().pingIntervalSeconds(-1).build());
    }

    @Test
    void testUnlimitedRetriesAllowed() {
        assertEquals(-1, SessionConfig.builder().reconnectMaxRetries(-1).build().reconnectMaxRetries());
    }

    @Test
    void testFromEnv() {
        Map<String, String> env = Map.of(
            "ROFEX_LOGIN_TIMEOUT_MS", "2000",
            "ROFEX_RECONNECT_MAX_RETRIES", "-1",
            "ROFEX_PING_INTERVAL_SECONDS", "30"
        );

        SessionConfig config = SessionConfig.fromEnv(env::get);

        assertEquals(2000, config.loginTimeoutMs());
        assertEquals(-1, config.reconnectMaxRetries());
        assertEquals(30, config.pingIntervalSeconds());
        assertEquals(1000, config.reconnectInitialDelayMs());
    }
}
