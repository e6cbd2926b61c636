package io.trading.rofex.client.config;

import java.util.function.Function;

/**
 * Tuning of a streaming session.
 *
 * @param loginTimeoutMs          Max time to wait for the handshake to be acknowledged
 * @param reconnectMaxRetries     Reconnect attempts before giving up (-1 for unlimited)
 * @param reconnectInitialDelayMs Delay before the first reconnect attempt
 * @param reconnectMaxDelayMs     Upper bound of the reconnect delay
 * @param backoffMultiplier       Factor applied to the delay after each failed attempt
 * @param pollIntervalMs          Max time the receive loop waits for an event before re-checking for close
 * @param pingIntervalSeconds     Idle time after which a ping is sent (0 disables)
 * @param enableCompression       Whether to negotiate permessage-deflate
 */
public record SessionConfig(
    long loginTimeoutMs,
    int reconnectMaxRetries,
    long reconnectInitialDelayMs,
    long reconnectMaxDelayMs,
    double backoffMultiplier,
    long pollIntervalMs,
    int pingIntervalSeconds,
    boolean enableCompression
) {
    private static final long DEFAULT_LOGIN_TIMEOUT_MS = 5000;
    private static final int DEFAULT_RECONNECT_MAX_RETRIES = 10;
    private static final long DEFAULT_RECONNECT_INITIAL_DELAY_MS = 1000;
    private static final long DEFAULT_RECONNECT_MAX_DELAY_MS = 60000;
    private static final double DEFAULT_BACKOFF_MULTIPLIER = 1.5;
    private static final long DEFAULT_POLL_INTERVAL_MS = 100;
    private static final int DEFAULT_PING_INTERVAL_SECONDS = 270;

    public SessionConfig {
        if (loginTimeoutMs <= 0) {
            throw new IllegalArgumentException("loginTimeoutMs must be positive");
        }
        if (reconnectMaxRetries < -1) {
            throw new IllegalArgumentException("reconnectMaxRetries must be -1 (unlimited) or >= 0");
        }
        if (reconnectInitialDelayMs < 0) {
            throw new IllegalArgumentException("reconnectInitialDelayMs cannot be negative");
        }
        if (reconnectMaxDelayMs < reconnectInitialDelayMs) {
            throw new IllegalArgumentException("reconnectMaxDelayMs cannot be lower than reconnectInitialDelayMs");
        }
        if (backoffMultiplier < 1.0) {
            throw new IllegalArgumentException("backoffMultiplier must be >= 1.0");
        }
        if (pollIntervalMs <= 0) {
            throw new IllegalArgumentException("pollIntervalMs must be positive");
        }
        if (pingIntervalSeconds < 0) {
            throw new IllegalArgumentException("pingIntervalSeconds cannot be negative");
        }
    }

    public static SessionConfig defaults() {
        return builder().build();
    }

    /**
     * Loads configuration from environment variables.
     *
     * Environment variables:
     * - ROFEX_LOGIN_TIMEOUT_MS (default: 5000)
     * - ROFEX_RECONNECT_MAX_RETRIES (default: 10)
     * - ROFEX_RECONNECT_INITIAL_DELAY_MS (default: 1000)
     * - ROFEX_RECONNECT_MAX_DELAY_MS (default: 60000)
     * - ROFEX_PING_INTERVAL_SECONDS (default: 270)
     */
    public static SessionConfig fromEnv() {
        return fromEnv(System::getenv);
    }

    static SessionConfig fromEnv(Function<String, String> env) {
        return builder()
            .loginTimeoutMs(ClientConfig.parseIntEnv(env, "ROFEX_LOGIN_TIMEOUT_MS", (int) DEFAULT_LOGIN_TIMEOUT_MS))
            .reconnectMaxRetries(ClientConfig.parseIntEnv(env, "ROFEX_RECONNECT_MAX_RETRIES", DEFAULT_RECONNECT_MAX_RETRIES))
            .reconnectInitialDelayMs(ClientConfig.parseIntEnv(env, "ROFEX_RECONNECT_INITIAL_DELAY_MS",
                (int) DEFAULT_RECONNECT_INITIAL_DELAY_MS))
            .reconnectMaxDelayMs(ClientConfig.parseIntEnv(env, "ROFEX_RECONNECT_MAX_DELAY_MS",
                (int) DEFAULT_RECONNECT_MAX_DELAY_MS))
            .pingIntervalSeconds(ClientConfig.parseIntEnv(env, "ROFEX_PING_INTERVAL_SECONDS", DEFAULT_PING_INTERVAL_SECONDS))
            .build();
    }

    /**
     * Creates a new builder for SessionConfig.
     */
    public static Builder builder() {
        return new Builder();
    }

    /**
     * Builder for SessionConfig.
     */
    public static class Builder {
        private long loginTimeoutMs = DEFAULT_LOGIN_TIMEOUT_MS;
        private int reconnectMaxRetries = DEFAULT_RECONNECT_MAX_RETRIES;
        private long reconnectInitialDelayMs = DEFAULT_RECONNECT_INITIAL_DELAY_MS;
        private long reconnectMaxDelayMs = DEFAULT_RECONNECT_MAX_DELAY_MS;
        private double backoffMultiplier = DEFAULT_BACKOFF_MULTIPLIER;
        private long pollIntervalMs = DEFAULT_POLL_INTERVAL_MS;
        private int pingIntervalSeconds = DEFAULT_PING_INTERVAL_SECONDS;
        private boolean enableCompression = false;

        public Builder loginTimeoutMs(long loginTimeoutMs) {
            this.loginTimeoutMs = loginTimeoutMs;
            return this;
        }

        public Builder reconnectMaxRetries(int reconnectMaxRetries) {
            this.reconnectMaxRetries = reconnectMaxRetries;
            return this;
        }

        public Builder reconnectInitialDelayMs(long reconnectInitialDelayMs) {
            this.reconnectInitialDelayMs = reconnectInitialDelayMs;
            return this;
        }

        public Builder reconnectMaxDelayMs(long reconnectMaxDelayMs) {
            this.reconnectMaxDelayMs = reconnectMaxDelayMs;
            return this;
        }

        public Builder backoffMultiplier(double backoffMultiplier) {
            this.backoffMultiplier = backoffMultiplier;
            return this;
        }

        public Builder pollIntervalMs(long pollIntervalMs) {
            this.pollIntervalMs = pollIntervalMs;
            return this;
        }

        public Builder pingIntervalSeconds(int pingIntervalSeconds) {
            this.pingIntervalSeconds = pingIntervalSeconds;
            return this;
        }

        public Builder enableCompression(boolean enableCompression) {
            this.enableCompression = enableCompression;
            return this;
        }

        public SessionConfig build() {
            return new SessionConfig(
                loginTimeoutMs,
                reconnectMaxRetries,
                reconnectInitialDelayMs,
                reconnectMaxDelayMs,
                backoffMultiplier,
                pollIntervalMs,
                pingIntervalSeconds,
                enableCompression
            );
        }
    }
}
