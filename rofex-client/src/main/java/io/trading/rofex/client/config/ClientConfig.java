package io.trading.rofex.client.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.util.function.Function;

/**
 * Configuration of a client bound to one environment.
 *
 * @param environment      Target environment
 * @param restUri          Base URI of the REST API (ends with '/')
 * @param streamUri        URI of the streaming API
 * @param proprietary      Default proprietary for order status/cancel requests
 * @param user             User name
 * @param password         Password
 * @param account          Default account, may be null
 * @param tokenTtlMs       Assumed token lifetime in milliseconds
 * @param requestTimeoutMs Timeout of REST requests in milliseconds
 */
public record ClientConfig(
    Environment environment,
    URI restUri,
    URI streamUri,
    String proprietary,
    String user,
    String password,
    String account,
    long tokenTtlMs,
    int requestTimeoutMs
) {
    private static final Logger LOGGER = LoggerFactory.getLogger(ClientConfig.class);

    private static final long DEFAULT_TOKEN_TTL_MS = 24L * 60 * 60 * 1000;
    private static final int DEFAULT_REQUEST_TIMEOUT_MS = 10000;

    public ClientConfig {
        if (environment == null) {
            throw new IllegalArgumentException("environment cannot be null");
        }
        if (restUri == null) {
            throw new IllegalArgumentException("restUri cannot be null");
        }
        if (streamUri == null) {
            throw new IllegalArgumentException("streamUri cannot be null");
        }
        if (user == null || user.isEmpty()) {
            throw new IllegalArgumentException("user cannot be null or empty");
        }
        if (password == null) {
            throw new IllegalArgumentException("password cannot be null");
        }
        if (tokenTtlMs <= 0) {
            throw new IllegalArgumentException("tokenTtlMs must be positive");
        }
        if (requestTimeoutMs <= 0) {
            throw new IllegalArgumentException("requestTimeoutMs must be positive");
        }
        if (!restUri.toString().endsWith("/")) {
            restUri = URI.create(restUri + "/");
        }
    }

    /**
     * Resolves a REST path (e.g., "rest/segment/all") against the base URI.
     */
    public URI resolve(String path) {
        return restUri.resolve(path);
    }

    @Override
    public String toString() {
        return "ClientConfig[environment=" + environment
            + ", restUri=" + restUri
            + ", streamUri=" + streamUri
            + ", user=" + user
            + ", account=" + account + "]";
    }

    /**
     * Loads configuration from environment variables.
     *
     * Environment variables:
     * - ROFEX_ENVIRONMENT: REMARKET or LIVE (default: REMARKET)
     * - ROFEX_USER / ROFEX_PASSWORD / ROFEX_ACCOUNT: credentials and default account
     * - ROFEX_REST_URL / ROFEX_WS_URL: override the environment URLs
     * - ROFEX_TOKEN_TTL_HOURS: assumed token lifetime (default: 24)
     * - ROFEX_REQUEST_TIMEOUT_MS: REST timeout (default: 10000)
     */
    public static ClientConfig fromEnv() {
        return fromEnv(System::getenv);
    }

    static ClientConfig fromEnv(Function<String, String> env) {
        String environmentStr = env.apply("ROFEX_ENVIRONMENT");
        Environment environment = environmentStr == null || environmentStr.isEmpty()
            ? Environment.REMARKET
            : Environment.valueOf(environmentStr.trim().toUpperCase());

        Builder builder = builder(environment)
            .user(env.apply("ROFEX_USER"))
            .password(env.apply("ROFEX_PASSWORD"))
            .account(env.apply("ROFEX_ACCOUNT"))
            .tokenTtlMs(parseIntEnv(env, "ROFEX_TOKEN_TTL_HOURS", 24) * 60L * 60 * 1000)
            .requestTimeoutMs(parseIntEnv(env, "ROFEX_REQUEST_TIMEOUT_MS", DEFAULT_REQUEST_TIMEOUT_MS));

        String restUrl = env.apply("ROFEX_REST_URL");
        if (restUrl != null && !restUrl.isEmpty()) {
            builder.restUri(URI.create(restUrl));
        }
        String wsUrl = env.apply("ROFEX_WS_URL");
        if (wsUrl != null && !wsUrl.isEmpty()) {
            builder.streamUri(URI.create(wsUrl));
        }
        return builder.build();
    }

    static int parseIntEnv(Function<String, String> env, String key, int defaultValue) {
        String value = env.apply(key);
        if (value == null || value.isEmpty()) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            LOGGER.warn("Invalid {} value: {}, using default: {}", key, value, defaultValue);
            return defaultValue;
        }
    }

    /**
     * Creates a builder preset with the environment URLs and proprietary.
     */
    public static Builder builder(Environment environment) {
        return new Builder(environment);
    }

    /**
     * Builder for ClientConfig.
     */
    public static class Builder {
        private final Environment environment;
        private URI restUri;
        private URI streamUri;
        private String proprietary;
        private String user;
        private String password;
        private String account;
        private long tokenTtlMs = DEFAULT_TOKEN_TTL_MS;
        private int requestTimeoutMs = DEFAULT_REQUEST_TIMEOUT_MS;

        private Builder(Environment environment) {
            if (environment == null) {
                throw new IllegalArgumentException("environment cannot be null");
            }
            this.environment = environment;
            this.restUri = environment.getRestUri();
            this.streamUri = environment.getStreamUri();
            this.proprietary = environment.getProprietary();
        }

        public Builder restUri(URI restUri) {
            this.restUri = restUri;
            return this;
        }

        public Builder streamUri(URI streamUri) {
            this.streamUri = streamUri;
            return this;
        }

        public Builder proprietary(String proprietary) {
            this.proprietary = proprietary;
            return this;
        }

        public Builder user(String user) {
            this.user = user;
            return this;
        }

        public Builder password(String password) {
            this.password = password;
            return this;
        }

        public Builder account(String account) {
            this.account = account;
            return this;
        }

        public Builder tokenTtlMs(long tokenTtlMs) {
            this.tokenTtlMs = tokenTtlMs;
            return this;
        }

        public Builder requestTimeoutMs(int requestTimeoutMs) {
            this.requestTimeoutMs = requestTimeoutMs;
            return this;
        }

        public ClientConfig build() {
            return new ClientConfig(
                environment,
                restUri,
                streamUri,
                proprietary,
                user,
                password,
                account,
                tokenTtlMs,
                requestTimeoutMs
            );
        }
    }
}
