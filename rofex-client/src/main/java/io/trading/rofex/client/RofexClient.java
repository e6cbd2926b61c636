package io.trading.rofex.client;

import io.prometheus.client.CollectorRegistry;
import io.trading.rofex.client.auth.CredentialProvider;
import io.trading.rofex.client.auth.PasswordCredentialProvider;
import io.trading.rofex.client.auth.Token;
import io.trading.rofex.client.config.ClientConfig;
import io.trading.rofex.client.config.SessionConfig;
import io.trading.rofex.client.metrics.SessionMetrics;
import io.trading.rofex.client.netty.NettyStreamTransport;
import io.trading.rofex.client.rest.RestClient;
import io.trading.rofex.client.stream.SessionState;
import io.trading.rofex.client.stream.StreamingSession;
import io.trading.rofex.client.stream.TransportFactory;
import io.trading.rofex.protocol.codec.JsonMessageCodec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.http.HttpClient;
import java.time.Duration;
import java.util.Locale;

/**
 * Client bound to one environment: credentials, REST calls and the streaming session.
 */
public class RofexClient implements AutoCloseable {

    private static final Logger LOGGER = LoggerFactory.getLogger(RofexClient.class);

    private final ClientConfig config;
    private final SessionConfig sessionConfig;
    private final CredentialProvider credentials;
    private final RestClient rest;
    private final TransportFactory transportFactory;
    private final SessionMetrics metrics;
    private final String sessionName;

    private StreamingSession session;

    public RofexClient(ClientConfig config) {
        this(config, SessionConfig.defaults());
    }

    public RofexClient(ClientConfig config, SessionConfig sessionConfig) {
        this(config, sessionConfig, newHttpClient(config));
    }

    private RofexClient(ClientConfig config, SessionConfig sessionConfig, HttpClient httpClient) {
        this(config, sessionConfig, new PasswordCredentialProvider(config, httpClient), httpClient,
            NettyStreamTransport::new, new CollectorRegistry());
    }

    /**
     * @param config           Environment and credentials
     * @param sessionConfig    Streaming session tuning
     * @param credentials      Token source shared by REST and streaming
     * @param httpClient       HTTP client used by REST calls
     * @param transportFactory Creates the streaming connections
     * @param registry         Registry the session metrics are registered on
     */
    public RofexClient(
        ClientConfig config,
        SessionConfig sessionConfig,
        CredentialProvider credentials,
        HttpClient httpClient,
        TransportFactory transportFactory,
        CollectorRegistry registry
    ) {
        this.config = config;
        this.sessionConfig = sessionConfig;
        this.credentials = credentials;
        this.rest = new RestClient(config, credentials, httpClient);
        this.transportFactory = transportFactory;
        this.sessionName = "rofex-" + config.environment().name().toLowerCase(Locale.ROOT);
        this.metrics = new SessionMetrics(sessionName, registry);
    }

    /**
     * Obtains a token, failing fast on bad credentials.
     *
     * @throws io.trading.rofex.client.error.AuthenticationException if the credentials are rejected
     */
    public Token authenticate() {
        Token token = credentials.getToken();
        LOGGER.info("[{}] Authenticated as {}", config.environment(), config.user());
        return token;
    }

    /**
     * The streaming session of this client, created on first use and again once the previous one closed.
     * The session is not started.
     */
    public synchronized StreamingSession streamingSession() {
        if (session == null || session.state() == SessionState.CLOSED) {
            session = new StreamingSession(
                sessionName,
                config,
                sessionConfig,
                credentials,
                transportFactory,
                JsonMessageCodec.getInstance(),
                metrics
            );
        }
        return session;
    }

    public RestClient rest() {
        return rest;
    }

    public CredentialProvider credentials() {
        return credentials;
    }

    public ClientConfig config() {
        return config;
    }

    public SessionMetrics metrics() {
        return metrics;
    }

    @Override
    public synchronized void close() {
        if (session != null) {
            session.close();
            session = null;
        }
        LOGGER.info("[{}] Client closed", config.environment());
    }

    private static HttpClient newHttpClient(ClientConfig config) {
        return HttpClient.newBuilder()
            .connectTimeout(Duration.ofMillis(config.requestTimeoutMs()))
            .build();
    }
}
