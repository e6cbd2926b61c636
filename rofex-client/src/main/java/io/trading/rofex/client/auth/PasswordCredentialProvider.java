package io.trading.rofex.client.auth;

import io.trading.rofex.client.config.ClientConfig;
import io.trading.rofex.client.error.AuthenticationException;
import io.trading.rofex.client.error.TransportException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Authenticates with user and password against {@code auth/getToken}.
 * The token is read from the X-Auth-Token response header and cached until it expires.
 */
public class PasswordCredentialProvider implements CredentialProvider {

    private static final Logger LOGGER = LoggerFactory.getLogger(PasswordCredentialProvider.class);

    static final String AUTH_PATH = "auth/getToken";
    static final String USER_HEADER = "X-Username";
    static final String PASSWORD_HEADER = "X-Password";
    static final String TOKEN_HEADER = "X-Auth-Token";

    private final ClientConfig config;
    private final HttpClient httpClient;
    private final Clock clock;

    private Token token;

    public PasswordCredentialProvider(ClientConfig config, HttpClient httpClient) {
        this(config, httpClient, Clock.systemUTC());
    }

    public PasswordCredentialProvider(ClientConfig config, HttpClient httpClient, Clock clock) {
        this.config = config;
        this.httpClient = httpClient;
        this.clock = clock;
    }

    @Override
    public synchronized Token getToken() {
        if (token == null || token.isExpired(clock.instant())) {
            token = authenticate();
        }
        return token;
    }

    @Override
    public synchronized Token refresh() {
        LOGGER.info("[{}] Refreshing token", config.environment());
        token = authenticate();
        return token;
    }

    private Token authenticate() {
        HttpRequest request = HttpRequest.newBuilder(config.resolve(AUTH_PATH))
            .timeout(Duration.ofMillis(config.requestTimeoutMs()))
            .header(USER_HEADER, config.user())
            .header(PASSWORD_HEADER, config.password())
            .POST(HttpRequest.BodyPublishers.noBody())
            .build();

        HttpResponse<Void> response;
        try {
            response = httpClient.send(request, HttpResponse.BodyHandlers.discarding());
        } catch (IOException e) {
            throw new TransportException("Authentication request failed: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TransportException("Interrupted while authenticating", e);
        }

        int status = response.statusCode();
        if (status < 200 || status >= 300) {
            LOGGER.warn("[{}] Authentication rejected for user {} (status {})", config.environment(), config.user(), status);
            throw new AuthenticationException("Authentication fails. Incorrect User or Password", status);
        }

        String value = response.headers().firstValue(TOKEN_HEADER)
            .orElseThrow(() -> new AuthenticationException("Authentication response without " + TOKEN_HEADER, status));

        Instant now = clock.instant();
        Token issued = new Token(value, now, now.plusMillis(config.tokenTtlMs()));
        LOGGER.info("[{}] Authenticated user {}, token valid until {}", config.environment(), config.user(), issued.expiresAt());
        return issued;
    }
}
