package io.trading.rofex.client.auth;

import io.trading.rofex.client.config.ClientConfig;
import io.trading.rofex.client.config.Environment;
import io.trading.rofex.client.error.AuthenticationException;
import io.trading.rofex.client.error.TransportException;
import io.trading.rofex.client.support.MutableClock;
import io.trading.rofex.client.support.StubGateway;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.net.http.HttpClient;
import java.time.Duration;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class PasswordCredentialProviderTest {

    private static final Instant NOW = Instant.parse("2019-11-22T13:30:00Z");

    private StubGateway gateway;
    private MutableClock clock;

    @BeforeEach
    void setUp() throws Exception {
        gateway = new StubGateway();
        clock = new MutableClock(NOW);
    }

    @AfterEach
    void tearDown() {
        gateway.close();
    }

    private PasswordCredentialProvider provider(String password) {
        ClientConfig config = ClientConfig.builder(Environment.REMARKET)
            .restUri(gateway.baseUri())
            .user(StubGateway.USER)
            .password(password)
            .tokenTtlMs(Duration.ofHours(24).toMillis())
            .requestTimeoutMs(2000)
            .build();
        return new PasswordCredentialProvider(config, HttpClient.newHttpClient(), clock);
    }

    @Test
    void testGetTokenAuthenticates() {
        Token token = provider(StubGateway.PASSWORD).getToken();

        assertEquals("token-1", token.value());
        assertEquals(NOW, token.issuedAt());
        assertEquals(NOW.plus(Duration.ofHours(24)), token.expiresAt());
        assertFalse(token.toString().contains("token-1"));
    }

    @Test
    void testTokenCachedUntilExpiry() {
        PasswordCredentialProvider provider = provider(StubGateway.PASSWORD);

        provider.getToken();
        clock.advance(Duration.ofHours(23));
        assertEquals("token-1", provider.getToken().value());
        assertEquals(1, gateway.getTokensIssued());

        clock.advance(Duration.ofHours(1));
        assertEquals("token-2", provider.getToken().value());
    }

    @Test
    void testRefreshAlwaysAuthenticates() {
        PasswordCredentialProvider provider = provider(StubGateway.PASSWORD);
        provider.getToken();

        assertEquals("token-2", provider.refresh().value());
        assertEquals("token-2", provider.getToken().value());
    }

    @Test
    void testWrongPasswordThrowsAuthenticationException() {
        AuthenticationException e = assertThrows(AuthenticationException.class,
            () -> provider("wrong").getToken());

        assertEquals("Authentication fails. Incorrect User or Password", e.getMessage());
        assertEquals(401, e.getStatusCode());
    }

    @Test
    void testMissingTokenHeaderThrowsAuthenticationException() {
        gateway.setOmitTokenHeader(true);

        assertThrows(AuthenticationException.class, () -> provider(StubGateway.PASSWORD).getToken());
    }

    @Test
    void testUnreachableEndpointThrowsTransportException() {
        PasswordCredentialProvider provider = provider(StubGateway.PASSWORD);
        gateway.close();

        assertThrows(TransportException.class, provider::getToken);
    }
}
