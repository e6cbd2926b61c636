package io.trading.rofex.client;

import io.prometheus.client.CollectorRegistry;
import io.trading.rofex.client.auth.CredentialProvider;
import io.trading.rofex.client.auth.Token;
import io.trading.rofex.client.config.ClientConfig;
import io.trading.rofex.client.config.Environment;
import io.trading.rofex.client.config.SessionConfig;
import io.trading.rofex.client.error.AuthenticationException;
import io.trading.rofex.client.stream.SessionState;
import io.trading.rofex.client.stream.StreamingSession;
import io.trading.rofex.client.support.FakeCredentialProvider;
import io.trading.rofex.client.support.FakeTransportFactory;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.net.http.HttpClient;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Function;

import static org.junit.jupiter.api.Assertions.*;

class RofexContextTest {

    private final List<RofexClient> created = new CopyOnWriteArrayList<>();
    private volatile boolean rejectCredentials = false;
    private RofexContext context;

    @BeforeEach
    void setUp() {
        Function<ClientConfig, RofexClient> factory = config -> {
            CredentialProvider credentials = rejectCredentials
                ? new RejectingCredentialProvider()
                : new FakeCredentialProvider("token-1");
            RofexClient client = new RofexClient(config, SessionConfig.defaults(), credentials,
                HttpClient.newHttpClient(), new FakeTransportFactory("token-1"), new CollectorRegistry());
            created.add(client);
            return client;
        };
        context = new RofexContext(factory);
    }

    @AfterEach
    void tearDown() {
        context.close();
    }

    @Test
    void testInitializeMakesEnvironmentDefault() {
        RofexClient client = context.initialize("user", "password", "REM123", Environment.REMARKET);

        assertSame(client, context.client());
        assertSame(client, context.client(Environment.REMARKET));
        assertEquals(Environment.REMARKET, context.getDefaultEnvironment());
        assertEquals("REM123", client.config().account());
    }

    @Test
    void testNotInitialized() {
        assertThrows(IllegalStateException.class, () -> context.client());
        assertThrows(IllegalStateException.class, () -> context.client(Environment.LIVE));
        assertThrows(IllegalStateException.class, () -> context.setDefaultEnvironment(Environment.LIVE));
    }

    @Test
    void testSwitchDefaultEnvironment() {
        RofexClient remarket = context.initialize("user", "password", null, Environment.REMARKET);
        RofexClient live = context.initialize("user", "password", null, Environment.LIVE);

        assertSame(live, context.client());

        context.setDefaultEnvironment(Environment.REMARKET);

        assertSame(remarket, context.client());
        assertSame(live, context.client(Environment.LIVE));
    }

    @Test
    void testRejectedCredentialsLeaveContextUnchanged() {
        RofexClient remarket = context.initialize("user", "password", null, Environment.REMARKET);
        rejectCredentials = true;

        AuthenticationException e = assertThrows(AuthenticationException.class,
            () -> context.initialize("user", "wrong", null, Environment.LIVE));

        assertEquals(401, e.getStatusCode());
        assertSame(remarket, context.client());
        assertThrows(IllegalStateException.class, () -> context.client(Environment.LIVE));
    }

    @Test
    void testReinitializeClosesPreviousClient() {
        RofexClient first = context.initialize("user", "password", null, Environment.REMARKET);
        StreamingSession session = first.streamingSession();

        RofexClient second = context.initialize("user", "password", "REM456", Environment.REMARKET);

        assertNotSame(first, second);
        assertEquals(SessionState.CLOSED, session.state());
        assertSame(second, context.client());
    }

    @Test
    void testStreamingSessionReusedUntilClosed() {
        RofexClient client = context.initialize("user", "password", null, Environment.REMARKET);

        StreamingSession session = client.streamingSession();
        assertSame(session, client.streamingSession());
        assertEquals("rofex-remarket", session.name());

        session.close();

        assertNotSame(session, client.streamingSession());
    }

    @Test
    void testCloseClearsContext() {
        context.initialize("user", "password", null, Environment.REMARKET);

        context.close();

        assertNull(context.getDefaultEnvironment());
        assertThrows(IllegalStateException.class, () -> context.client());
    }

    private static class RejectingCredentialProvider implements CredentialProvider {
        @Override
        public Token getToken() {
            throw new AuthenticationException("Authentication fails. Incorrect User or Password", 401);
        }

        @Override
        public Token refresh() {
            return getToken();
        }
    }
}
