package io.trading.rofex.client;

import io.trading.rofex.client.config.ClientConfig;
import io.trading.rofex.client.config.Environment;
import io.trading.rofex.protocol.error.RofexException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * Holds the initialized client of each environment and which one is the default.
 *
 * <pre>
 * RofexContext context = new RofexContext();
 * context.initialize(user, password, account, Environment.REMARKET);
 * StreamingSession session = context.client().streamingSession();
 * </pre>
 */
public class RofexContext implements AutoCloseable {

    private static final Logger LOGGER = LoggerFactory.getLogger(RofexContext.class);

    private final Function<ClientConfig, RofexClient> clientFactory;
    private final Map<Environment, RofexClient> clients = new EnumMap<>(Environment.class);
    private Environment defaultEnvironment;

    public RofexContext() {
        this(RofexClient::new);
    }

    RofexContext(Function<ClientConfig, RofexClient> clientFactory) {
        this.clientFactory = clientFactory;
    }

    /**
     * Authenticates against the environment and makes it the default.
     * A client previously initialized for the same environment is closed and replaced.
     *
     * @param account Default account of REST and streaming calls, may be null
     * @throws io.trading.rofex.client.error.AuthenticationException if the credentials are rejected
     */
    public RofexClient initialize(String user, String password, String account, Environment environment) {
        return initialize(ClientConfig.builder(environment)
            .user(user)
            .password(password)
            .account(account)
            .build());
    }

    public RofexClient initialize(ClientConfig config) {
        RofexClient client = clientFactory.apply(config);
        try {
            client.authenticate();
        } catch (RofexException e) {
            client.close();
            throw e;
        }

        RofexClient previous;
        synchronized (this) {
            previous = clients.put(config.environment(), client);
            defaultEnvironment = config.environment();
        }
        if (previous != null) {
            previous.close();
        }
        LOGGER.info("Initialized {} environment", config.environment());
        return client;
    }

    /**
     * The client of the default environment.
     *
     * @throws IllegalStateException if no environment was initialized
     */
    public synchronized RofexClient client() {
        if (defaultEnvironment == null) {
            throw new IllegalStateException("No environment initialized");
        }
        return clients.get(defaultEnvironment);
    }

    /**
     * @throws IllegalStateException if the environment was not initialized
     */
    public synchronized RofexClient client(Environment environment) {
        RofexClient client = clients.get(environment);
        if (client == null) {
            throw new IllegalStateException("Environment " + environment + " not initialized");
        }
        return client;
    }

    /**
     * @throws IllegalStateException if the environment was not initialized
     */
    public synchronized void setDefaultEnvironment(Environment environment) {
        if (!clients.containsKey(environment)) {
            throw new IllegalStateException("Environment " + environment + " not initialized");
        }
        defaultEnvironment = environment;
    }

    public synchronized Environment getDefaultEnvironment() {
        return defaultEnvironment;
    }

    @Override
    public void close() {
        List<RofexClient> toClose;
        synchronized (this) {
            toClose = new ArrayList<>(clients.values());
            clients.clear();
            defaultEnvironment = null;
        }
        for (RofexClient client : toClose) {
            client.close();
        }
    }
}
