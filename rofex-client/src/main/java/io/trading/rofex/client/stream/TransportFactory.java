package io.trading.rofex.client.stream;

import io.trading.rofex.client.config.SessionConfig;

/**
 * Creates a transport for each connection attempt.
 */
@FunctionalInterface
public interface TransportFactory {

    StreamTransport create(String name, SessionConfig config);
}
