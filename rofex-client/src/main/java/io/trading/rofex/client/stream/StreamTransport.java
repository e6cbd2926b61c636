package io.trading.rofex.client.stream;

import java.net.URI;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * A single WebSocket connection. One instance per connection attempt.
 */
public interface StreamTransport extends AutoCloseable {

    /**
     * Connects and performs the WebSocket upgrade.
     *
     * @param uri       Stream endpoint
     * @param headers   Headers added to the upgrade request
     * @param listener  Receives the connection's events
     * @return Completes when the upgrade is accepted. Fails with
     *         {@link io.trading.rofex.client.error.AuthenticationException} when the
     *         server rejects the credentials, or with
     *         {@link io.trading.rofex.client.error.TransportException} otherwise.
     */
    CompletableFuture<Void> open(URI uri, Map<String, String> headers, TransportListener listener);

    /**
     * Writes a text frame.
     *
     * @throws io.trading.rofex.client.error.TransportException if the connection is not open
     */
    void send(String text);

    boolean isOpen();

    /**
     * Releases the connection. Idempotent.
     */
    @Override
    void close();
}
