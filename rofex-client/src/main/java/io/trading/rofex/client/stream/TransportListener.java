package io.trading.rofex.client.stream;

/**
 * Socket events of one connection. Called from the transport's I/O thread,
 * so implementations must not block.
 */
public interface TransportListener {

    /**
     * TCP/TLS connection established, upgrade request sent.
     */
    void onConnected();

    void onFrame(String text);

    /**
     * The connection is gone. Called at most once per connection.
     */
    void onClosed();

    void onError(Throwable cause);
}
