package io.trading.rofex.client.subscription;

/**
 * Where subscription frames go once encoded. Implemented by the streaming session.
 */
public interface OutboundChannel {

    /**
     * Whether frames enqueued now will be written on the current connection.
     */
    boolean isActive();

    /**
     * Queues a frame for the current connection. A frame that cannot be written
     * because the connection is lost is dropped; activation replays the subscriptions.
     */
    void enqueue(String frame);
}
