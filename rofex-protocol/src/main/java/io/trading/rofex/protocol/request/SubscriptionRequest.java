package io.trading.rofex.protocol.request;

/**
 * A streaming subscription that can be sent, cancelled and replayed after a reconnect.
 */
public interface SubscriptionRequest {

    /**
     * Short description used in logs.
     */
    String describe();
}
