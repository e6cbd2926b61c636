package io.trading.rofex.client.dispatch;

/**
 * Callback for decoded inbound messages of one category.
 *
 * @param <M> Message type
 */
@FunctionalInterface
public interface MessageHandler<M> {

    void onMessage(M message) throws Exception;
}
