package io.trading.rofex.protocol.codec;

import io.trading.rofex.protocol.message.InboundMessage;
import io.trading.rofex.protocol.request.CancelOrderRequest;
import io.trading.rofex.protocol.request.LoginRequest;
import io.trading.rofex.protocol.request.NewOrderRequest;
import io.trading.rofex.protocol.request.SubscriptionRequest;

import java.util.Map;

/**
 * Translates between streaming frames and typed messages.
 * Implementations must be thread-safe.
 */
public interface MessageCodec {

    /**
     * Encodes the streaming handshake. The token travels in the upgrade request headers.
     *
     * @param request The login request
     * @return Headers to add to the WebSocket upgrade request
     * @throws io.trading.rofex.protocol.error.ValidationException if the token is blank
     */
    Map<String, String> encodeLogin(LoginRequest request);

    /**
     * Encodes a subscription frame.
     *
     * @param request The subscription to send
     * @return The text frame
     * @throws io.trading.rofex.protocol.error.ValidationException if the request is malformed
     */
    String encode(SubscriptionRequest request);

    /**
     * Encodes the cancellation of a subscription.
     *
     * @param request The subscription to cancel
     * @return The text frame
     * @throws io.trading.rofex.protocol.error.ValidationException if the request is malformed
     */
    String encodeCancel(SubscriptionRequest request);

    /**
     * Encodes a new order routed through the stream.
     *
     * @throws io.trading.rofex.protocol.error.ValidationException if the order is malformed
     */
    String encode(NewOrderRequest request);

    /**
     * Encodes an order cancellation routed through the stream.
     *
     * @throws io.trading.rofex.protocol.error.ValidationException if the request is malformed
     */
    String encode(CancelOrderRequest request);

    /**
     * Decodes an inbound frame. Never throws: frames that cannot be classified
     * are returned as {@link io.trading.rofex.protocol.message.ErrorMessage}.
     *
     * @param frame The raw text frame
     * @return The decoded message
     */
    InboundMessage decode(String frame);
}
