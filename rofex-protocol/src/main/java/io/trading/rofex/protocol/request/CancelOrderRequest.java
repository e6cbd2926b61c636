package io.trading.rofex.protocol.request;

/**
 * Cancellation of an order by client order id.
 *
 * @param clOrdId     Client order id of the order to cancel
 * @param proprietary Proprietary of the order
 */
public record CancelOrderRequest(String clOrdId, String proprietary) {
}
