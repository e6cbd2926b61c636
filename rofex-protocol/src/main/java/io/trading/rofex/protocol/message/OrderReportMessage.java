package io.trading.rofex.protocol.message;

import io.trading.rofex.protocol.model.InstrumentId;
import io.trading.rofex.protocol.model.OrderStatus;
import io.trading.rofex.protocol.model.OrderType;
import io.trading.rofex.protocol.model.Side;
import io.trading.rofex.protocol.model.TimeInForce;

import java.math.BigDecimal;

/**
 * Execution report for an order: a status change or a fill.
 *
 * @param orderId      Exchange order id
 * @param clOrdId      Client order id
 * @param proprietary  Proprietary of the order
 * @param execId       Execution id
 * @param accountId    Account the order belongs to
 * @param instrument   Instrument of the order
 * @param price        Limit price (null for market orders)
 * @param orderQty     Ordered quantity
 * @param orderType    Order type (null when not reported)
 * @param side         Order side
 * @param timeInForce  Time in force (null when not reported)
 * @param transactTime Transaction time as sent by the gateway
 * @param avgPx        Average fill price
 * @param lastPx       Price of the last fill
 * @param lastQty      Quantity of the last fill
 * @param cumQty       Cumulative filled quantity
 * @param leavesQty    Quantity still open
 * @param status       Order status
 * @param text         Free text from the gateway
 * @param raw          The frame as received
 */
public record OrderReportMessage(
    String orderId,
    String clOrdId,
    String proprietary,
    String execId,
    String accountId,
    InstrumentId instrument,
    BigDecimal price,
    BigDecimal orderQty,
    OrderType orderType,
    Side side,
    TimeInForce timeInForce,
    String transactTime,
    BigDecimal avgPx,
    BigDecimal lastPx,
    BigDecimal lastQty,
    BigDecimal cumQty,
    BigDecimal leavesQty,
    OrderStatus status,
    String text,
    String raw
) implements InboundMessage {
    public OrderReportMessage {
        if (clOrdId == null && orderId == null) {
            throw new IllegalArgumentException("orderId and clOrdId cannot both be null");
        }
        if (status == null) {
            status = OrderStatus.UNKNOWN;
        }
        if (side == null) {
            side = Side.UNKNOWN;
        }
    }

    @Override
    public MessageCategory category() {
        return MessageCategory.ORDER_REPORT;
    }

    /**
     * Whether this report carries a fill.
     */
    public boolean isFill() {
        return lastQty != null && lastQty.signum() > 0;
    }
}
