package io.trading.rofex.protocol.request;

import io.trading.rofex.protocol.model.Market;
import io.trading.rofex.protocol.model.OrderType;
import io.trading.rofex.protocol.model.Side;
import io.trading.rofex.protocol.model.TimeInForce;

import java.math.BigDecimal;

/**
 * A new single order, sent either through REST or through the streaming session.
 *
 * @param ticker          Instrument symbol
 * @param market          Market of the instrument
 * @param side            Order side
 * @param size            Order quantity
 * @param orderType       Order type
 * @param price           Limit price, required for LIMIT orders
 * @param timeInForce     Time in force
 * @param expireDate      Expire date (yyyyMMdd), required for GOOD_TILL_DATE
 * @param account         Account; null means the client's default account
 * @param cancelPrevious  Cancel previous orders of the same side and instrument
 * @param iceberg         Whether the order is an iceberg
 * @param displayQuantity Displayed quantity of an iceberg order
 * @param wsClOrdId       Optional correlation id echoed in streaming order reports
 */
public record NewOrderRequest(
    String ticker,
    Market market,
    Side side,
    BigDecimal size,
    OrderType orderType,
    BigDecimal price,
    TimeInForce timeInForce,
    String expireDate,
    String account,
    boolean cancelPrevious,
    boolean iceberg,
    BigDecimal displayQuantity,
    String wsClOrdId
) {

    /**
     * Copy of this request with the account filled in.
     */
    public NewOrderRequest withAccount(String account) {
        return new NewOrderRequest(ticker, market, side, size, orderType, price, timeInForce, expireDate,
            account, cancelPrevious, iceberg, displayQuantity, wsClOrdId);
    }

    /**
     * Creates a new builder for NewOrderRequest.
     */
    public static Builder builder() {
        return new Builder();
    }

    /**
     * Builder for NewOrderRequest.
     */
    public static class Builder {
        private String ticker;
        private Market market = Market.ROFEX;
        private Side side;
        private BigDecimal size;
        private OrderType orderType = OrderType.LIMIT;
        private BigDecimal price;
        private TimeInForce timeInForce = TimeInForce.DAY;
        private String expireDate;
        private String account;
        private boolean cancelPrevious;
        private boolean iceberg;
        private BigDecimal displayQuantity;
        private String wsClOrdId;

        public Builder ticker(String ticker) {
            this.ticker = ticker;
            return this;
        }

        public Builder market(Market market) {
            this.market = market;
            return this;
        }

        public Builder side(Side side) {
            this.side = side;
            return this;
        }

        public Builder size(long size) {
            this.size = BigDecimal.valueOf(size);
            return this;
        }

        public Builder size(BigDecimal size) {
            this.size = size;
            return this;
        }

        public Builder orderType(OrderType orderType) {
            this.orderType = orderType;
            return this;
        }

        public Builder price(BigDecimal price) {
            this.price = price;
            return this;
        }

        public Builder price(String price) {
            this.price = new BigDecimal(price);
            return this;
        }

        public Builder timeInForce(TimeInForce timeInForce) {
            this.timeInForce = timeInForce;
            return this;
        }

        public Builder expireDate(String expireDate) {
            this.expireDate = expireDate;
            return this;
        }

        public Builder account(String account) {
            this.account = account;
            return this;
        }

        public Builder cancelPrevious(boolean cancelPrevious) {
            this.cancelPrevious = cancelPrevious;
            return this;
        }

        public Builder iceberg(BigDecimal displayQuantity) {
            this.iceberg = true;
            this.displayQuantity = displayQuantity;
            return this;
        }

        public Builder wsClOrdId(String wsClOrdId) {
            this.wsClOrdId = wsClOrdId;
            return this;
        }

        public NewOrderRequest build() {
            return new NewOrderRequest(ticker, market, side, size, orderType, price, timeInForce, expireDate,
                account, cancelPrevious, iceberg, displayQuantity, wsClOrdId);
        }
    }
}
