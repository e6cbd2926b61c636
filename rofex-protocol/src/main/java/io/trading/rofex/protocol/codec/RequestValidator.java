package io.trading.rofex.protocol.codec;

import io.trading.rofex.protocol.error.ValidationException;
import io.trading.rofex.protocol.model.MarketDataEntry;
import io.trading.rofex.protocol.model.OrderType;
import io.trading.rofex.protocol.model.Side;
import io.trading.rofex.protocol.model.TimeInForce;
import io.trading.rofex.protocol.request.CancelOrderRequest;
import io.trading.rofex.protocol.request.LoginRequest;
import io.trading.rofex.protocol.request.MarketDataSubscription;
import io.trading.rofex.protocol.request.NewOrderRequest;
import io.trading.rofex.protocol.request.OrderReportSubscription;
import io.trading.rofex.protocol.request.SubscriptionRequest;

/**
 * Checks outbound requests before they are encoded.
 * Every method throws {@link ValidationException} on the first problem found.
 */
public final class RequestValidator {

    private RequestValidator() {
    }

    public static void validate(LoginRequest request) {
        if (request == null || isBlank(request.token())) {
            throw new ValidationException("Login requires a non-blank token");
        }
    }

    public static void validate(SubscriptionRequest request) {
        if (request instanceof MarketDataSubscription marketData) {
            validate(marketData);
        } else if (request instanceof OrderReportSubscription orderReport) {
            validate(orderReport);
        } else {
            throw new ValidationException("Unsupported subscription request: " + request);
        }
    }

    public static void validate(MarketDataSubscription request) {
        if (request.tickers().isEmpty()) {
            throw new ValidationException("Market data subscription requires at least one ticker");
        }
        for (String ticker : request.tickers()) {
            if (isBlank(ticker)) {
                throw new ValidationException("Invalid ticker in subscription: '" + ticker + "'");
            }
        }
        if (request.entries().isEmpty()) {
            throw new ValidationException("Market data subscription requires at least one entry");
        }
        for (MarketDataEntry entry : request.entries()) {
            if (entry == null) {
                throw new ValidationException("Invalid Market Data Entry: null");
            }
        }
        if (request.market() == null) {
            throw new ValidationException("Market data subscription requires a market");
        }
        if (request.depth() < 1) {
            throw new ValidationException("Depth must be at least 1, was " + request.depth());
        }
    }

    public static void validate(OrderReportSubscription request) {
        if (isBlank(request.account())) {
            throw new ValidationException("Account not specified.");
        }
    }

    public static void validate(NewOrderRequest request) {
        if (request == null) {
            throw new ValidationException("Order cannot be null");
        }
        if (isBlank(request.ticker())) {
            throw new ValidationException("Order requires a ticker");
        }
        if (request.market() == null) {
            throw new ValidationException("Order requires a market");
        }
        if (request.side() == null || request.side() == Side.UNKNOWN) {
            throw new ValidationException("Order requires a side");
        }
        if (request.size() == null || request.size().signum() <= 0) {
            throw new ValidationException("Order size must be positive");
        }
        if (request.orderType() == null) {
            throw new ValidationException("Order requires an order type");
        }
        if (request.orderType() == OrderType.LIMIT && request.price() == null) {
            throw new ValidationException("Limit order requires a price");
        }
        if (request.timeInForce() == null) {
            throw new ValidationException("Order requires a time in force");
        }
        if (request.timeInForce() == TimeInForce.GOOD_TILL_DATE && isBlank(request.expireDate())) {
            throw new ValidationException("Good till date order requires an expire date");
        }
        if (request.iceberg() && (request.displayQuantity() == null || request.displayQuantity().signum() <= 0)) {
            throw new ValidationException("Iceberg order requires a positive display quantity");
        }
        if (isBlank(request.account())) {
            throw new ValidationException("Account not specified.");
        }
    }

    public static void validate(CancelOrderRequest request) {
        if (request == null || isBlank(request.clOrdId())) {
            throw new ValidationException("Cancel requires a client order id");
        }
        if (isBlank(request.proprietary())) {
            throw new ValidationException("Cancel requires a proprietary");
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
