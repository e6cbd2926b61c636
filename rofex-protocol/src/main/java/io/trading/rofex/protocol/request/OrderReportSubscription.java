package io.trading.rofex.protocol.request;

/**
 * Order report subscription for an account.
 *
 * @param account            Account id
 * @param snapshotOnlyActive true to receive reports of active orders only on subscription
 */
public record OrderReportSubscription(String account, boolean snapshotOnlyActive) implements SubscriptionRequest {

    public static OrderReportSubscription of(String account) {
        return new OrderReportSubscription(account, true);
    }

    @Override
    public String describe() {
        return "order reports account=" + account;
    }
}
