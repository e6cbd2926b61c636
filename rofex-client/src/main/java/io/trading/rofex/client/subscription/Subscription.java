package io.trading.rofex.client.subscription;

import io.trading.rofex.protocol.request.SubscriptionRequest;

import java.time.Instant;

/**
 * A retained subscription.
 *
 * @param id      Id unique within the session
 * @param request What was subscribed
 * @param created When it was recorded
 */
public record Subscription(long id, SubscriptionRequest request, Instant created) {
}
