package io.trading.rofex.client.subscription;

import io.trading.rofex.protocol.codec.MessageCodec;
import io.trading.rofex.protocol.error.ValidationException;
import io.trading.rofex.protocol.model.Market;
import io.trading.rofex.protocol.model.MarketDataEntry;
import io.trading.rofex.protocol.request.MarketDataSubscription;
import io.trading.rofex.protocol.request.OrderReportSubscription;
import io.trading.rofex.protocol.request.SubscriptionRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.BooleanSupplier;
import java.util.function.IntConsumer;

/**
 * Retains the subscriptions of a session and replays them when the session (re)activates.
 *
 * Recording a subscription and activating the session are serialized on one lock, so a
 * subscription made while the session activates is either part of the replay or sent
 * on its own, never both.
 */
public class SubscriptionManager {

    private static final Logger LOGGER = LoggerFactory.getLogger(SubscriptionManager.class);

    private final String name;
    private final MessageCodec codec;
    private final OutboundChannel channel;
    private final String defaultAccount;
    private final Clock clock;

    private final Object lock = new Object();
    private final Map<Long, Subscription> subscriptions = new LinkedHashMap<>();
    private long nextId = 1;
    private IntConsumer sizeListener = size -> { };

    public SubscriptionManager(String name, MessageCodec codec, OutboundChannel channel, String defaultAccount) {
        this(name, codec, channel, defaultAccount, Clock.systemUTC());
    }

    SubscriptionManager(String name, MessageCodec codec, OutboundChannel channel, String defaultAccount, Clock clock) {
        this.name = name;
        this.codec = codec;
        this.channel = channel;
        this.defaultAccount = defaultAccount;
        this.clock = clock;
    }

    /**
     * Records a subscription and sends it if the session is active; otherwise it is
     * sent on the next activation.
     *
     * @throws ValidationException if the request is malformed; nothing is recorded
     */
    public Subscription subscribe(SubscriptionRequest request) {
        String frame = codec.encode(request);

        Subscription subscription;
        synchronized (lock) {
            subscription = new Subscription(nextId++, request, clock.instant());
            subscriptions.put(subscription.id(), subscription);
            if (channel.isActive()) {
                channel.enqueue(frame);
                LOGGER.info("[{}] Subscribed #{}: {}", name, subscription.id(), request.describe());
            } else {
                LOGGER.info("[{}] Subscription #{} deferred until active: {}",
                    name, subscription.id(), request.describe());
            }
            sizeListener.accept(subscriptions.size());
        }
        return subscription;
    }

    public Subscription subscribeMarketData(Collection<String> tickers, Collection<MarketDataEntry> entries) {
        return subscribe(MarketDataSubscription.of(tickers, entries));
    }

    public Subscription subscribeMarketData(Collection<String> tickers, Collection<MarketDataEntry> entries,
                                            int depth, Market market) {
        return subscribe(new MarketDataSubscription(
            tickers == null ? null : new ArrayList<>(tickers),
            entries == null ? null : new ArrayList<>(entries),
            market,
            depth));
    }

    /**
     * Order reports of the default account.
     */
    public Subscription subscribeOrderReports() {
        return subscribeOrderReports(null, true);
    }

    /**
     * @param account            Account id; null means the default account
     * @param snapshotOnlyActive true to receive only active orders in the initial snapshot
     */
    public Subscription subscribeOrderReports(String account, boolean snapshotOnlyActive) {
        String resolved = account != null ? account : defaultAccount;
        return subscribe(new OrderReportSubscription(resolved, snapshotOnlyActive));
    }

    /**
     * Removes a subscription and sends its cancellation if the session is active.
     *
     * @return false if no subscription has that id
     */
    public boolean unsubscribe(long id) {
        synchronized (lock) {
            Subscription removed = subscriptions.remove(id);
            if (removed == null) {
                return false;
            }
            if (channel.isActive()) {
                channel.enqueue(codec.encodeCancel(removed.request()));
            }
            LOGGER.info("[{}] Unsubscribed #{}: {}", name, id, removed.request().describe());
            sizeListener.accept(subscriptions.size());
            return true;
        }
    }

    /**
     * Flips the session to active and returns what must be re-sent, in creation order.
     *
     * @param markActive Performs the state change; returns false if the session can no longer activate
     * @return Retained subscriptions, or an empty list if the session did not activate
     */
    public List<Subscription> replayOnActivation(BooleanSupplier markActive) {
        synchronized (lock) {
            if (!markActive.getAsBoolean()) {
                return List.of();
            }
            return new ArrayList<>(subscriptions.values());
        }
    }

    public List<Subscription> list() {
        synchronized (lock) {
            return new ArrayList<>(subscriptions.values());
        }
    }

    public int size() {
        synchronized (lock) {
            return subscriptions.size();
        }
    }

    public void clear() {
        synchronized (lock) {
            subscriptions.clear();
            sizeListener.accept(0);
        }
    }

    /**
     * Notified with the number of retained subscriptions whenever it changes.
     */
    public void setSizeListener(IntConsumer sizeListener) {
        synchronized (lock) {
            this.sizeListener = sizeListener;
        }
    }
}
