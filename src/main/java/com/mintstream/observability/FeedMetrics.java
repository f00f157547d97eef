package com.mintstream.observability;

import com.mintstream.subscription.SubscriptionRegistry;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.stereotype.Service;

/**
 * Micrometer meters for the feed and the store.
 *
 * <ul>
 *   <li><b>feed.messages.received</b> (counter): inbound text frames</li>
 *   <li><b>feed.messages.sent</b> (counter): outbound commands accepted by the session</li>
 *   <li><b>feed.malformed.messages</b> (counter): inbound frames that failed to decode</li>
 *   <li><b>feed.reconnects</b> (counter): backoff cycles entered by the reconnect loop</li>
 *   <li><b>store.persistence.failures</b> (counter, tag {@code operation})</li>
 *   <li><b>store.trades.purged</b> (counter): trades removed by the cleaner</li>
 *   <li><b>feed.subscriptions.active</b> (gauge): size of the subscription registry</li>
 * </ul>
 */
@Service
public class FeedMetrics {

    private final MeterRegistry meterRegistry;
    private final Counter messagesReceivedCounter;
    private final Counter messagesSentCounter;
    private final Counter malformedMessagesCounter;
    private final Counter reconnectsCounter;
    private final Counter tradesPurgedCounter;

    public FeedMetrics(MeterRegistry meterRegistry, SubscriptionRegistry subscriptionRegistry) {
        this.meterRegistry = meterRegistry;

        this.messagesReceivedCounter = Counter.builder("feed.messages.received")
                .description("Inbound messages received from the feed")
                .register(meterRegistry);

        this.messagesSentCounter = Counter.builder("feed.messages.sent")
                .description("Subscribe and unsubscribe commands sent to the feed")
                .register(meterRegistry);

        this.malformedMessagesCounter = Counter.builder("feed.malformed.messages")
                .description("Inbound messages discarded because they could not be decoded")
                .register(meterRegistry);

        this.reconnectsCounter = Counter.builder("feed.reconnects")
                .description("Reconnect backoff cycles")
                .register(meterRegistry);

        this.tradesPurgedCounter = Counter.builder("store.trades.purged")
                .description("Trades removed after the retention window")
                .register(meterRegistry);

        Gauge.builder("feed.subscriptions.active", subscriptionRegistry, SubscriptionRegistry::size)
                .description("Tokens with an outstanding trade subscription")
                .register(meterRegistry);
    }

    public void recordReceived() {
        messagesReceivedCounter.increment();
    }

    public void recordSent() {
        messagesSentCounter.increment();
    }

    public void recordMalformed() {
        malformedMessagesCounter.increment();
    }

    public void recordReconnect() {
        reconnectsCounter.increment();
    }

    public void recordTradesPurged(int count) {
        tradesPurgedCounter.increment(count);
    }

    public void recordPersistenceFailure(String operation) {
        Counter.builder("store.persistence.failures")
                .description("Store operations that failed and were skipped")
                .tag("operation", operation)
                .register(meterRegistry)
                .increment();
    }

    public long getMessagesReceived() {
        return (long) messagesReceivedCounter.count();
    }

    public long getMessagesSent() {
        return (long) messagesSentCounter.count();
    }
}
