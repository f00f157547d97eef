package com.mintstream.retention;

import com.mintstream.config.RetentionConfig;
import com.mintstream.exception.EventStoreException;
import com.mintstream.feed.FeedChannel;
import com.mintstream.observability.PersistenceErrorReporter;
import com.mintstream.store.EventStore;
import com.mintstream.subscription.SubscriptionRegistry;
import java.time.LocalDateTime;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Tears down trade subscriptions for tokens older than the staleness age.
 *
 * <p>Each sweep snapshots the registry and asks the store which of those mints are stale, so
 * the query is bounded by the number of live subscriptions. The store is read outside the
 * registry lock, then {@link SubscriptionRegistry#markUnsubscribed} sends an unsubscribe and
 * drops each one that is still subscribed. A token is stale when its age is strictly greater than the staleness age.
 * Without a live session nothing is sent and the tokens are retried on the next sweep.
 *
 * <p>Scheduled by {@link com.mintstream.core.StreamOrchestrator} every
 * {@code mintstream.retention.sweep-interval}.
 */
@Component
public class UnsubscribeSweeper {

    private static final Logger log = LoggerFactory.getLogger(UnsubscribeSweeper.class);

    private final EventStore eventStore;
    private final SubscriptionRegistry subscriptionRegistry;
    private final FeedChannel feedChannel;
    private final RetentionConfig retentionConfig;
    private final PersistenceErrorReporter persistenceErrorReporter;

    public UnsubscribeSweeper(
            EventStore eventStore,
            SubscriptionRegistry subscriptionRegistry,
            FeedChannel feedChannel,
            RetentionConfig retentionConfig,
            PersistenceErrorReporter persistenceErrorReporter) {
        this.eventStore = eventStore;
        this.subscriptionRegistry = subscriptionRegistry;
        this.feedChannel = feedChannel;
        this.retentionConfig = retentionConfig;
        this.persistenceErrorReporter = persistenceErrorReporter;
    }

    public void sweep() {
        sweep(LocalDateTime.now());
    }

    /**
     * @param now reference time for the staleness cutoff
     * @return tokens unsubscribed by this sweep
     */
    public Set<String> sweep(LocalDateTime now) {
        Set<String> subscribed = subscriptionRegistry.snapshot();
        if (subscribed.isEmpty()) {
            return Set.of();
        }
        LocalDateTime cutoff = now.minus(retentionConfig.getStalenessAge());

        Set<String> staleMints;
        try {
            staleMints = eventStore.findMintsCreatedBefore(cutoff, subscribed);
        } catch (EventStoreException e) {
            persistenceErrorReporter.report("find-stale-tokens", null, e);
            return Set.of();
        }

        if (staleMints.isEmpty()) {
            return Set.of();
        }
        if (!feedChannel.isActive()) {
            log.debug("Feed session not active, deferring unsubscribe sweep");
            return Set.of();
        }

        Set<String> removed = subscriptionRegistry.markUnsubscribed(staleMints, feedChannel::unsubscribeTokenTrade);
        for (String mint : removed) {
            log.info("Unsubscribed stale token {}", mint);
        }
        if (!removed.isEmpty()) {
            log.info(
                    "Unsubscribe sweep removed {} tokens, {} still subscribed",
                    removed.size(),
                    subscriptionRegistry.size());
        }
        return removed;
    }
}
