package com.mintstream.recovery;

import com.mintstream.config.RecoveryConfig;
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
import org.springframework.stereotype.Service;

/**
 * Optionally refills the subscription registry at startup.
 *
 * <p>Disabled by default: the registry then starts empty, and tokens onboarded before the
 * restart get neither trade updates nor an unsubscribe. When
 * {@code mintstream.recovery.rebuild-subscriptions=true}, tokens created within the staleness
 * window are registered before the first session opens; the reconnect loop subscribes to
 * all registered tokens as soon as that session is active, and the sweeper retires them as
 * usual.
 */
@Service
public class SubscriptionRecoveryService {

    private static final Logger log = LoggerFactory.getLogger(SubscriptionRecoveryService.class);

    private final RecoveryConfig recoveryConfig;
    private final RetentionConfig retentionConfig;
    private final EventStore eventStore;
    private final SubscriptionRegistry subscriptionRegistry;
    private final FeedChannel feedChannel;
    private final PersistenceErrorReporter persistenceErrorReporter;

    public SubscriptionRecoveryService(
            RecoveryConfig recoveryConfig,
            RetentionConfig retentionConfig,
            EventStore eventStore,
            SubscriptionRegistry subscriptionRegistry,
            FeedChannel feedChannel,
            PersistenceErrorReporter persistenceErrorReporter) {
        this.recoveryConfig = recoveryConfig;
        this.retentionConfig = retentionConfig;
        this.eventStore = eventStore;
        this.subscriptionRegistry = subscriptionRegistry;
        this.feedChannel = feedChannel;
        this.persistenceErrorReporter = persistenceErrorReporter;
    }

    public int rebuild() {
        return rebuild(LocalDateTime.now());
    }

    /**
     * @return number of tokens registered
     */
    public int rebuild(LocalDateTime now) {
        if (!recoveryConfig.isRebuildSubscriptions()) {
            log.info("Subscription rebuild disabled, starting with an empty subscription set");
            return 0;
        }

        LocalDateTime cutoff = now.minus(retentionConfig.getStalenessAge());
        Set<String> liveMints;
        try {
            liveMints = eventStore.findMintsCreatedSince(cutoff);
        } catch (EventStoreException e) {
            persistenceErrorReporter.report("find-live-tokens", null, e);
            return 0;
        }

        int registered = 0;
        for (String mint : liveMints) {
            if (subscriptionRegistry.markSubscribed(mint, feedChannel::subscribeTokenTrade)) {
                registered++;
            }
        }
        log.info("Rebuilt subscription set with {} tokens created since {}", registered, cutoff);
        return registered;
    }
}
