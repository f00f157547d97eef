package com.mintstream.service;

import com.mintstream.domain.model.TokenCreation;
import com.mintstream.exception.EventStoreException;
import com.mintstream.feed.FeedChannel;
import com.mintstream.observability.PersistenceErrorReporter;
import com.mintstream.store.EventStore;
import com.mintstream.subscription.SubscriptionRegistry;
import java.time.LocalDateTime;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Onboards newly created tokens: registers the token, stores its creation record and
 * subscribes to its trades.
 *
 * <p>Idempotent per mint. The three steps run in order under the registry lock (add to the
 * set, store, send the subscribe), so a concurrent sweep cannot interleave. A failed store
 * is reported and onboarding still completes. Such a token has no row, so the sweeper
 * never finds it stale.
 */
@Service
public class TokenOnboardingService {

    private static final Logger log = LoggerFactory.getLogger(TokenOnboardingService.class);

    private final SubscriptionRegistry subscriptionRegistry;
    private final EventStore eventStore;
    private final FeedChannel feedChannel;
    private final PersistenceErrorReporter persistenceErrorReporter;

    public TokenOnboardingService(
            SubscriptionRegistry subscriptionRegistry,
            EventStore eventStore,
            FeedChannel feedChannel,
            PersistenceErrorReporter persistenceErrorReporter) {
        this.subscriptionRegistry = subscriptionRegistry;
        this.eventStore = eventStore;
        this.feedChannel = feedChannel;
        this.persistenceErrorReporter = persistenceErrorReporter;
    }

    /**
     * @return true if the token was onboarded now, false if it was already tracked or has no mint
     */
    public boolean handleNewToken(TokenCreation creation) {
        String mint = creation.getMint();
        if (mint == null || mint.isBlank()) {
            log.warn("Token creation without mint ignored (signature={})", creation.getSignature());
            return false;
        }

        boolean onboarded = subscriptionRegistry.markSubscribed(mint, mints -> {
            storeCreation(creation);
            return feedChannel.subscribeTokenTrade(mints);
        });

        if (onboarded) {
            log.info(
                    "New token subscribed: {} ({}), tracking {} tokens",
                    mint,
                    creation.getSymbol(),
                    subscriptionRegistry.size());
        } else {
            log.debug("Token {} already subscribed", mint);
        }
        return onboarded;
    }

    private void storeCreation(TokenCreation creation) {
        if (creation.getCreatedAt() == null) {
            creation.setCreatedAt(LocalDateTime.now());
        }
        try {
            if (eventStore.insertIfAbsent(creation)) {
                log.debug("Token saved: {}", creation.getMint());
            }
        } catch (EventStoreException e) {
            persistenceErrorReporter.report("insert-token", creation.getMint(), e);
        }
    }
}
