package com.mintstream.unit.recovery;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.mintstream.config.RecoveryConfig;
import com.mintstream.config.RetentionConfig;
import com.mintstream.exception.EventStoreException;
import com.mintstream.feed.FeedChannel;
import com.mintstream.observability.PersistenceErrorReporter;
import com.mintstream.recovery.SubscriptionRecoveryService;
import com.mintstream.store.EventStore;
import com.mintstream.subscription.SubscriptionRegistry;
import java.time.LocalDateTime;
import java.util.Set;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class SubscriptionRecoveryServiceTest {

    private static final LocalDateTime NOW = LocalDateTime.of(2024, 5, 1, 12, 0);

    @Mock
    private EventStore eventStore;

    @Mock
    private FeedChannel feedChannel;

    @Mock
    private PersistenceErrorReporter persistenceErrorReporter;

    private RecoveryConfig recoveryConfig;
    private SubscriptionRegistry subscriptionRegistry;
    private SubscriptionRecoveryService subscriptionRecoveryService;

    @BeforeEach
    void setUp() {
        recoveryConfig = new RecoveryConfig();
        subscriptionRegistry = new SubscriptionRegistry();
        subscriptionRecoveryService = new SubscriptionRecoveryService(
                recoveryConfig,
                new RetentionConfig(),
                eventStore,
                subscriptionRegistry,
                feedChannel,
                persistenceErrorReporter);
    }

    @Test
    @DisplayName("disabled by default: registry starts empty and the store is not read")
    void disabledByDefault() {
        int registered = subscriptionRecoveryService.rebuild(NOW);

        assertThat(registered).isZero();
        assertThat(subscriptionRegistry.size()).isZero();
        verifyNoInteractions(eventStore, feedChannel);
    }

    @Test
    @DisplayName("enabled: registers tokens created within the staleness window")
    void registersLiveTokens() {
        recoveryConfig.setRebuildSubscriptions(true);
        when(eventStore.findMintsCreatedSince(LocalDateTime.of(2024, 5, 1, 11, 0)))
                .thenReturn(Set.of("MintA", "MintB"));
        when(feedChannel.subscribeTokenTrade(anyList())).thenReturn(false);

        int registered = subscriptionRecoveryService.rebuild(NOW);

        assertThat(registered).isEqualTo(2);
        assertThat(subscriptionRegistry.snapshot()).containsExactlyInAnyOrder("MintA", "MintB");
    }

    @Test
    @DisplayName("enabled: store failure is reported and the registry stays empty")
    void storeFailureReported() {
        recoveryConfig.setRebuildSubscriptions(true);
        EventStoreException failure = new EventStoreException("query failed", new RuntimeException("db down"));
        when(eventStore.findMintsCreatedSince(any(LocalDateTime.class))).thenThrow(failure);

        int registered = subscriptionRecoveryService.rebuild(NOW);

        assertThat(registered).isZero();
        assertThat(subscriptionRegistry.size()).isZero();
        verify(persistenceErrorReporter).report("find-live-tokens", null, failure);
    }
}
