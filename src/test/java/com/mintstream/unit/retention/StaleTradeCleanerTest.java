package com.mintstream.unit.retention;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.mintstream.config.RetentionConfig;
import com.mintstream.exception.EventStoreException;
import com.mintstream.observability.FeedMetrics;
import com.mintstream.observability.PersistenceErrorReporter;
import com.mintstream.retention.StaleTradeCleaner;
import com.mintstream.store.EventStore;
import com.mintstream.subscription.SubscriptionRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Duration;
import java.time.LocalDateTime;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class StaleTradeCleanerTest {

    private static final LocalDateTime NOW = LocalDateTime.of(2024, 5, 1, 12, 0);

    @Mock
    private EventStore eventStore;

    @Mock
    private PersistenceErrorReporter persistenceErrorReporter;

    private SimpleMeterRegistry meterRegistry;
    private RetentionConfig retentionConfig;
    private StaleTradeCleaner staleTradeCleaner;

    @BeforeEach
    void setUp() {
        meterRegistry = new SimpleMeterRegistry();
        retentionConfig = new RetentionConfig();
        FeedMetrics feedMetrics = new FeedMetrics(meterRegistry, new SubscriptionRegistry());
        staleTradeCleaner = new StaleTradeCleaner(eventStore, retentionConfig, feedMetrics, persistenceErrorReporter);
    }

    @Test
    @DisplayName("deletes trades older than the retention window and counts them")
    void purgesOldTrades() {
        when(eventStore.deleteTradesOlderThan(NOW.minusMinutes(10))).thenReturn(7);

        int deleted = staleTradeCleaner.clean(NOW);

        assertThat(deleted).isEqualTo(7);
        assertThat(meterRegistry.counter("store.trades.purged").count()).isEqualTo(7.0);
    }

    @Test
    @DisplayName("uses the configured retention window")
    void configuredRetention() {
        retentionConfig.setTradeRetention(Duration.ofMinutes(30));
        when(eventStore.deleteTradesOlderThan(any(LocalDateTime.class))).thenReturn(0);

        staleTradeCleaner.clean(NOW);

        verify(eventStore).deleteTradesOlderThan(LocalDateTime.of(2024, 5, 1, 11, 30));
    }

    @Test
    @DisplayName("store failure is reported and returns zero")
    void failureReported() {
        EventStoreException failure = new EventStoreException("purge failed", new RuntimeException("lock timeout"));
        when(eventStore.deleteTradesOlderThan(any(LocalDateTime.class))).thenThrow(failure);

        int deleted = staleTradeCleaner.clean(NOW);

        assertThat(deleted).isZero();
        verify(persistenceErrorReporter).report("purge-trades", null, failure);
    }
}
