package com.mintstream.retention;

import com.mintstream.config.RetentionConfig;
import com.mintstream.exception.EventStoreException;
import com.mintstream.observability.FeedMetrics;
import com.mintstream.observability.PersistenceErrorReporter;
import com.mintstream.store.EventStore;
import java.time.LocalDateTime;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Purges trades older than the retention window in one bulk delete. Trades exactly at the
 * cutoff are kept. Touches only the store.
 */
@Component
public class StaleTradeCleaner {

    private static final Logger log = LoggerFactory.getLogger(StaleTradeCleaner.class);

    private final EventStore eventStore;
    private final RetentionConfig retentionConfig;
    private final FeedMetrics feedMetrics;
    private final PersistenceErrorReporter persistenceErrorReporter;

    public StaleTradeCleaner(
            EventStore eventStore,
            RetentionConfig retentionConfig,
            FeedMetrics feedMetrics,
            PersistenceErrorReporter persistenceErrorReporter) {
        this.eventStore = eventStore;
        this.retentionConfig = retentionConfig;
        this.feedMetrics = feedMetrics;
        this.persistenceErrorReporter = persistenceErrorReporter;
    }

    public void clean() {
        clean(LocalDateTime.now());
    }

    /**
     * @return number of trades removed, 0 on failure
     */
    public int clean(LocalDateTime now) {
        LocalDateTime cutoff = now.minus(retentionConfig.getTradeRetention());
        try {
            int deleted = eventStore.deleteTradesOlderThan(cutoff);
            if (deleted > 0) {
                feedMetrics.recordTradesPurged(deleted);
                log.info("{} outdated trades removed", deleted);
            }
            return deleted;
        } catch (EventStoreException e) {
            persistenceErrorReporter.report("purge-trades", null, e);
            return 0;
        }
    }
}
