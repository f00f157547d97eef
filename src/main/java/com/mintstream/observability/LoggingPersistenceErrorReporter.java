package com.mintstream.observability;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Default {@link PersistenceErrorReporter}: one ERROR line per failure plus the
 * {@code store.persistence.failures} counter.
 */
@Component
public class LoggingPersistenceErrorReporter implements PersistenceErrorReporter {

    private static final Logger log = LoggerFactory.getLogger(LoggingPersistenceErrorReporter.class);

    private final FeedMetrics feedMetrics;

    public LoggingPersistenceErrorReporter(FeedMetrics feedMetrics) {
        this.feedMetrics = feedMetrics;
    }

    @Override
    public void report(String operation, String mint, Throwable error) {
        feedMetrics.recordPersistenceFailure(operation);
        if (mint != null) {
            log.error("Store {} failed for token {}: {}", operation, mint, rootMessage(error));
        } else {
            log.error("Store {} failed: {}", operation, rootMessage(error));
        }
        log.debug("Store {} failure detail", operation, error);
    }

    private String rootMessage(Throwable error) {
        Throwable root = error;
        while (root.getCause() != null && root.getCause() != root) {
            root = root.getCause();
        }
        return root == error ? error.getMessage() : error.getMessage() + " (" + root.getMessage() + ")";
    }
}
