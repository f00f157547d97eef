package com.mintstream.core;

import com.mintstream.config.FeedConfig;
import com.mintstream.config.RetentionConfig;
import com.mintstream.domain.enums.ReconnectState;
import com.mintstream.feed.FeedReconnectLoop;
import com.mintstream.observability.FeedMetrics;
import com.mintstream.recovery.SubscriptionRecoveryService;
import com.mintstream.retention.StaleTradeCleaner;
import com.mintstream.retention.UnsubscribeSweeper;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.SmartLifecycle;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Service;

/**
 * Starts and stops the three long-lived stream tasks.
 *
 * <p>On start:
 * <ol>
 *   <li>Optionally rebuild the subscription set from the store</li>
 *   <li>Run the {@link FeedReconnectLoop} on its own scheduler thread</li>
 *   <li>Schedule the {@link UnsubscribeSweeper} with a fixed delay of {@code sweep-interval}</li>
 *   <li>Schedule the {@link StaleTradeCleaner} with a fixed delay of {@code cleanup-interval}</li>
 * </ol>
 *
 * <p>The periodic tasks run once immediately, then after each interval. If the reconnect loop
 * ends with EXHAUSTED the error is logged and the periodic tasks keep running; restarting the
 * process is left to its supervisor.
 *
 * <p>On stop the loop is asked to stop (wakes its sleep, closes the session) and the periodic
 * tasks are cancelled without interruption, so a store call in progress completes. Stop waits
 * up to the close timeout plus one heartbeat interval for the loop to return.
 */
@Service
public class StreamOrchestrator implements SmartLifecycle {

    private static final Logger log = LoggerFactory.getLogger(StreamOrchestrator.class);

    private final FeedReconnectLoop feedReconnectLoop;
    private final UnsubscribeSweeper unsubscribeSweeper;
    private final StaleTradeCleaner staleTradeCleaner;
    private final SubscriptionRecoveryService subscriptionRecoveryService;
    private final TaskScheduler streamScheduler;
    private final RetentionConfig retentionConfig;
    private final FeedConfig feedConfig;
    private final FeedMetrics feedMetrics;

    private final AtomicBoolean running = new AtomicBoolean(false);

    private Future<?> feedFuture;
    private ScheduledFuture<?> sweeperFuture;
    private ScheduledFuture<?> cleanerFuture;

    public StreamOrchestrator(
            FeedReconnectLoop feedReconnectLoop,
            UnsubscribeSweeper unsubscribeSweeper,
            StaleTradeCleaner staleTradeCleaner,
            SubscriptionRecoveryService subscriptionRecoveryService,
            @Qualifier("streamScheduler") TaskScheduler streamScheduler,
            RetentionConfig retentionConfig,
            FeedConfig feedConfig,
            FeedMetrics feedMetrics) {
        this.feedReconnectLoop = feedReconnectLoop;
        this.unsubscribeSweeper = unsubscribeSweeper;
        this.staleTradeCleaner = staleTradeCleaner;
        this.subscriptionRecoveryService = subscriptionRecoveryService;
        this.streamScheduler = streamScheduler;
        this.retentionConfig = retentionConfig;
        this.feedConfig = feedConfig;
        this.feedMetrics = feedMetrics;
    }

    @Override
    public void start() {
        if (!running.compareAndSet(false, true)) {
            return;
        }

        subscriptionRecoveryService.rebuild();

        feedFuture = streamScheduler.schedule(this::runFeed, Instant.now());
        sweeperFuture = streamScheduler.scheduleWithFixedDelay(
                unsubscribeSweeper::sweep, retentionConfig.getSweepInterval());
        cleanerFuture = streamScheduler.scheduleWithFixedDelay(
                staleTradeCleaner::clean, retentionConfig.getCleanupInterval());

        log.info(
                "Stream tasks started (sweep every {}s, trade cleanup every {}s)",
                retentionConfig.getSweepInterval().toSeconds(),
                retentionConfig.getCleanupInterval().toSeconds());
    }

    @Override
    public void stop() {
        if (!running.compareAndSet(true, false)) {
            return;
        }
        log.info("Stopping stream tasks...");

        feedReconnectLoop.stop();
        cancel(sweeperFuture);
        cancel(cleanerFuture);
        awaitFeed();

        log.info(
                "Stream processing complete. Messages sent: {}, messages received: {}",
                feedMetrics.getMessagesSent(),
                feedMetrics.getMessagesReceived());
    }

    @Override
    public boolean isRunning() {
        return running.get();
    }

    @Override
    public int getPhase() {
        // Above the stream scheduler's phase: start after it, stop before it
        return Integer.MAX_VALUE - 1;
    }

    @Override
    public boolean isAutoStartup() {
        return true;
    }

    /** True while the reconnect loop has not reached a terminal state. */
    public boolean isFeedRunning() {
        return feedFuture != null && !feedFuture.isDone();
    }

    private void runFeed() {
        ReconnectState finalState = feedReconnectLoop.run();
        if (finalState == ReconnectState.EXHAUSTED) {
            log.error("Feed task ended after exhausting reconnect attempts; sweeper and cleaner keep running");
        }
    }

    private void cancel(Future<?> future) {
        if (future != null) {
            future.cancel(false);
        }
    }

    private void awaitFeed() {
        if (feedFuture == null) {
            return;
        }
        Duration timeout = feedConfig.getCloseTimeout().plus(feedConfig.getHeartbeatInterval());
        try {
            feedFuture.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            log.warn("Feed task did not stop within {}s", timeout.toSeconds());
        } catch (ExecutionException e) {
            log.error("Feed task failed: {}", e.getCause() != null ? e.getCause().getMessage() : e.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while waiting for feed task to stop");
        } catch (CancellationException e) {
            log.debug("Feed task was cancelled before it started");
        }
    }
}
