package com.mintstream.feed;

import com.mintstream.config.FeedConfig;
import com.mintstream.domain.enums.ReconnectState;
import com.mintstream.exception.FeedConnectionException;
import com.mintstream.exception.MalformedFeedMessageException;
import com.mintstream.observability.FeedMetrics;
import com.mintstream.subscription.SubscriptionRegistry;
import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Owns the feed session: connects, subscribes, dispatches inbound messages and reconnects
 * with exponential backoff.
 *
 * <p>State machine (see {@link ReconnectState}):
 * <ul>
 *   <li>CONNECTING: open a session. Failure goes to BACKOFF.</li>
 *   <li>ACTIVE: send the base subscription, re-send trade subscriptions for every token
 *       still in the registry, then receive and dispatch until the session is lost. The retry
 *       count is reset by the first inbound message, so a session that opens and drops at
 *       once still counts as a failed attempt. A message that fails to decode or process is
 *       logged and skipped.</li>
 *   <li>CONNECTION_LOST: close the session, wait the grace period with a per-second countdown.</li>
 *   <li>BACKOFF: give up with EXHAUSTED once {@code maxRetries} consecutive attempts failed,
 *       otherwise increment the retry count, sleep {@link ReconnectBackoff#delayFor} and
 *       go back to CONNECTING.</li>
 * </ul>
 *
 * <p>{@link #run()} blocks the calling thread until the loop ends. {@link #stop()} may be
 * called from any thread: it wakes any sleep and closes the live session, and the loop then
 * returns STOPPED after the message being dispatched (if any) completes.
 */
@Component
public class FeedReconnectLoop {

    private static final Logger log = LoggerFactory.getLogger(FeedReconnectLoop.class);

    private final FeedConnector feedConnector;
    private final FeedChannel feedChannel;
    private final FeedMessageDispatcher feedMessageDispatcher;
    private final SubscriptionRegistry subscriptionRegistry;
    private final FeedMetrics feedMetrics;
    private final ReconnectBackoff reconnectBackoff;
    private final Duration reconnectGrace;
    private final int maxRetries;
    private final Sleeper sleeper;

    private final CountDownLatch stopLatch = new CountDownLatch(1);

    private volatile boolean stopRequested;
    private volatile ReconnectState state = ReconnectState.DISCONNECTED;
    private volatile FeedConnection connection;
    private int retryCount;

    @Autowired
    public FeedReconnectLoop(
            FeedConnector feedConnector,
            FeedChannel feedChannel,
            FeedMessageDispatcher feedMessageDispatcher,
            SubscriptionRegistry subscriptionRegistry,
            FeedMetrics feedMetrics,
            FeedConfig feedConfig) {
        this(
                feedConnector,
                feedChannel,
                feedMessageDispatcher,
                subscriptionRegistry,
                feedMetrics,
                new ReconnectBackoff(feedConfig.getMaxBackoff()),
                feedConfig.getReconnectGrace(),
                feedConfig.getMaxRetries(),
                null);
    }

    /** Secondary constructor for tests that script the backoff jitter and record sleeps. */
    public FeedReconnectLoop(
            FeedConnector feedConnector,
            FeedChannel feedChannel,
            FeedMessageDispatcher feedMessageDispatcher,
            SubscriptionRegistry subscriptionRegistry,
            FeedMetrics feedMetrics,
            ReconnectBackoff reconnectBackoff,
            Duration reconnectGrace,
            int maxRetries,
            Sleeper sleeper) {
        this.feedConnector = feedConnector;
        this.feedChannel = feedChannel;
        this.feedMessageDispatcher = feedMessageDispatcher;
        this.subscriptionRegistry = subscriptionRegistry;
        this.feedMetrics = feedMetrics;
        this.reconnectBackoff = reconnectBackoff;
        this.reconnectGrace = reconnectGrace;
        this.maxRetries = maxRetries;
        this.sleeper = sleeper != null ? sleeper : this::awaitStop;
    }

    /**
     * Runs the loop on the calling thread.
     *
     * @return the terminal state, EXHAUSTED or STOPPED
     */
    public ReconnectState run() {
        retryCount = 0;
        ReconnectState next = ReconnectState.CONNECTING;

        while (!next.isTerminal()) {
            if (stopRequested) {
                next = ReconnectState.STOPPED;
                break;
            }
            state = next;
            next = switch (next) {
                case CONNECTING -> connect();
                case ACTIVE -> receiveUntilLost();
                case CONNECTION_LOST -> closeAndWaitGrace();
                case BACKOFF -> backoff();
                default -> throw new IllegalStateException("Unexpected reconnect state " + next);
            };
        }

        closeConnection();
        state = next;
        if (next == ReconnectState.EXHAUSTED) {
            log.error("Maximum feed reconnect attempts ({}) reached. Ending feed task.", maxRetries);
        } else {
            log.info("Feed task stopped");
        }
        return next;
    }

    /** Requests shutdown. Safe to call from any thread, more than once. */
    public void stop() {
        stopRequested = true;
        stopLatch.countDown();
        FeedConnection current = connection;
        if (current != null) {
            current.close();
        }
    }

    public ReconnectState getState() {
        return state;
    }

    public int getRetryCount() {
        return retryCount;
    }

    // ---- States ----

    private ReconnectState connect() {
        try {
            FeedConnection opened = feedConnector.open();
            connection = opened;
            if (stopRequested) {
                return ReconnectState.STOPPED;
            }
            feedChannel.attach(opened);
            log.info("Feed session connected");
            return ReconnectState.ACTIVE;
        } catch (FeedConnectionException e) {
            log.warn("Feed connection failed: {}", e.getMessage());
            return ReconnectState.BACKOFF;
        }
    }

    private ReconnectState receiveUntilLost() {
        if (!feedChannel.subscribeNewTokens()) {
            log.warn("Base subscription could not be sent, treating session as lost");
            return ReconnectState.CONNECTION_LOST;
        }
        int resubscribed = subscriptionRegistry.resubscribeAll(feedChannel::subscribeTokenTrade);
        if (resubscribed > 0) {
            log.info("Resubscribed {} tokens after connect", resubscribed);
        }

        while (!stopRequested) {
            Optional<String> payload;
            try {
                payload = connection.receive();
            } catch (FeedConnectionException e) {
                log.warn("Feed connection lost: {}", e.getMessage());
                return ReconnectState.CONNECTION_LOST;
            }
            if (payload.isPresent()) {
                if (retryCount > 0) {
                    log.info("Feed session healthy, resetting retry count from {}", retryCount);
                    retryCount = 0;
                }
                dispatchSafely(payload.get());
            }
        }
        return ReconnectState.STOPPED;
    }

    private ReconnectState closeAndWaitGrace() {
        closeConnection();

        long seconds = reconnectGrace.toSeconds();
        if (seconds <= 0) {
            return pause(reconnectGrace) ? ReconnectState.BACKOFF : ReconnectState.STOPPED;
        }
        for (long remaining = seconds; remaining > 0; remaining--) {
            log.info("Reconnecting in {} seconds...", remaining);
            if (!pause(Duration.ofSeconds(1))) {
                return ReconnectState.STOPPED;
            }
        }
        return ReconnectState.BACKOFF;
    }

    private ReconnectState backoff() {
        if (retryCount >= maxRetries) {
            return ReconnectState.EXHAUSTED;
        }
        retryCount++;
        Duration delay = reconnectBackoff.delayFor(retryCount);
        feedMetrics.recordReconnect();
        log.warn("Retrying feed connection in {} ms (attempt {}/{})", delay.toMillis(), retryCount, maxRetries);
        return pause(delay) ? ReconnectState.CONNECTING : ReconnectState.STOPPED;
    }

    // ---- Helpers ----

    private void dispatchSafely(String payload) {
        feedMetrics.recordReceived();
        try {
            feedMessageDispatcher.dispatch(payload);
        } catch (MalformedFeedMessageException e) {
            feedMetrics.recordMalformed();
            log.warn("Discarding malformed feed message: {}", e.getMessage());
        } catch (RuntimeException e) {
            log.error("Error processing feed message: {}", e.getMessage(), e);
        }
    }

    private void closeConnection() {
        FeedConnection current = connection;
        if (current == null) {
            return;
        }
        feedChannel.detach(current);
        current.close();
        connection = null;
        log.info("Feed session closed");
    }

    /** @return false if the loop was asked to stop while pausing */
    private boolean pause(Duration duration) {
        try {
            sleeper.sleep(duration);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            stopRequested = true;
        }
        return !stopRequested;
    }

    private void awaitStop(Duration duration) throws InterruptedException {
        stopLatch.await(duration.toMillis(), TimeUnit.MILLISECONDS);
    }
}
