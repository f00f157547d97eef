package com.mintstream.unit.core;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doReturn;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.mintstream.config.FeedConfig;
import com.mintstream.config.RetentionConfig;
import com.mintstream.core.StreamOrchestrator;
import com.mintstream.domain.enums.ReconnectState;
import com.mintstream.feed.FeedReconnectLoop;
import com.mintstream.observability.FeedMetrics;
import com.mintstream.recovery.SubscriptionRecoveryService;
import com.mintstream.retention.StaleTradeCleaner;
import com.mintstream.retention.UnsubscribeSweeper;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.scheduling.TaskScheduler;

/**
 * Unit tests for {@link StreamOrchestrator} lifecycle wiring against a mocked scheduler.
 */
@ExtendWith(MockitoExtension.class)
class StreamOrchestratorTest {

    @Mock
    private FeedReconnectLoop feedReconnectLoop;

    @Mock
    private UnsubscribeSweeper unsubscribeSweeper;

    @Mock
    private StaleTradeCleaner staleTradeCleaner;

    @Mock
    private SubscriptionRecoveryService subscriptionRecoveryService;

    @Mock
    private TaskScheduler streamScheduler;

    @Mock
    private FeedMetrics feedMetrics;

    @Mock
    private ScheduledFuture<Object> feedFuture;

    @Mock
    private ScheduledFuture<Object> sweeperFuture;

    @Mock
    private ScheduledFuture<Object> cleanerFuture;

    private RetentionConfig retentionConfig;
    private StreamOrchestrator streamOrchestrator;

    @BeforeEach
    void setUp() {
        retentionConfig = new RetentionConfig();
        streamOrchestrator = new StreamOrchestrator(
                feedReconnectLoop,
                unsubscribeSweeper,
                staleTradeCleaner,
                subscriptionRecoveryService,
                streamScheduler,
                retentionConfig,
                new FeedConfig(),
                feedMetrics);
    }

    private void stubScheduler() {
        doReturn(feedFuture).when(streamScheduler).schedule(any(Runnable.class), any(Instant.class));
        doReturn(sweeperFuture)
                .when(streamScheduler)
                .scheduleWithFixedDelay(any(Runnable.class), eq(Duration.ofSeconds(60)));
        doReturn(cleanerFuture)
                .when(streamScheduler)
                .scheduleWithFixedDelay(any(Runnable.class), eq(Duration.ofSeconds(600)));
    }

    @Test
    @DisplayName("start: rebuilds subscriptions before launching the feed and both periodic tasks")
    void startLaunchesTasks() {
        stubScheduler();
        when(feedReconnectLoop.run()).thenReturn(ReconnectState.STOPPED);

        streamOrchestrator.start();

        assertThat(streamOrchestrator.isRunning()).isTrue();
        InOrder inOrder = inOrder(subscriptionRecoveryService, streamScheduler);
        inOrder.verify(subscriptionRecoveryService).rebuild();
        inOrder.verify(streamScheduler).schedule(any(Runnable.class), any(Instant.class));

        ArgumentCaptor<Runnable> feedTask = ArgumentCaptor.forClass(Runnable.class);
        verify(streamScheduler).schedule(feedTask.capture(), any(Instant.class));
        feedTask.getValue().run();
        verify(feedReconnectLoop).run();

        ArgumentCaptor<Runnable> sweepTask = ArgumentCaptor.forClass(Runnable.class);
        verify(streamScheduler).scheduleWithFixedDelay(sweepTask.capture(), eq(Duration.ofSeconds(60)));
        sweepTask.getValue().run();
        verify(unsubscribeSweeper).sweep();

        ArgumentCaptor<Runnable> cleanTask = ArgumentCaptor.forClass(Runnable.class);
        verify(streamScheduler).scheduleWithFixedDelay(cleanTask.capture(), eq(Duration.ofSeconds(600)));
        cleanTask.getValue().run();
        verify(staleTradeCleaner).clean();
    }

    @Test
    @DisplayName("start: second call is a no-op")
    void startTwice() {
        stubScheduler();

        streamOrchestrator.start();
        streamOrchestrator.start();

        verify(subscriptionRecoveryService, times(1)).rebuild();
        verify(streamScheduler, times(1)).schedule(any(Runnable.class), any(Instant.class));
    }

    @Test
    @DisplayName("exhausted feed task does not cancel the periodic tasks")
    void exhaustedFeedKeepsPeriodicTasks() {
        stubScheduler();
        when(feedReconnectLoop.run()).thenReturn(ReconnectState.EXHAUSTED);
        streamOrchestrator.start();

        ArgumentCaptor<Runnable> feedTask = ArgumentCaptor.forClass(Runnable.class);
        verify(streamScheduler).schedule(feedTask.capture(), any(Instant.class));
        feedTask.getValue().run();

        verify(sweeperFuture, never()).cancel(anyBoolean());
        verify(cleanerFuture, never()).cancel(anyBoolean());
        assertThat(streamOrchestrator.isRunning()).isTrue();
    }

    @Test
    @DisplayName("stop: stops the loop, cancels periodic tasks without interrupting, waits for the feed task")
    void stopShutsDownTasks() throws Exception {
        stubScheduler();
        streamOrchestrator.start();

        streamOrchestrator.stop();

        assertThat(streamOrchestrator.isRunning()).isFalse();
        verify(feedReconnectLoop).stop();
        verify(sweeperFuture).cancel(false);
        verify(cleanerFuture).cancel(false);
        verify(feedFuture).get(anyLong(), eq(TimeUnit.MILLISECONDS));
        verify(feedMetrics).getMessagesSent();
    }

    @Test
    @DisplayName("stops before the scheduler it runs on")
    void phaseAboveScheduler() {
        assertThat(streamOrchestrator.getPhase()).isGreaterThan(Integer.MAX_VALUE / 2);
        assertThat(streamOrchestrator.isAutoStartup()).isTrue();
    }
}
