package com.mintstream.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.SmartLifecycle;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

/**
 * Thread pool for the three long-lived stream tasks: the reconnect loop, the unsubscribe
 * sweeper and the trade cleaner. Each task has a dedicated thread so a slow store call in one
 * never delays the others.
 */
@Configuration
public class SchedulerConfig {

    private static final Logger log = LoggerFactory.getLogger(SchedulerConfig.class);

    @Value("${mintstream.scheduler.pool-size:3}")
    private int poolSize;

    @Value("${mintstream.scheduler.await-termination-seconds:30}")
    private int awaitTerminationSeconds;

    @Bean("streamScheduler")
    public ThreadPoolTaskScheduler streamScheduler() {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(poolSize);
        scheduler.setThreadNamePrefix("stream-");
        scheduler.setRemoveOnCancelPolicy(true);
        scheduler.setWaitForTasksToCompleteOnShutdown(true);
        scheduler.setAwaitTerminationSeconds(awaitTerminationSeconds);
        // Stopped after StreamOrchestrator, which ends the feed task first
        scheduler.setPhase(SmartLifecycle.DEFAULT_PHASE - 1024);
        scheduler.setErrorHandler(
                throwable -> log.error("Uncaught error in stream task: {}", throwable.getMessage(), throwable));
        return scheduler;
    }
}
