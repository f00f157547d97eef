package com.mintstream.feed;

import java.time.Duration;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.DoubleSupplier;

/**
 * Exponential reconnect delay: {@code min(maxDelay, 2^retryCount s + jitter)} with jitter
 * uniform in [0, 1) s. The loop increments retryCount before asking, so consecutive failures
 * wait roughly 2s, 4s, 8s, ... up to the cap.
 */
public class ReconnectBackoff {

    /** Above this exponent 2^n seconds exceeds any sensible cap. */
    private static final int MAX_EXPONENT = 30;

    private final Duration maxDelay;
    private final DoubleSupplier jitterSource;

    public ReconnectBackoff(Duration maxDelay) {
        this(maxDelay, () -> ThreadLocalRandom.current().nextDouble());
    }

    public ReconnectBackoff(Duration maxDelay, DoubleSupplier jitterSource) {
        this.maxDelay = maxDelay;
        this.jitterSource = jitterSource;
    }

    public Duration delayFor(int retryCount) {
        return computeDelay(retryCount, jitterSource.getAsDouble(), maxDelay);
    }

    /**
     * Pure delay function.
     *
     * @param retryCount consecutive failures so far, at least 0
     * @param jitterSeconds jitter in [0, 1)
     * @param maxDelay cap
     */
    public static Duration computeDelay(int retryCount, double jitterSeconds, Duration maxDelay) {
        if (retryCount < 0) {
            throw new IllegalArgumentException("retryCount must be >= 0, was " + retryCount);
        }
        if (retryCount > MAX_EXPONENT) {
            return maxDelay;
        }
        long millis = (long) (((1L << retryCount) + jitterSeconds) * 1000);
        return millis >= maxDelay.toMillis() ? maxDelay : Duration.ofMillis(millis);
    }

    public Duration getMaxDelay() {
        return maxDelay;
    }
}
