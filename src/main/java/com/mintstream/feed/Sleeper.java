package com.mintstream.feed;

import java.time.Duration;

/** Suspends the reconnect loop between attempts. Separate from the delay computation. */
@FunctionalInterface
public interface Sleeper {

    void sleep(Duration duration) throws InterruptedException;
}
