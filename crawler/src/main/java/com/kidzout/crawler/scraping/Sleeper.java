package com.kidzout.crawler.scraping;

import java.time.Duration;

/**
 * Suspends the calling thread. Swapped out in tests to observe waits without spending them.
 */
@FunctionalInterface
public interface Sleeper {

    Sleeper SYSTEM = duration -> {
        if (duration.isNegative() || duration.isZero()) return;
        Thread.sleep(duration.toMillis(), (int) (duration.toNanos() % 1_000_000));
    };

    void sleep(Duration duration) throws InterruptedException;
}
