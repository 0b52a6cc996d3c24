package com.kidzout.crawler.scraping;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicLong;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class RateLimiterTest {

    private final AtomicLong clock = new AtomicLong(0);
    private final List<Duration> sleeps = new ArrayList<>();

    // Advances the fake clock instead of blocking
    private final Sleeper fakeSleeper = duration -> {
        sleeps.add(duration);
        clock.addAndGet(duration.toNanos());
    };

    private RateLimiter limiter(double jitter) {
        return new RateLimiter(Duration.ofSeconds(4), 0.2, 8, 3, fakeSleeper, clock::get, () -> jitter);
    }

    @Test
    void firstAcquireForDomainDoesNotWait() throws InterruptedException {
        RateLimiter rateLimiter = limiter(0.0);

        rateLimiter.acquire("example.org");

        assertTrue(sleeps.isEmpty());
    }

    @Test
    void secondAcquireWaitsForBaseInterval() throws InterruptedException {
        RateLimiter rateLimiter = limiter(0.0);

        rateLimiter.acquire("example.org");
        clock.addAndGet(Duration.ofSeconds(1).toNanos());
        rateLimiter.acquire("example.org");

        assertEquals(List.of(Duration.ofSeconds(3)), sleeps);
    }

    @Test
    void grantGapNeverBelowLowerJitterBound() throws InterruptedException {
        RateLimiter rateLimiter = limiter(-1.0);
        List<Long> grants = new ArrayList<>();

        for (int i = 0; i < 5; i++) {
            rateLimiter.acquire("example.org");
            grants.add(clock.get());
        }

        long minimum = rateLimiter.minimumGap("example.org").toNanos();
        for (int i = 1; i < grants.size(); i++) {
            assertTrue(grants.get(i) - grants.get(i - 1) >= minimum);
        }
        assertEquals(Duration.ofMillis(3200), rateLimiter.minimumGap("example.org"));
    }

    @Test
    void domainsAreIndependent() throws InterruptedException {
        RateLimiter rateLimiter = limiter(0.0);

        rateLimiter.acquire("a.example");
        rateLimiter.acquire("b.example");

        assertTrue(sleeps.isEmpty());
    }

    @Test
    void failuresDoubleMultiplierUpToCap() {
        RateLimiter rateLimiter = limiter(0.0);

        rateLimiter.recordFailure("example.org");
        assertEquals(2, rateLimiter.currentMultiplier("example.org"));
        rateLimiter.recordFailure("example.org");
        rateLimiter.recordFailure("example.org");
        rateLimiter.recordFailure("example.org");

        assertEquals(8, rateLimiter.currentMultiplier("example.org"));
    }

    @Test
    void backoffStretchesTheWait() throws InterruptedException {
        RateLimiter rateLimiter = limiter(0.0);

        rateLimiter.acquire("example.org");
        rateLimiter.recordFailure("example.org");
        rateLimiter.acquire("example.org");

        assertEquals(List.of(Duration.ofSeconds(8)), sleeps);
    }

    @Test
    void consecutiveSuccessesHalveMultiplier() {
        RateLimiter rateLimiter = limiter(0.0);
        rateLimiter.recordFailure("example.org");
        rateLimiter.recordFailure("example.org");

        rateLimiter.recordSuccess("example.org");
        rateLimiter.recordSuccess("example.org");
        assertEquals(4, rateLimiter.currentMultiplier("example.org"));

        rateLimiter.recordSuccess("example.org");
        assertEquals(2, rateLimiter.currentMultiplier("example.org"));
    }

    @Test
    void failureResetsRecoveryStreak() {
        RateLimiter rateLimiter = limiter(0.0);
        rateLimiter.recordFailure("example.org");

        rateLimiter.recordSuccess("example.org");
        rateLimiter.recordSuccess("example.org");
        rateLimiter.recordFailure("example.org");
        rateLimiter.recordSuccess("example.org");

        assertEquals(4, rateLimiter.currentMultiplier("example.org"));
    }
}
