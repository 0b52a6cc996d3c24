package com.kidzout.crawler.scraping;

import com.kidzout.crawler.config.CrawlerConfig;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.DoubleSupplier;
import java.util.function.LongSupplier;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Per-domain request spacing with jitter and failure backoff.
 * <p>
 * Each domain has its own lock and last-grant timestamp, so callers for different domains never
 * wait on each other. Callers for the same domain are granted one at a time, and each grant is at
 * least {@code baseInterval * multiplier * (1 - jitter)} after the previous one. Failures double the
 * multiplier up to the configured cap; a run of successes halves it again.
 */
@Component
@Slf4j
public class RateLimiter {

    private final long baseIntervalNanos;
    private final double jitterFraction;
    private final int maxBackoffMultiplier;
    private final int recoverySuccesses;
    private final Sleeper sleeper;
    private final LongSupplier nanoClock;
    private final DoubleSupplier jitterSource;

    private final Map<String, DomainState> domains = new ConcurrentHashMap<>();

    @Autowired
    public RateLimiter(CrawlerConfig crawlerConfig) {
        this(crawlerConfig.getRateLimit().getBaseInterval(),
                crawlerConfig.getRateLimit().getJitterFraction(),
                crawlerConfig.getRateLimit().getMaxBackoffMultiplier(),
                crawlerConfig.getRateLimit().getRecoverySuccesses(),
                Sleeper.SYSTEM,
                System::nanoTime,
                () -> ThreadLocalRandom.current().nextDouble(-1.0, 1.0));
    }

    /**
     * @param jitterSource supplies values in [-1, 1]; scaled by the jitter fraction
     */
    public RateLimiter(Duration baseInterval, double jitterFraction, int maxBackoffMultiplier,
                       int recoverySuccesses, Sleeper sleeper, LongSupplier nanoClock,
                       DoubleSupplier jitterSource) {
        this.baseIntervalNanos = baseInterval.toNanos();
        this.jitterFraction = jitterFraction;
        this.maxBackoffMultiplier = Math.max(1, maxBackoffMultiplier);
        this.recoverySuccesses = Math.max(1, recoverySuccesses);
        this.sleeper = sleeper;
        this.nanoClock = nanoClock;
        this.jitterSource = jitterSource;
    }

    /**
     * Fixed spacing without jitter or backoff, for a single shared upstream such as a geocoding provider
     */
    public static RateLimiter fixedInterval(Duration interval) {
        return new RateLimiter(interval, 0.0, 1, 1, Sleeper.SYSTEM, System::nanoTime, () -> 0.0);
    }

    /**
     * Block until the domain's next slot is due, then take it
     */
    public void acquire(String domain) throws InterruptedException {
        DomainState state = stateFor(domain);
        state.lock.lockInterruptibly();
        try {
            if (state.lastGrantNanos != null) {
                long interval = jitteredInterval(state.multiplier);
                long elapsed = nanoClock.getAsLong() - state.lastGrantNanos;
                long waitNanos = interval - elapsed;
                if (waitNanos > 0) {
                    log.debug("Rate limit: waiting {} ms for {} (backoff x{})",
                            waitNanos / 1_000_000, domain, state.multiplier);
                    sleeper.sleep(Duration.ofNanos(waitNanos));
                }
            }
            state.lastGrantNanos = nanoClock.getAsLong();
        } finally {
            state.lock.unlock();
        }
    }

    /**
     * Double the domain's spacing after a failed attempt, up to the cap
     */
    public void recordFailure(String domain) {
        DomainState state = stateFor(domain);
        state.lock.lock();
        try {
            int previous = state.multiplier;
            state.multiplier = Math.min(state.multiplier * 2, maxBackoffMultiplier);
            state.successStreak = 0;
            if (state.multiplier != previous) {
                log.info("Backing off {}: interval multiplier x{} -> x{}", domain, previous, state.multiplier);
            }
        } finally {
            state.lock.unlock();
        }
    }

    /**
     * Count a success; enough of them in a row halve the multiplier toward the base interval
     */
    public void recordSuccess(String domain) {
        DomainState state = stateFor(domain);
        state.lock.lock();
        try {
            if (state.multiplier == 1) {
                state.successStreak = 0;
                return;
            }
            state.successStreak++;
            if (state.successStreak >= recoverySuccesses) {
                state.multiplier = Math.max(1, state.multiplier / 2);
                state.successStreak = 0;
                log.debug("Recovering {}: interval multiplier now x{}", domain, state.multiplier);
            }
        } finally {
            state.lock.unlock();
        }
    }

    public int currentMultiplier(String domain) {
        DomainState state = domains.get(normalize(domain));
        return state == null ? 1 : state.multiplier;
    }

    /**
     * Smallest gap the limiter will ever leave between two grants for the domain at its current backoff level
     */
    public Duration minimumGap(String domain) {
        return Duration.ofNanos((long) (baseIntervalNanos * currentMultiplier(domain) * (1.0 - jitterFraction)));
    }

    private long jitteredInterval(int multiplier) {
        double jitter = Math.max(-1.0, Math.min(1.0, jitterSource.getAsDouble())) * jitterFraction;
        return (long) (baseIntervalNanos * multiplier * (1.0 + jitter));
    }

    private DomainState stateFor(String domain) {
        return domains.computeIfAbsent(normalize(domain), key -> new DomainState());
    }

    private static String normalize(String domain) {
        return domain == null ? "" : domain.trim().toLowerCase();
    }

    private static final class DomainState {
        private final ReentrantLock lock = new ReentrantLock(true);
        private Long lastGrantNanos;
        private int multiplier = 1;
        private int successStreak;
    }
}
