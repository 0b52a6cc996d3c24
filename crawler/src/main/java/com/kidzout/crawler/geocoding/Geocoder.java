package com.kidzout.crawler.geocoding;

import com.kidzout.crawler.config.CrawlerConfig;
import com.kidzout.crawler.exception.GeocodeException;
import com.kidzout.crawler.model.Coordinates;
import com.kidzout.crawler.model.GeocodeCacheEntry;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

/**
 * Address to coordinates resolution backed by a persistent cache.
 * <p>
 * Addresses are keyed after normalization (trimmed, lowercased, whitespace collapsed). Both hits
 * and misses are cached, so the same address is looked up at most once per run. Concurrent
 * callers for the same key share a single in-flight lookup; callers for different keys do not
 * block each other apart from the provider's own rate limit. Entries loaded from an earlier run
 * are looked up again once they are older than the configured staleness threshold.
 */
@Service
@Slf4j
public class Geocoder {

    private final GeocodingProvider provider;
    private final boolean enabled;
    private final Duration staleAfter;
    private final Duration negativeStaleAfter;
    private final Clock clock;

    private final Map<String, GeocodeCacheEntry> cache = new ConcurrentHashMap<>();
    private final Map<String, CompletableFuture<Optional<Coordinates>>> inFlight = new ConcurrentHashMap<>();
    private final AtomicInteger lookups = new AtomicInteger();

    @Autowired
    public Geocoder(GeocodingProvider provider, CrawlerConfig crawlerConfig) {
        this(provider, crawlerConfig.getGeocoder(), Clock.systemUTC());
    }

    public Geocoder(GeocodingProvider provider, CrawlerConfig.Geocoder settings, Clock clock) {
        this.provider = provider;
        this.enabled = settings.isEnabled();
        this.staleAfter = settings.getStaleAfter();
        this.negativeStaleAfter = settings.getNegativeStaleAfter();
        this.clock = clock;
    }

    public Optional<Coordinates> resolve(String addressText) {
        String key = normalizeKey(addressText);
        if (key.isEmpty() || !enabled) {
            return Optional.empty();
        }

        GeocodeCacheEntry cached = cache.get(key);
        if (cached != null && isFresh(cached)) {
            return Optional.ofNullable(cached.toCoordinates());
        }

        CompletableFuture<Optional<Coordinates>> mine = new CompletableFuture<>();
        CompletableFuture<Optional<Coordinates>> existing = inFlight.putIfAbsent(key, mine);
        if (existing != null) {
            return existing.join();
        }

        try {
            // Another caller may have finished this key between the cache check and registration
            GeocodeCacheEntry current = cache.get(key);
            if (current != null && current != cached && isFresh(current)) {
                Optional<Coordinates> result = Optional.ofNullable(current.toCoordinates());
                mine.complete(result);
                return result;
            }

            Optional<Coordinates> result = lookup(addressText.trim(), key);
            mine.complete(result);
            return result;
        } catch (RuntimeException e) {
            mine.completeExceptionally(e);
            throw e;
        } finally {
            inFlight.remove(key, mine);
        }
    }

    private Optional<Coordinates> lookup(String address, String key) {
        lookups.incrementAndGet();
        Instant now = clock.instant();
        try {
            Optional<Coordinates> coordinates = provider.lookup(address);
            cache.put(key, coordinates.map(c -> GeocodeCacheEntry.resolved(c, now))
                    .orElseGet(() -> GeocodeCacheEntry.unresolvable(now)));
            log.debug("Geocoded '{}' -> {}", address, coordinates.map(Object::toString).orElse("unresolvable"));
            return coordinates;
        } catch (GeocodeException e) {
            if (Thread.currentThread().isInterrupted()) {
                // Cancelled, not a provider answer; leave the key uncached
                return Optional.empty();
            }
            log.warn("Geocoding failed for '{}': {}", address, e.getMessage());
            cache.put(key, GeocodeCacheEntry.unresolvable(now));
            return Optional.empty();
        }
    }

    private boolean isFresh(GeocodeCacheEntry entry) {
        if (entry.getResolvedAt() == null) return false;
        Duration threshold = entry.isUnresolvable() ? negativeStaleAfter : staleAfter;
        return entry.getResolvedAt().plus(threshold).isAfter(clock.instant());
    }

    public static String normalizeKey(String addressText) {
        if (addressText == null) return "";
        return addressText.trim().toLowerCase(Locale.ROOT).replaceAll("\\s+", " ");
    }

    /**
     * Seed the cache with entries persisted by an earlier run
     */
    public void load(Map<String, GeocodeCacheEntry> entries) {
        entries.forEach((key, entry) -> {
            if (entry != null) cache.put(normalizeKey(key), entry);
        });
        log.info("📍 Loaded {} geocode cache entries", cache.size());
    }

    /**
     * Sorted copy of the cache for persistence
     */
    public Map<String, GeocodeCacheEntry> snapshot() {
        return new TreeMap<>(cache);
    }

    public int lookupCount() {
        return lookups.get();
    }
}
