package com.kidzout.crawler.quality;

import com.kidzout.crawler.config.CrawlerConfig;
import com.kidzout.crawler.model.FetchAttempt;
import com.kidzout.crawler.model.Source;
import com.kidzout.crawler.model.SourceStats;
import com.kidzout.crawler.model.enums.FetchOutcome;
import com.kidzout.crawler.model.enums.SourceFormat;
import com.kidzout.crawler.output.AtomicJsonWriter;
import com.kidzout.crawler.output.QualityStateStore;
import com.kidzout.crawler.support.TestSources;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SourceQualityTrackerTest {

    @TempDir
    Path tempDir;

    private final SourceQualityTracker tracker = new SourceQualityTracker(new CrawlerConfig());
    private final Source source = TestSources.source("Feed", SourceFormat.RSS);

    private static FetchAttempt attempt(FetchOutcome outcome) {
        return FetchAttempt.builder()
                .sourceName("Feed")
                .timestamp(Instant.parse("2025-03-01T08:00:00Z"))
                .outcome(outcome)
                .itemCount(outcome == FetchOutcome.SUCCESS ? 3 : 0)
                .build();
    }

    @Test
    void sourceWithoutHistoryScoresHalf() {
        assertEquals(0.5, tracker.score(source), 1e-9);
    }

    @Test
    void scoreIsWeightedRatioDampedByStreak() {
        tracker.report(source, attempt(FetchOutcome.SUCCESS));
        tracker.report(source, attempt(FetchOutcome.EMPTY));
        assertEquals(0.75, tracker.score(source), 1e-9);

        tracker.report(source, attempt(FetchOutcome.HTTP_ERROR));
        assertEquals(0.5 * 0.8, tracker.score(source), 1e-9);
    }

    @Test
    void scoreNeverIncreasesWithMoreConsecutiveFailures() {
        tracker.report(source, attempt(FetchOutcome.SUCCESS));
        double previous = tracker.score(source);
        for (FetchOutcome failure : List.of(FetchOutcome.TIMEOUT, FetchOutcome.PARSE_ERROR, FetchOutcome.HTTP_ERROR)) {
            tracker.report(source, attempt(failure));
            double current = tracker.score(source);
            assertTrue(current <= previous);
            assertTrue(current >= 0.0 && current <= 1.0);
            previous = current;
        }
    }

    @Test
    void emptyLeavesStreakUnchangedAndSuccessResetsIt() {
        tracker.report(source, attempt(FetchOutcome.TIMEOUT));
        tracker.report(source, attempt(FetchOutcome.EMPTY));
        assertEquals(1, tracker.stats("Feed").getConsecutiveFailures());

        tracker.report(source, attempt(FetchOutcome.SUCCESS));
        assertEquals(0, tracker.stats("Feed").getConsecutiveFailures());
    }

    @Test
    void windowKeepsLastOutcomesOnly() {
        for (int i = 0; i < 25; i++) {
            tracker.report(source, attempt(FetchOutcome.SUCCESS));
        }

        SourceStats stats = tracker.stats("Feed");
        assertEquals(20, stats.getRecentOutcomes().size());
        assertEquals(25, stats.getTotalAttempts());
        assertEquals(75, stats.getTotalItems());
    }

    @Test
    void fiveConsecutiveFailuresExcludeSourceForOneRun() {
        for (int i = 0; i < 5; i++) {
            tracker.report(source, attempt(FetchOutcome.HTTP_ERROR));
        }

        assertEquals(Set.of("Feed"), tracker.consumeExclusions(List.of(source)));
        assertTrue(tracker.consumeExclusions(List.of(source)).isEmpty());
    }

    @Test
    void concurrentReportsAreNotLost() throws Exception {
        ExecutorService pool = Executors.newFixedThreadPool(8);
        try {
            List<Future<?>> futures = new ArrayList<>();
            for (int i = 0; i < 400; i++) {
                FetchOutcome outcome = i % 2 == 0 ? FetchOutcome.SUCCESS : FetchOutcome.EMPTY;
                futures.add(pool.submit(() -> tracker.report(source, attempt(outcome))));
            }
            for (Future<?> future : futures) {
                future.get();
            }
        } finally {
            pool.shutdownNow();
        }

        SourceStats stats = tracker.stats("Feed");
        assertEquals(400, stats.getTotalAttempts());
        assertEquals(200L, stats.getTotals().get(FetchOutcome.SUCCESS));
        assertEquals(20, stats.getRecentOutcomes().size());
    }

    @Test
    void statePersistsAcrossRuns() {
        QualityStateStore store = new QualityStateStore(new AtomicJsonWriter(new CrawlerConfig()), tempDir.resolve("crawler_stats.json"));
        for (int i = 0; i < 5; i++) {
            tracker.report(source, attempt(FetchOutcome.TIMEOUT));
        }
        store.save(tracker.snapshot());

        SourceQualityTracker nextRun = new SourceQualityTracker(new CrawlerConfig());
        Map<String, SourceStats> loaded = store.load();
        nextRun.load(loaded);

        assertEquals(tracker.score(source), nextRun.score(source), 1e-9);
        assertEquals(5, nextRun.stats("Feed").getConsecutiveFailures());
        assertEquals(Set.of("Feed"), nextRun.consumeExclusions(List.of(source)));
        assertFalse(nextRun.stats("Feed").isExcludeNextRun());
    }
}
