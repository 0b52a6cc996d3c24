package com.kidzout.crawler.scraping;

import com.kidzout.crawler.config.CrawlerConfig;
import com.kidzout.crawler.enrichment.Enricher;
import com.kidzout.crawler.exception.ConfigException;
import com.kidzout.crawler.exception.EnrichmentException;
import com.kidzout.crawler.exception.PersistenceException;
import com.kidzout.crawler.geocoding.Geocoder;
import com.kidzout.crawler.model.CandidateRecord;
import com.kidzout.crawler.model.EnrichedEvent;
import com.kidzout.crawler.model.FetchAttempt;
import com.kidzout.crawler.model.Source;
import com.kidzout.crawler.model.dto.CrawlSummaryDTO;
import com.kidzout.crawler.model.dto.SourceResultDTO;
import com.kidzout.crawler.model.enums.FetchOutcome;
import com.kidzout.crawler.model.enums.RecordKind;
import com.kidzout.crawler.model.enums.RunState;
import com.kidzout.crawler.output.DatasetWriter;
import com.kidzout.crawler.output.GeocodeCacheStore;
import com.kidzout.crawler.output.QualityStateStore;
import com.kidzout.crawler.quality.SourceQualityTracker;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

/**
 * Drives one crawl run through its states.
 * <p>
 * {@code IDLE → LOADING → DISPATCHING → COLLECTING → ENRICHING → PERSISTING → DONE}, with
 * {@code FAILED} reachable from Loading (bad configuration) and Persisting (unwritable output).
 * Source-level failures never fail the run: they are reported to the quality tracker and listed
 * in the summary.
 */
@Service
@Slf4j
public class CrawlOrchestrator {

    private final SourceConfigService sourceConfigService;
    private final SourceWorker sourceWorker;
    private final RecordDeduplicator recordDeduplicator;
    private final Enricher enricher;
    private final SourceQualityTracker qualityTracker;
    private final Geocoder geocoder;
    private final DatasetWriter datasetWriter;
    private final GeocodeCacheStore geocodeCacheStore;
    private final QualityStateStore qualityStateStore;
    private final Executor enrichmentTaskExecutor;
    private final int workerCount;
    private final Duration runTimeout;

    private volatile RunState state = RunState.IDLE;

    public CrawlOrchestrator(SourceConfigService sourceConfigService,
                             SourceWorker sourceWorker,
                             RecordDeduplicator recordDeduplicator,
                             Enricher enricher,
                             SourceQualityTracker qualityTracker,
                             Geocoder geocoder,
                             DatasetWriter datasetWriter,
                             GeocodeCacheStore geocodeCacheStore,
                             QualityStateStore qualityStateStore,
                             @Qualifier("enrichmentTaskExecutor") Executor enrichmentTaskExecutor,
                             CrawlerConfig crawlerConfig) {
        this.sourceConfigService = sourceConfigService;
        this.sourceWorker = sourceWorker;
        this.recordDeduplicator = recordDeduplicator;
        this.enricher = enricher;
        this.qualityTracker = qualityTracker;
        this.geocoder = geocoder;
        this.datasetWriter = datasetWriter;
        this.geocodeCacheStore = geocodeCacheStore;
        this.qualityStateStore = qualityStateStore;
        this.enrichmentTaskExecutor = enrichmentTaskExecutor;
        this.workerCount = crawlerConfig.getWorkerCount();
        this.runTimeout = crawlerConfig.getRunTimeout();
    }

    public RunState getState() {
        return state;
    }

    /**
     * Execute a complete run. Only one run executes at a time.
     */
    public synchronized CrawlSummaryDTO run() {
        Instant startedAt = Instant.now();
        CrawlSummaryDTO summary = CrawlSummaryDTO.builder().startedAt(startedAt).build();
        log.info("🌟 ===== CRAWL RUN STARTED =====");

        try {
            // Phase 1: configuration and persisted state
            transition(RunState.LOADING);
            List<Source> configured = sourceConfigService.loadSources();
            qualityTracker.load(qualityStateStore.load());
            geocoder.load(geocodeCacheStore.load());
            Set<String> excluded = qualityTracker.consumeExclusions(configured);
            List<Source> sources = configured.stream()
                    .filter(source -> !excluded.contains(source.getName()))
                    .collect(Collectors.toList());
            summary.setSourcesConfigured(configured.size());
            summary.setSourcesSkipped(new ArrayList<>(excluded));
            excluded.forEach(name -> log.warn("⏭️ Skipping {} for this run (flagged by quality tracker)", name));

            // Phase 2: fetch and extract
            transition(RunState.DISPATCHING);
            List<SourceCrawlResult> results = dispatch(sources);

            // Phase 3: merge
            transition(RunState.COLLECTING);
            List<CandidateRecord> candidates = collect(sources, results, summary);
            List<CandidateRecord> unique = recordDeduplicator.deduplicate(candidates);
            summary.setCandidateCount(candidates.size());
            summary.setDuplicatesRemoved(candidates.size() - unique.size());
            log.info("🔗 Collected {} candidates, {} after removing duplicates", candidates.size(), unique.size());

            // Phase 4: enrich
            transition(RunState.ENRICHING);
            List<EnrichedEvent> enriched = enrich(unique, sources, summary);
            List<EnrichedEvent> events = enriched.stream()
                    .filter(record -> record.getKind() == RecordKind.EVENT)
                    .collect(Collectors.toList());
            List<EnrichedEvent> locations = enriched.stream()
                    .filter(record -> record.getKind() == RecordKind.LOCATION)
                    .collect(Collectors.toList());
            summary.setEventCount(events.size());
            summary.setLocationCount(locations.size());
            summary.setGeocodeLookups(geocoder.lookupCount());

            // Phase 5: persist
            transition(RunState.PERSISTING);
            geocodeCacheStore.save(geocoder.snapshot());
            qualityStateStore.save(qualityTracker.snapshot());
            finish(summary, RunState.DONE);
            datasetWriter.write(events, locations, summary);
            transition(RunState.DONE);
        } catch (ConfigException | PersistenceException e) {
            log.error("💥 Crawl run failed in {}: {}", state, e.getMessage(), e);
            summary.setError(e.getMessage());
            finish(summary, RunState.FAILED);
            transition(RunState.FAILED);
        }

        logSummary(summary);
        return summary;
    }

    /**
     * Run every source on a fixed pool. Sources still running when the run timeout expires are
     * cancelled and reported as TIMEOUT.
     */
    private List<SourceCrawlResult> dispatch(List<Source> sources) {
        int poolSize = Math.max(1, Math.min(workerCount, sources.size()));
        ExecutorService executorService = Executors.newFixedThreadPool(poolSize);
        log.info("🚀 Dispatching {} sources on {} workers", sources.size(), poolSize);

        List<Future<SourceCrawlResult>> futures = new ArrayList<>();
        for (Source source : sources) {
            futures.add(executorService.submit(() -> sourceWorker.crawl(source)));
        }

        long deadline = System.nanoTime() + runTimeout.toNanos();
        List<SourceCrawlResult> results = new ArrayList<>();
        try {
            for (int i = 0; i < sources.size(); i++) {
                results.add(await(sources.get(i), futures.get(i), deadline));
            }
        } finally {
            executorService.shutdownNow();
        }
        return results;
    }

    private SourceCrawlResult await(Source source, Future<SourceCrawlResult> future, long deadline) {
        long remaining = deadline - System.nanoTime();
        try {
            return future.get(Math.max(0, remaining), TimeUnit.NANOSECONDS);
        } catch (TimeoutException e) {
            if (future.cancel(true)) {
                log.warn("⏰ {} did not finish within {}; cancelled", source.getName(), runTimeout);
                return timedOut(source);
            }
            // Finished between the timeout and the cancel
            return awaitCompleted(source, future);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            future.cancel(true);
            return timedOut(source);
        } catch (ExecutionException e) {
            return workerFailed(source, e.getCause());
        }
    }

    private SourceCrawlResult awaitCompleted(Source source, Future<SourceCrawlResult> future) {
        try {
            return future.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return timedOut(source);
        } catch (ExecutionException e) {
            return workerFailed(source, e.getCause());
        }
    }

    private SourceCrawlResult timedOut(Source source) {
        FetchAttempt attempt = FetchAttempt.builder()
                .sourceName(source.getName())
                .timestamp(Instant.now())
                .outcome(FetchOutcome.TIMEOUT)
                .error("Run timeout of " + runTimeout + " exceeded")
                .build();
        return new SourceCrawlResult(source, attempt, List.of());
    }

    private SourceCrawlResult workerFailed(Source source, Throwable cause) {
        log.error("❌ Worker for {} failed unexpectedly", source.getName(), cause);
        FetchAttempt attempt = FetchAttempt.builder()
                .sourceName(source.getName())
                .timestamp(Instant.now())
                .outcome(FetchOutcome.PARSE_ERROR)
                .error(cause != null ? cause.getMessage() : "worker failed")
                .build();
        return new SourceCrawlResult(source, attempt, List.of());
    }

    /**
     * Report every attempt exactly once and flatten the records in (source order, item index) order
     */
    private List<CandidateRecord> collect(List<Source> sources, List<SourceCrawlResult> results, CrawlSummaryDTO summary) {
        List<CandidateRecord> candidates = new ArrayList<>();
        int skippedItems = 0;

        for (int i = 0; i < results.size(); i++) {
            SourceCrawlResult result = results.get(i);
            FetchAttempt attempt = result.getAttempt();
            qualityTracker.report(result.getSource(), attempt);

            switch (attempt.getOutcome()) {
                case SUCCESS -> summary.setSourcesSucceeded(summary.getSourcesSucceeded() + 1);
                case EMPTY -> summary.setSourcesEmpty(summary.getSourcesEmpty() + 1);
                case TIMEOUT -> {
                    summary.setTimeouts(summary.getTimeouts() + 1);
                    summary.setSourcesFailed(summary.getSourcesFailed() + 1);
                }
                default -> summary.setSourcesFailed(summary.getSourcesFailed() + 1);
            }
            skippedItems += attempt.getSkippedItems();
            summary.getSources().add(toResultDTO(result));

            result.getRecords().stream()
                    .sorted(Comparator.comparingInt(CandidateRecord::getItemIndex))
                    .forEach(candidates::add);
        }

        summary.setSourcesAttempted(sources.size());
        summary.setSkippedItems(skippedItems);
        return candidates;
    }

    private SourceResultDTO toResultDTO(SourceCrawlResult result) {
        Source source = result.getSource();
        FetchAttempt attempt = result.getAttempt();
        return SourceResultDTO.builder()
                .sourceName(source.getName())
                .url(source.getUrl())
                .format(source.getFormat() != null ? source.getFormat().getYamlKey() : null)
                .outcome(attempt.getOutcome())
                .httpStatus(attempt.getHttpStatus())
                .itemCount(attempt.getItemCount())
                .skippedItems(attempt.getSkippedItems())
                .retries(attempt.getRetries())
                .latencyMs(attempt.getLatencyMs())
                .responseSize(attempt.getResponseSize())
                .score(qualityTracker.score(source))
                .error(attempt.getError())
                .build();
    }

    /**
     * Enrich records in parallel; the output keeps the input order. Records the enricher rejects
     * are counted as dropped.
     */
    private List<EnrichedEvent> enrich(List<CandidateRecord> candidates, List<Source> sources, CrawlSummaryDTO summary) {
        Map<String, Source> sourcesByName = sources.stream()
                .collect(Collectors.toMap(Source::getName, source -> source));
        AtomicInteger dropped = new AtomicInteger();

        List<CompletableFuture<EnrichedEvent>> futures = candidates.stream()
                .map(candidate -> CompletableFuture.supplyAsync(
                        () -> enrichOne(candidate, sourcesByName.get(candidate.getSourceName()), dropped),
                        enrichmentTaskExecutor))
                .collect(Collectors.toList());

        List<EnrichedEvent> enriched = futures.stream()
                .map(CompletableFuture::join)
                .filter(Objects::nonNull)
                .collect(Collectors.toList());

        summary.setDroppedRecords(dropped.get());
        log.info("✨ Enriched {} records ({} dropped)", enriched.size(), dropped.get());
        return enriched;
    }

    private EnrichedEvent enrichOne(CandidateRecord candidate, Source source, AtomicInteger dropped) {
        try {
            return enricher.enrich(candidate, source);
        } catch (EnrichmentException e) {
            log.debug("Dropping record: {}", e.getMessage());
            dropped.incrementAndGet();
            return null;
        } catch (RuntimeException e) {
            log.warn("⚠️ Unexpected enrichment failure for '{}': {}", candidate.getTitle(), e.getMessage());
            dropped.incrementAndGet();
            return null;
        }
    }

    private void transition(RunState next) {
        log.info("📍 {} → {}", state, next);
        state = next;
    }

    private static void finish(CrawlSummaryDTO summary, RunState finalState) {
        Instant finishedAt = Instant.now();
        summary.setFinishedAt(finishedAt);
        summary.setDurationSeconds(Duration.between(summary.getStartedAt(), finishedAt).toMillis() / 1000.0);
        summary.setFinalState(finalState);
    }

    private static void logSummary(CrawlSummaryDTO summary) {
        String banner = summary.getFinalState() == RunState.DONE ? "🎉 ===== CRAWL RUN COMPLETED =====" : "💥 ===== CRAWL RUN FAILED =====";
        log.info(banner);
        log.info("📊 Sources: {} configured, {} skipped, {} attempted, {} succeeded, {} empty, {} failed ({} timeouts)",
                summary.getSourcesConfigured(), summary.getSourcesSkipped().size(), summary.getSourcesAttempted(),
                summary.getSourcesSucceeded(), summary.getSourcesEmpty(), summary.getSourcesFailed(), summary.getTimeouts());
        log.info("📊 Records: {} candidates, {} duplicates, {} dropped, {} items skipped → {} events, {} locations",
                summary.getCandidateCount(), summary.getDuplicatesRemoved(), summary.getDroppedRecords(),
                summary.getSkippedItems(), summary.getEventCount(), summary.getLocationCount());
        log.info("📊 Geocode lookups: {}, duration: {}s", summary.getGeocodeLookups(), summary.getDurationSeconds());
    }
}
