package com.kidzout.crawler.scraping;

import com.kidzout.crawler.exception.DocumentParseException;
import com.kidzout.crawler.exception.FetchException;
import com.kidzout.crawler.extraction.ExtractionContext;
import com.kidzout.crawler.extraction.ExtractionResult;
import com.kidzout.crawler.extraction.ExtractionService;
import com.kidzout.crawler.model.FetchAttempt;
import com.kidzout.crawler.model.Source;
import com.kidzout.crawler.model.enums.FetchOutcome;
import com.kidzout.crawler.scraping.fetch.FetchResult;
import com.kidzout.crawler.scraping.fetch.Fetcher;
import com.kidzout.crawler.scraping.fetch.RequestHeaderFactory;
import java.time.Instant;
import java.time.ZoneId;
import java.util.List;
import java.util.concurrent.TimeUnit;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Crawls a single source: waits for the domain's rate-limit slot, fetches, and extracts.
 * <p>
 * Never throws for source-level problems; every path ends in a {@link FetchAttempt} describing
 * the outcome.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class SourceWorker {

    private final Fetcher fetcher;
    private final RateLimiter rateLimiter;
    private final RequestHeaderFactory requestHeaderFactory;
    private final ExtractionService extractionService;

    public SourceCrawlResult crawl(Source source) {
        String domain = source.getDomain();
        Instant startedAt = Instant.now();
        long started = System.nanoTime();
        log.info("🔍 Crawling {} ({})", source.getName(), source.getUrl());

        try {
            rateLimiter.acquire(domain);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return failure(source, startedAt, started, FetchOutcome.TIMEOUT, null, 0, "Cancelled while waiting for rate limit");
        }

        FetchResult response;
        try {
            response = fetcher.fetch(source.getUrl(), requestHeaderFactory.headersFor(source.getUrl()));
        } catch (FetchException e) {
            rateLimiter.recordFailure(domain);
            FetchOutcome outcome = e.isTimeout() ? FetchOutcome.TIMEOUT : FetchOutcome.HTTP_ERROR;
            log.warn("   ❌ {}: {} after {} retries ({})", source.getName(), outcome, e.getRetries(), e.getMessage());
            return failure(source, startedAt, started, outcome, e.getStatusCode(), e.getRetries(), e.getMessage());
        }
        rateLimiter.recordSuccess(domain);

        ExtractionContext context = ExtractionContext.builder()
                .source(source)
                .baseUrl(response.getUrl() != null ? response.getUrl() : source.getUrl())
                .charsetName(response.charsetName())
                .referenceYear(startedAt.atZone(ZoneId.systemDefault()).getYear())
                .build();

        FetchAttempt.FetchAttemptBuilder attempt = FetchAttempt.builder()
                .sourceName(source.getName())
                .timestamp(startedAt)
                .httpStatus(response.getStatusCode())
                .responseSize(response.size())
                .retries(response.getRetries());

        try {
            ExtractionResult result = extractionService.extract(response.getBody(), context);
            FetchOutcome outcome = result.isEmpty() ? FetchOutcome.EMPTY : FetchOutcome.SUCCESS;
            if (outcome == FetchOutcome.EMPTY) {
                log.info("   ⚠️ {}: no records found", source.getName());
            } else {
                log.info("   ✅ {}: {} records ({} items skipped)", source.getName(), result.size(), result.getSkippedItems());
            }
            return new SourceCrawlResult(source, attempt
                    .outcome(outcome)
                    .itemCount(result.size())
                    .skippedItems(result.getSkippedItems())
                    .latencyMs(elapsedMs(started))
                    .build(), result.getRecords());
        } catch (DocumentParseException e) {
            log.warn("   ❌ {}: unreadable document ({})", source.getName(), e.getMessage());
            return new SourceCrawlResult(source, attempt
                    .outcome(FetchOutcome.PARSE_ERROR)
                    .latencyMs(elapsedMs(started))
                    .error(e.getMessage())
                    .build(), List.of());
        } catch (RuntimeException e) {
            log.error("   ❌ {}: extraction failed", source.getName(), e);
            return new SourceCrawlResult(source, attempt
                    .outcome(FetchOutcome.PARSE_ERROR)
                    .latencyMs(elapsedMs(started))
                    .error(e.getClass().getSimpleName() + ": " + e.getMessage())
                    .build(), List.of());
        }
    }

    private static SourceCrawlResult failure(Source source, Instant startedAt, long started, FetchOutcome outcome,
                                             Integer status, int retries, String error) {
        FetchAttempt attempt = FetchAttempt.builder()
                .sourceName(source.getName())
                .timestamp(startedAt)
                .outcome(outcome)
                .httpStatus(status)
                .latencyMs(elapsedMs(started))
                .retries(retries)
                .error(error)
                .build();
        return new SourceCrawlResult(source, attempt, List.of());
    }

    private static long elapsedMs(long startedNanos) {
        return TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startedNanos);
    }
}
