package com.kidzout.crawler.scraping;

import com.fasterxml.jackson.databind.JsonNode;
import com.kidzout.crawler.config.CrawlerConfig;
import com.kidzout.crawler.exception.FetchException;
import com.kidzout.crawler.geocoding.Geocoder;
import com.kidzout.crawler.model.SourceStats;
import com.kidzout.crawler.model.dto.CrawlSummaryDTO;
import com.kidzout.crawler.model.dto.SourceResultDTO;
import com.kidzout.crawler.model.enums.FetchOutcome;
import com.kidzout.crawler.model.enums.RunState;
import com.kidzout.crawler.output.AtomicJsonWriter;
import com.kidzout.crawler.output.DatasetWriter;
import com.kidzout.crawler.output.GeocodeCacheStore;
import com.kidzout.crawler.output.QualityStateStore;
import com.kidzout.crawler.quality.SourceQualityTracker;
import com.kidzout.crawler.scraping.fetch.RequestHeaderFactory;
import com.kidzout.crawler.support.FakeFetcher;
import com.kidzout.crawler.support.FakeGeocodingProvider;
import com.kidzout.crawler.support.TestPipeline;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.core.io.DefaultResourceLoader;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class CrawlOrchestratorTest {

    private static final String THREE_SOURCES = """
            sources:
              - name: A
                url: https://a.example/feed
                format: rss
              - name: B
                url: https://b.example/feed
                format: rss
              - name: C
                url: https://c.example/feed
                format: rss
            """;

    @TempDir
    Path tempDir;

    private CrawlerConfig config;
    private FakeFetcher fetcher;
    private AtomicJsonWriter jsonWriter;
    private QualityStateStore qualityStateStore;

    @BeforeEach
    void setUp() {
        config = new CrawlerConfig();
        config.setSourcesFile(tempDir.resolve("sources.yml").toString());
        config.getGeocoder().setEnabled(false);
        fetcher = new FakeFetcher();
        jsonWriter = new AtomicJsonWriter(config);
        qualityStateStore = new QualityStateStore(jsonWriter, tempDir.resolve("crawler_stats.json"));
    }

    private CrawlOrchestrator orchestrator() {
        RateLimiter rateLimiter = RateLimiter.fixedInterval(Duration.ZERO);
        SourceWorker worker = new SourceWorker(fetcher, rateLimiter, new RequestHeaderFactory(config),
                TestPipeline.extractionService(config));
        Geocoder geocoder = new Geocoder(new FakeGeocodingProvider(), config.getGeocoder(), Clock.systemUTC());
        return new CrawlOrchestrator(
                new SourceConfigService(new DefaultResourceLoader(), config),
                worker,
                new RecordDeduplicator(),
                TestPipeline.enricher(geocoder, config, Clock.systemUTC()),
                new SourceQualityTracker(config),
                geocoder,
                new DatasetWriter(jsonWriter, dataFile()),
                new GeocodeCacheStore(jsonWriter, tempDir.resolve("geocode_cache.json")),
                qualityStateStore,
                Runnable::run,
                config);
    }

    private Path dataFile() {
        return tempDir.resolve("data.json");
    }

    private void writeSources(String yaml) throws IOException {
        Files.writeString(tempDir.resolve("sources.yml"), yaml, StandardCharsets.UTF_8);
    }

    private static Map<String, SourceResultDTO> bySource(CrawlSummaryDTO summary) {
        return summary.getSources().stream().collect(Collectors.toMap(SourceResultDTO::getSourceName, r -> r));
    }

    @Test
    void failingSourceDoesNotAffectOthers() throws IOException {
        writeSources(THREE_SOURCES);
        fetcher.respond("https://a.example/feed", TestPipeline.rss("Kinderkonzert", "Zaubershow"), TestPipeline.RSS)
                .fail("https://b.example/feed", FetchException.permanent("HTTP 403", 403))
                .respond("https://c.example/feed", TestPipeline.rss("Märchenstunde", null), TestPipeline.RSS);
        CrawlOrchestrator orchestrator = orchestrator();

        CrawlSummaryDTO summary = orchestrator.run();

        assertEquals(RunState.DONE, summary.getFinalState());
        assertEquals(RunState.DONE, orchestrator.getState());
        assertEquals(3, summary.getEventCount());
        assertEquals(2, summary.getSourcesSucceeded());
        assertEquals(1, summary.getSourcesFailed());
        assertEquals(1, summary.getSkippedItems());

        Map<String, SourceResultDTO> results = bySource(summary);
        assertEquals(FetchOutcome.HTTP_ERROR, results.get("B").getOutcome());
        assertEquals(403, results.get("B").getHttpStatus());
        assertEquals(0, results.get("B").getRetries());
        assertEquals(FetchOutcome.SUCCESS, results.get("C").getOutcome());

        JsonNode dataset = jsonWriter.objectMapper().readTree(dataFile().toFile());
        assertEquals(3, dataset.get("events").size());
        assertEquals("Kinderkonzert", dataset.get("events").get(0).get("title").asText());
        assertEquals("Zaubershow", dataset.get("events").get(1).get("title").asText());
        assertEquals("Märchenstunde", dataset.get("events").get(2).get("title").asText());
        assertEquals("DONE", dataset.get("metadata").get("finalState").asText());

        Map<String, SourceStats> persisted = qualityStateStore.load();
        assertEquals(1, persisted.get("B").getConsecutiveFailures());
        assertEquals(1, persisted.get("A").getTotalAttempts());
    }

    @Test
    @Timeout(30)
    void runTimeoutCancelsSlowSources() throws IOException {
        writeSources("""
                sources:
                  - {name: S1, url: "https://s1.example/feed", format: rss}
                  - {name: S2, url: "https://s2.example/feed", format: rss}
                  - {name: S3, url: "https://s3.example/feed", format: rss}
                  - {name: S4, url: "https://s4.example/feed", format: rss}
                  - {name: S5, url: "https://s5.example/feed", format: rss}
                """);
        for (String name : List.of("s1", "s3", "s5")) {
            fetcher.respond("https://" + name + ".example/feed", TestPipeline.rss("Termin " + name), TestPipeline.RSS);
        }
        fetcher.block("https://s2.example/feed").block("https://s4.example/feed");
        config.setRunTimeout(Duration.ofSeconds(2));

        CrawlSummaryDTO summary = orchestrator().run();

        assertEquals(RunState.DONE, summary.getFinalState());
        assertEquals(2, summary.getTimeouts());
        assertEquals(3, summary.getSourcesSucceeded());
        assertEquals(3, summary.getEventCount());
        Map<String, SourceResultDTO> results = bySource(summary);
        assertEquals(FetchOutcome.TIMEOUT, results.get("S2").getOutcome());
        assertEquals(FetchOutcome.TIMEOUT, results.get("S4").getOutcome());
        assertTrue(Files.exists(dataFile()));
    }

    @Test
    void flaggedSourceIsSkippedForOneRun() throws IOException {
        writeSources(THREE_SOURCES);
        SourceStats flagged = new SourceStats("B");
        flagged.setConsecutiveFailures(5);
        flagged.setExcludeNextRun(true);
        qualityStateStore.save(Map.of("B", flagged));
        fetcher.respond("https://a.example/feed", TestPipeline.rss("Kinderkonzert"), TestPipeline.RSS)
                .respond("https://b.example/feed", TestPipeline.rss("Wieder da"), TestPipeline.RSS)
                .respond("https://c.example/feed", TestPipeline.rss("Märchenstunde"), TestPipeline.RSS);

        CrawlSummaryDTO first = orchestrator().run();

        assertEquals(List.of("B"), first.getSourcesSkipped());
        assertEquals(3, first.getSourcesConfigured());
        assertEquals(2, first.getSourcesAttempted());
        assertFalse(fetcher.requested().contains("https://b.example/feed"));

        CrawlSummaryDTO second = orchestrator().run();

        assertTrue(second.getSourcesSkipped().isEmpty());
        assertEquals(3, second.getEventCount());
    }

    @Test
    void duplicatesAcrossSourcesAreMerged() throws IOException {
        writeSources(THREE_SOURCES);
        fetcher.respond("https://a.example/feed", TestPipeline.rss("Kinderkonzert"), TestPipeline.RSS)
                .respond("https://b.example/feed", TestPipeline.rss("KINDERKONZERT!"), TestPipeline.RSS)
                .respond("https://c.example/feed", TestPipeline.rss(), TestPipeline.RSS);

        CrawlSummaryDTO summary = orchestrator().run();

        assertEquals(2, summary.getCandidateCount());
        assertEquals(1, summary.getDuplicatesRemoved());
        assertEquals(1, summary.getEventCount());
        assertEquals(1, summary.getSourcesEmpty());
    }

    @Test
    void invalidConfigurationFailsRunWithoutOutput() throws IOException {
        writeSources("sources:\n  - name: kaputt\n    format: rss\n");
        CrawlOrchestrator orchestrator = orchestrator();

        CrawlSummaryDTO summary = orchestrator.run();

        assertEquals(RunState.FAILED, summary.getFinalState());
        assertEquals(RunState.FAILED, orchestrator.getState());
        assertNotNull(summary.getError());
        assertFalse(Files.exists(dataFile()));
    }

    @Test
    void unwritableOutputFailsRun() throws IOException {
        writeSources(THREE_SOURCES);
        fetcher.respond("https://a.example/feed", TestPipeline.rss("Kinderkonzert"), TestPipeline.RSS);
        Files.writeString(tempDir.resolve("blocker"), "file");
        CrawlOrchestrator orchestrator = new CrawlOrchestrator(
                new SourceConfigService(new DefaultResourceLoader(), config),
                new SourceWorker(fetcher, RateLimiter.fixedInterval(Duration.ZERO), new RequestHeaderFactory(config),
                        TestPipeline.extractionService(config)),
                new RecordDeduplicator(),
                TestPipeline.enricher(new Geocoder(new FakeGeocodingProvider(), config.getGeocoder(), Clock.systemUTC()),
                        config, Clock.systemUTC()),
                new SourceQualityTracker(config),
                new Geocoder(new FakeGeocodingProvider(), config.getGeocoder(), Clock.systemUTC()),
                new DatasetWriter(jsonWriter, tempDir.resolve("blocker").resolve("data.json")),
                new GeocodeCacheStore(jsonWriter, tempDir.resolve("geocode_cache.json")),
                qualityStateStore,
                Runnable::run,
                config);

        CrawlSummaryDTO summary = orchestrator.run();

        assertEquals(RunState.FAILED, summary.getFinalState());
        assertEquals(RunState.FAILED, orchestrator.getState());
    }
}
