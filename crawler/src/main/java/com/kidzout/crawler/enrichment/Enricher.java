package com.kidzout.crawler.enrichment;

import com.kidzout.crawler.config.CrawlerConfig;
import com.kidzout.crawler.exception.EnrichmentException;
import com.kidzout.crawler.model.CandidateRecord;
import com.kidzout.crawler.model.EnrichedEvent;
import com.kidzout.crawler.model.Source;
import com.kidzout.crawler.model.enums.RecordKind;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Clock;
import java.util.HexFormat;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

/**
 * Turns a candidate record into an {@link EnrichedEvent} by running the enrichment steps in order.
 * <p>
 * Only a record without title or source is rejected. Any single step may fail without affecting
 * the others; its fields simply stay absent.
 */
@Service
@Slf4j
public class Enricher {

    private static final int TITLE_LIMIT = 200;

    private final List<EnrichmentStep> steps;
    private final CrawlerConfig.Defaults defaults;
    private final Clock clock;

    @Autowired
    public Enricher(List<EnrichmentStep> steps, CrawlerConfig crawlerConfig) {
        this(steps, crawlerConfig.getDefaults(), Clock.systemUTC());
    }

    public Enricher(List<EnrichmentStep> steps, CrawlerConfig.Defaults defaults, Clock clock) {
        this.steps = List.copyOf(steps);
        this.defaults = defaults;
        this.clock = clock;
    }

    public EnrichedEvent enrich(CandidateRecord candidate, Source source) throws EnrichmentException {
        if (source == null || candidate.getSourceName() == null) {
            throw new EnrichmentException("Record '" + candidate.getTitle() + "' has no source");
        }
        if (candidate.getTitle() == null || candidate.getTitle().isBlank()) {
            throw new EnrichmentException("Record #" + candidate.getItemIndex() + " from " + source.getName() + " has no title");
        }

        String title = candidate.getTitle().trim();
        if (title.length() > TITLE_LIMIT) {
            title = title.substring(0, TITLE_LIMIT);
        }
        RecordKind kind = candidate.getKind() != null ? candidate.getKind() : source.getRecordKind();

        EnrichedEvent event = EnrichedEvent.builder()
                .id(stableId(kind, title, candidate))
                .kind(kind)
                .source(source.getName())
                .sourceUrl(source.getUrl())
                .extractionFormat(candidate.getFormat())
                .itemIndex(candidate.getItemIndex())
                .title(title)
                .description(candidate.getDescription())
                .start(candidate.getStart())
                .end(candidate.getEnd())
                .timeExpression(candidate.getTimeExpression())
                .location(candidate.getLocationText())
                .address(candidate.getAddress())
                .url(candidate.getUrl() != null ? candidate.getUrl() : source.getUrl())
                .city(source.getCity() != null ? source.getCity() : defaults.getCity())
                .region(defaults.getRegion())
                .country(defaults.getCountry())
                .lastUpdated(clock.instant())
                .build();

        for (EnrichmentStep step : steps) {
            try {
                step.apply(candidate, source, event);
            } catch (EnrichmentException | RuntimeException e) {
                log.debug("Enrichment step '{}' failed for '{}': {}", step.name(), title, e.getMessage());
            }
        }
        return event;
    }

    /**
     * {@code ev-}/{@code loc-} plus the first 16 hex digits of SHA-1 over "title|date|link"
     */
    static String stableId(RecordKind kind, String title, CandidateRecord candidate) {
        String date = candidate.getStart() != null ? candidate.getStart().toLocalDate().toString() : "";
        String link = candidate.getUrl() != null ? candidate.getUrl() : "";
        return kind.getIdPrefix() + sha1Hex(title + "|" + date + "|" + link).substring(0, 16);
    }

    private static String sha1Hex(String value) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-1");
            return HexFormat.of().formatHex(digest.digest(value.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            // Every JRE ships SHA-1
            throw new IllegalStateException(e);
        }
    }
}
