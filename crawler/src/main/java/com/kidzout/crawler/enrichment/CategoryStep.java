package com.kidzout.crawler.enrichment;

import com.kidzout.crawler.model.CandidateRecord;
import com.kidzout.crawler.model.EnrichedEvent;
import com.kidzout.crawler.model.Source;
import com.kidzout.crawler.model.enums.RecordKind;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

/**
 * Normalized category from title and description keywords. Events and locations use separate
 * tables; the source's first configured category is the fallback.
 */
@Component
@Order(10)
public class CategoryStep implements EnrichmentStep {

    static final KeywordTaxonomy EVENT_CATEGORIES = KeywordTaxonomy.builder()
            .label("theater", "theater", "puppentheater", "kasperl", "bühne", "musical")
            .label("museum", "museum", "ausstellung", "galerie", "kunst")
            .label("outdoor", "spielplatz", "outdoor", "park", "garten", "wandern", "natur", "draußen")
            .label("indoor", "indoor", "halle", "drinnen")
            .label("kreativ", "workshop", "basteln", "kreativ", "malen", "werken", "kurs")
            .label("schwimmbad", "schwimmen", "baden", "pool", "freibad", "hallenbad", "wasser")
            .label("sport", "sport", "turnen", "fußball", "klettern", "bewegung", "tanz")
            .label("musik", "musik", "konzert", "singen", "instrument")
            .label("kino", "kino", "film", "vorführung")
            .label("festival", "fest", "festival", "markt", "feier")
            .build();

    static final KeywordTaxonomy LOCATION_CATEGORIES = KeywordTaxonomy.builder()
            .label("spielplatz", "spielplatz", "abenteuerspielplatz", "playground")
            .label("museum", "museum")
            .label("indoor", "indoor", "halle", "spielhalle")
            .label("schwimmbad", "schwimm", "bad", "hallenbad", "freibad", "therme")
            .label("tierpark", "tier", "zoo", "wildpark")
            .label("outdoor", "park", "garten", "wald", "see")
            .build();

    @Override
    public String name() {
        return "category";
    }

    @Override
    public void apply(CandidateRecord candidate, Source source, EnrichedEvent event) {
        String text = candidate.getTitle() + " " + (candidate.getDescription() != null ? candidate.getDescription() : "");
        KeywordTaxonomy taxonomy = candidate.getKind() == RecordKind.LOCATION ? LOCATION_CATEGORIES : EVENT_CATEGORIES;

        String category = taxonomy.match(text)
                .orElseGet(() -> fallback(source, candidate.getKind()));
        event.setCategory(category);
    }

    private static String fallback(Source source, RecordKind kind) {
        if (source.getCategories() != null && !source.getCategories().isEmpty()) {
            return source.getCategories().get(0);
        }
        return kind == RecordKind.LOCATION ? "location" : "event";
    }
}
