package com.kidzout.crawler.enrichment;

import com.kidzout.crawler.model.CandidateRecord;
import com.kidzout.crawler.model.EnrichedEvent;
import com.kidzout.crawler.model.Source;
import com.kidzout.crawler.model.enums.RecordKind;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

/**
 * Display name for the kids view: an emoji matching the record's theme plus the first 50
 * characters of the title.
 */
@Component
@Order(30)
public class KidsNameStep implements EnrichmentStep {

    static final int NAME_LENGTH = 50;

    private static final KeywordTaxonomy EVENT_EMOJI = KeywordTaxonomy.builder()
            .label("🎭", "theater", "puppentheater", "kasperl")
            .label("🎨", "workshop", "basteln")
            .label("🎵", "musik", "konzert")
            .label("⚽", "sport", "bewegung")
            .label("🏛️", "museum")
            .build();

    private static final KeywordTaxonomy LOCATION_EMOJI = KeywordTaxonomy.builder()
            .label("🏞️", "spielplatz")
            .label("🏛️", "museum")
            .label("🏠", "indoor", "halle")
            .label("🏊", "schwimm", "bad")
            .label("🦁", "tier", "zoo")
            .build();

    @Override
    public String name() {
        return "kids-name";
    }

    @Override
    public void apply(CandidateRecord candidate, Source source, EnrichedEvent event) {
        String title = candidate.getTitle().trim();
        String text = title + " " + (candidate.getDescription() != null ? candidate.getDescription() : "");

        String emoji;
        if (candidate.getKind() == RecordKind.LOCATION) {
            emoji = LOCATION_EMOJI.match(text).orElse("spielplatz".equals(event.getCategory()) ? "🏞️" : "🎯");
        } else {
            emoji = EVENT_EMOJI.match(text).orElse("🎉");
        }

        String shortName = title.length() > NAME_LENGTH ? title.substring(0, NAME_LENGTH) : title;
        event.setNameKids(emoji + " " + shortName);
    }
}
