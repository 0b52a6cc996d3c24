package com.kidzout.crawler.enrichment;

import com.kidzout.crawler.model.CandidateRecord;
import com.kidzout.crawler.model.EnrichedEvent;
import com.kidzout.crawler.model.Source;
import lombok.RequiredArgsConstructor;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

@Component
@Order(40)
@RequiredArgsConstructor
public class OpeningHoursStep implements EnrichmentStep {

    private final OpeningHoursParser openingHoursParser;

    @Override
    public String name() {
        return "opening-hours";
    }

    @Override
    public void apply(CandidateRecord candidate, Source source, EnrichedEvent event) {
        String text = candidate.getOpeningHoursText();
        if (text == null || text.isBlank()) {
            return;
        }
        event.setOpeningHours(openingHoursParser.parse(text));
    }
}
