package com.kidzout.crawler.enrichment;

import com.kidzout.crawler.geocoding.Geocoder;
import com.kidzout.crawler.model.CandidateRecord;
import com.kidzout.crawler.model.EnrichedEvent;
import com.kidzout.crawler.model.Source;
import java.util.Locale;
import lombok.RequiredArgsConstructor;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

/**
 * Coordinates for a record. Coordinates already present in the markup win; otherwise the address,
 * or the location text, is geocoded together with the record's city.
 */
@Component
@Order(60)
@RequiredArgsConstructor
public class GeocodingStep implements EnrichmentStep {

    private final Geocoder geocoder;

    @Override
    public String name() {
        return "geocoding";
    }

    @Override
    public void apply(CandidateRecord candidate, Source source, EnrichedEvent event) {
        if (candidate.getCoordinates() != null) {
            event.setCoordinates(candidate.getCoordinates());
            return;
        }

        String query = query(candidate, event.getCity());
        if (query == null) {
            return;
        }
        geocoder.resolve(query).ifPresent(event::setCoordinates);
    }

    static String query(CandidateRecord candidate, String city) {
        String place = candidate.getAddress() != null && !candidate.getAddress().isBlank()
                ? candidate.getAddress()
                : candidate.getLocationText();
        if (place == null || place.isBlank()) {
            return null;
        }
        if (city == null || place.toLowerCase(Locale.GERMAN).contains(city.toLowerCase(Locale.GERMAN))) {
            return place.trim();
        }
        return place.trim() + ", " + city;
    }
}
