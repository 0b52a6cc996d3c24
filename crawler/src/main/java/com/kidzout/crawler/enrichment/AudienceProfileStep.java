package com.kidzout.crawler.enrichment;

import com.kidzout.crawler.model.CandidateRecord;
import com.kidzout.crawler.model.EnrichedEvent;
import com.kidzout.crawler.model.Source;
import com.kidzout.crawler.model.enums.RecordKind;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

/**
 * Weather suitability and energy level for all records; amenities and highlights for locations.
 */
@Component
@Order(50)
public class AudienceProfileStep implements EnrichmentStep {

    private static final KeywordTaxonomy WEATHER = KeywordTaxonomy.builder()
            .label("good-weather", "draußen", "outdoor", "garten", "park", "spielplatz", "wandern", "freibad")
            .label("indoor", "drinnen", "indoor", "halle", "museum", "theater", "kino")
            .build();

    private static final KeywordTaxonomy ENERGY = KeywordTaxonomy.builder()
            .label("high", "sport", "toben", "klettern", "rennen", "action", "trampolin", "spielplatz")
            .label("low", "basteln", "malen", "lesen", "märchen", "ruhig", "museum", "vorlesen")
            .build();

    private static final KeywordTaxonomy AMENITIES = KeywordTaxonomy.builder()
            .label("Wickelraum", "wickel")
            .label("WC", "wc", "toilette")
            .label("Parkplatz", "parkplatz", "parkplätze")
            .label("Rollstuhlgerecht", "rollstuhl", "barrierefrei")
            .label("Café", "café", "cafe", "kiosk", "gastronomie")
            .build();

    private static final Pattern FREE_ENTRY = Pattern.compile(
            "(?<!\\p{L})(kostenlos|kostenfrei|eintritt frei|freier eintritt|free entry|gratis)(?!\\p{L})");
    private static final Pattern PARKING = Pattern.compile("(?<!\\p{L})(parkplatz|parkplätze|parken)");
    private static final Pattern TRANSIT = Pattern.compile("(?<!\\p{L})(öpnv|u-bahn|s-bahn|tram|bus|haltestelle)(?!\\p{L})");

    @Override
    public String name() {
        return "audience-profile";
    }

    @Override
    public void apply(CandidateRecord candidate, Source source, EnrichedEvent event) {
        String text = (candidate.getTitle() + " " + (candidate.getDescription() != null ? candidate.getDescription() : ""))
                .toLowerCase(Locale.GERMAN);

        event.setWeatherSuitability(WEATHER.match(text).orElse("any"));
        event.setEnergyLevel(ENERGY.match(text).orElse("medium"));

        if (candidate.getKind() != RecordKind.LOCATION) {
            return;
        }

        List<String> amenities = new ArrayList<>();
        for (String amenity : List.of("Wickelraum", "WC", "Parkplatz", "Rollstuhlgerecht", "Café")) {
            if (AMENITIES.matches(amenity, text)) {
                amenities.add(amenity);
            }
        }
        if (!amenities.isEmpty()) {
            event.setAmenities(amenities);
        }

        List<String> highlights = new ArrayList<>();
        if (FREE_ENTRY.matcher(text).find()) highlights.add("Kostenloser Eintritt");
        if (PARKING.matcher(text).find()) highlights.add("Parkplätze vorhanden");
        if (TRANSIT.matcher(text).find()) highlights.add("Gut mit Öffis erreichbar");
        if (!highlights.isEmpty()) {
            event.setHighlights(highlights);
        }
    }
}
