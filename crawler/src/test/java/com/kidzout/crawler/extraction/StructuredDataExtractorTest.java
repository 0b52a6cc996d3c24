package com.kidzout.crawler.extraction;

import com.kidzout.crawler.config.CrawlerConfig;
import com.kidzout.crawler.model.CandidateRecord;
import com.kidzout.crawler.model.enums.ExtractionFormat;
import com.kidzout.crawler.model.enums.RecordKind;
import com.kidzout.crawler.model.enums.SourceFormat;
import com.kidzout.crawler.support.TestSources;
import java.time.LocalDateTime;
import org.junit.jupiter.api.Test;

import static com.kidzout.crawler.support.TestSources.utf8;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class StructuredDataExtractorTest {

    private final StructuredDataExtractor extractor = new StructuredDataExtractor(new CrawlerConfig());

    @Test
    void readsEventsFromGraphAndArrays() {
        String html = """
                <html><head>
                <script type="application/ld+json">
                {"@context": "https://schema.org", "@graph": [
                  {"@type": "Organization", "name": "Theater"},
                  {"@type": "TheaterEvent", "name": "Der Grüffelo",
                   "startDate": "2025-03-15T15:00",
                   "url": "/spielplan/grueffelo",
                   "location": {"@type": "Place", "name": "Kleine Bühne",
                     "address": {"streetAddress": "Franz-Joseph-Str. 47", "postalCode": "80801", "addressLocality": "München"}}}
                ]}
                </script>
                <script type="application/ld+json">
                [{"@type": "Event", "name": "Familienkonzert", "startDate": "irgendwann im Frühling"},
                 {"@type": "Event", "description": "ohne Namen"}]
                </script>
                <script type="application/ld+json">{ not json </script>
                </head><body></body></html>
                """;
        ExtractionContext context = ExtractionContext.builder()
                .source(TestSources.source("Theater", SourceFormat.HTML))
                .baseUrl("https://theater.example/")
                .build();

        ExtractionResult result = extractor.extract(utf8(html), context);

        assertEquals(2, result.size());
        // nameless event plus the malformed block
        assertEquals(2, result.getSkippedItems());

        CandidateRecord first = result.getRecords().get(0);
        assertEquals("Der Grüffelo", first.getTitle());
        assertEquals(LocalDateTime.of(2025, 3, 15, 15, 0), first.getStart().getDateTime());
        assertTrue(first.getStart().isFloating());
        assertEquals("Kleine Bühne", first.getLocationText());
        assertEquals("Franz-Joseph-Str. 47, 80801 München", first.getAddress());
        assertEquals("https://theater.example/spielplan/grueffelo", first.getUrl());
        assertEquals(ExtractionFormat.STRUCTURED_DATA, first.getFormat());

        CandidateRecord second = result.getRecords().get(1);
        assertEquals("irgendwann im Frühling", second.getTimeExpression());
        assertEquals(1, second.getItemIndex());
    }

    @Test
    void readsPlacesForLocationDirectories() {
        String html = """
                <script type="application/ld+json">
                {"@type": ["Playground", "Place"], "name": "Spielplatz am Weißenseepark",
                 "address": "Weißenseestraße 1, 81539 München",
                 "geo": {"latitude": "48.1099", "longitude": "11.5861"},
                 "openingHoursSpecification": [
                   {"dayOfWeek": ["https://schema.org/Monday", "https://schema.org/Friday"], "opens": "08:00:00", "closes": "20:00:00"}
                 ]}
                </script>
                <script type="application/ld+json">{"@type": "Event", "name": "Kein Ort"}</script>
                """;

        ExtractionResult result = extractor.extract(utf8(html),
                TestSources.context(TestSources.source("Spielplätze", SourceFormat.LOCATION_DIRECTORY)));

        assertEquals(1, result.size());
        CandidateRecord place = result.getRecords().get(0);
        assertEquals(RecordKind.LOCATION, place.getKind());
        assertEquals("Weißenseestraße 1, 81539 München", place.getAddress());
        assertNotNull(place.getCoordinates());
        assertEquals("Monday, Friday 08:00-20:00", place.getOpeningHoursText());
    }

    @Test
    void pageWithoutStructuredDataYieldsNothing() {
        ExtractionResult result = extractor.extract(utf8("<html><body><h1>Hallo</h1></body></html>"),
                TestSources.context(TestSources.source("Leer", SourceFormat.HTML)));

        assertTrue(result.isEmpty());
        assertEquals(0, result.getSkippedItems());
    }
}
