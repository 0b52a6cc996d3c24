package com.kidzout.crawler.extraction;

import com.kidzout.crawler.config.CrawlerConfig;
import com.kidzout.crawler.model.CandidateRecord;
import com.kidzout.crawler.model.SourceSelectors;
import com.kidzout.crawler.model.enums.SourceFormat;
import com.kidzout.crawler.support.TestSources;
import java.time.LocalDate;
import java.time.LocalDateTime;
import org.junit.jupiter.api.Test;

import static com.kidzout.crawler.support.TestSources.utf8;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;

class HtmlHeuristicExtractorTest {

    private final HtmlHeuristicExtractor extractor = new HtmlHeuristicExtractor(new CrawlerConfig());

    @Test
    void usesConfiguredSelectors() {
        String html = """
                <html><body><main>
                  <section class="programm">
                    <article class="termin">
                      <h3 class="name">Zirkusworkshop für Kinder</h3>
                      <time datetime="2025-06-14T10:00">Sa, 14. Juni, 10 Uhr</time>
                      <p class="text">Jonglieren und Balancieren im Zirkuszelt</p>
                      <a href="/programm/zirkus">Mehr</a>
                    </article>
                    <article class="termin">
                      <h3 class="name">Waldentdecker</h3>
                      <p class="text">Treffpunkt am Parkplatz, 21.06.2025 um 14:30 Uhr</p>
                    </article>
                    <article class="termin"><h3>Kurz</h3></article>
                  </section>
                </main></body></html>
                """;
        SourceSelectors selectors = SourceSelectors.builder()
                .item("article.termin").title(".name").date("time").description(".text").build();
        ExtractionContext context = ExtractionContext.builder()
                .source(TestSources.source("Programm", SourceFormat.HTML, selectors))
                .baseUrl("https://programm.example/kinder")
                .build();

        ExtractionResult result = extractor.extract(utf8(html), context);

        assertEquals(2, result.size());
        CandidateRecord first = result.getRecords().get(0);
        assertEquals("Zirkusworkshop für Kinder", first.getTitle());
        assertEquals(LocalDateTime.of(2025, 6, 14, 10, 0), first.getStart().getDateTime());
        assertEquals("Jonglieren und Balancieren im Zirkuszelt", first.getDescription());
        assertEquals("https://programm.example/programm/zirkus", first.getUrl());

        CandidateRecord second = result.getRecords().get(1);
        assertEquals(LocalDateTime.of(2025, 6, 21, 14, 30), second.getStart().getDateTime());
        assertEquals("https://programm.example/kinder", second.getUrl());
    }

    @Test
    void readsLocationBlocks() {
        String html = """
                <html><body>
                  <div class="place-item" data-lat="48.1351" data-lng="11.5820">
                    <h2>Abenteuerspielplatz Neuhausen</h2>
                    <span class="adresse">Hübnerstraße 8, 80637 München</span>
                    <span class="opening-hours">Di-Fr 13-18 Uhr</span>
                  </div>
                </body></html>
                """;
        SourceSelectors selectors = SourceSelectors.builder().address(".adresse").build();

        ExtractionResult result = extractor.extract(utf8(html), TestSources.context(
                TestSources.source("Plätze", SourceFormat.LOCATION_DIRECTORY, selectors)));

        assertEquals(1, result.size());
        CandidateRecord place = result.getRecords().get(0);
        assertEquals("Abenteuerspielplatz Neuhausen", place.getTitle());
        assertEquals("Hübnerstraße 8, 80637 München", place.getAddress());
        assertEquals("Di-Fr 13-18 Uhr", place.getOpeningHoursText());
        assertNotNull(place.getCoordinates());
        assertNull(place.getStart());
    }

    @Test
    void findsDateInFreeText() {
        assertEquals(LocalDate.of(2025, 3, 1), DateTimeNormalizer.parse(
                DateTimeNormalizer.findDateText("Vorlesen am 1. März 2025 in der Bücherei").orElseThrow(), 2025).toLocalDate());
    }
}
