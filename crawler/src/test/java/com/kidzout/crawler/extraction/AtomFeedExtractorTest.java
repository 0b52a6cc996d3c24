package com.kidzout.crawler.extraction;

import com.kidzout.crawler.config.CrawlerConfig;
import com.kidzout.crawler.exception.DocumentParseException;
import com.kidzout.crawler.model.CandidateRecord;
import com.kidzout.crawler.model.enums.ExtractionFormat;
import com.kidzout.crawler.model.enums.SourceFormat;
import com.kidzout.crawler.support.TestSources;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import org.junit.jupiter.api.Test;

import static com.kidzout.crawler.support.TestSources.utf8;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class AtomFeedExtractorTest {

    private static final String FEED = """
            <?xml version="1.0" encoding="utf-8"?>
            <feed xmlns="http://www.w3.org/2005/Atom">
              <title>Familienkalender</title>
              <entry>
                <title>Lesestunde in der Stadtbibliothek</title>
                <link rel="self" href="https://atom.example/api/1"/>
                <link rel="alternate" href="/termine/lesestunde"/>
                <published>2025-04-12T15:00:00+02:00</published>
                <summary>Geschichten für Kinder von 3 bis 6 Jahren</summary>
              </entry>
              <entry>
                <summary>ohne Titel</summary>
              </entry>
            </feed>
            """;

    private final AtomFeedExtractor extractor = new AtomFeedExtractor(new CrawlerConfig());

    @Test
    void extractsEntriesWithAlternateLink() throws DocumentParseException {
        ExtractionContext context = ExtractionContext.builder()
                .source(TestSources.source("Atom", SourceFormat.ATOM))
                .baseUrl("https://atom.example/feed.xml")
                .build();

        ExtractionResult result = extractor.extract(utf8(FEED), context);

        assertEquals(1, result.size());
        assertEquals(1, result.getSkippedItems());
        CandidateRecord record = result.getRecords().get(0);
        assertEquals("Lesestunde in der Stadtbibliothek", record.getTitle());
        assertEquals("https://atom.example/termine/lesestunde", record.getUrl());
        assertEquals(LocalDateTime.of(2025, 4, 12, 15, 0), record.getStart().getDateTime());
        assertEquals(ZoneOffset.ofHours(2), record.getStart().getZone());
        assertEquals(ExtractionFormat.ATOM, record.getFormat());
    }

    @Test
    void readsFeedWithPrefixedAtomNamespace() throws DocumentParseException {
        String prefixed = """
                <a:feed xmlns:a="http://www.w3.org/2005/Atom">
                  <a:entry>
                    <a:title>Kinderflohmarkt am Rathausplatz</a:title>
                    <a:link href="https://atom.example/termine/flohmarkt"/>
                    <a:updated>2025-05-17T09:00:00Z</a:updated>
                  </a:entry>
                </a:feed>
                """;

        ExtractionResult result = extractor.extract(utf8(prefixed),
                TestSources.context(TestSources.source("Atom", SourceFormat.ATOM)));

        assertEquals(1, result.size());
        CandidateRecord record = result.getRecords().get(0);
        assertEquals("Kinderflohmarkt am Rathausplatz", record.getTitle());
        assertEquals("https://atom.example/termine/flohmarkt", record.getUrl());
        assertEquals(LocalDateTime.of(2025, 5, 17, 9, 0), record.getStart().getDateTime());
    }

    @Test
    void rejectsRssDocument() {
        assertThrows(DocumentParseException.class, () -> extractor.extract(utf8("<rss><channel/></rss>"),
                TestSources.context(TestSources.source("Atom", SourceFormat.ATOM))));
    }
}
