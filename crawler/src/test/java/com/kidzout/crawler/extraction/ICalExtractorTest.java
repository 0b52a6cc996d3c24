package com.kidzout.crawler.extraction;

import com.kidzout.crawler.config.CrawlerConfig;
import com.kidzout.crawler.exception.DocumentParseException;
import com.kidzout.crawler.model.CandidateRecord;
import com.kidzout.crawler.model.EventTime;
import com.kidzout.crawler.model.enums.SourceFormat;
import com.kidzout.crawler.support.TestSources;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.time.ZoneOffset;
import org.junit.jupiter.api.Test;

import static com.kidzout.crawler.support.TestSources.utf8;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ICalExtractorTest {

    private static final String CALENDAR = String.join("\r\n",
            "BEGIN:VCALENDAR",
            "VERSION:2.0",
            "PRODID:-//Stadtteilzentrum//DE",
            "BEGIN:VEVENT",
            "UID:1@example",
            "SUMMARY:Kinderflohmarkt im Hof",
            "DTSTART;TZID=Europe/Berlin:20250510T090000",
            "DTEND;TZID=Europe/Berlin:20250510T130000",
            "LOCATION:Innenhof\\, Stadtteilzentrum",
            "DESCRIPTION:Spielzeug und Kleidung\\nfür Kinder bis 12",
            "  Jahre",
            "GEO:48.137;11.575",
            "URL:https://ical.example/flohmarkt",
            "BEGIN:VALARM",
            "ACTION:DISPLAY",
            "SUMMARY:Erinnerung",
            "END:VALARM",
            "END:VEVENT",
            "BEGIN:VEVENT",
            "SUMMARY:Sommerferien-Programm",
            "DTSTART;VALUE=DATE:20250801",
            "END:VEVENT",
            "BEGIN:VEVENT",
            "DTSTART:20250901T100000Z",
            "END:VEVENT",
            "BEGIN:VEVENT",
            "SUMMARY:Abgebrochen",
            "END:VCALENDAR",
            "");

    private final ICalExtractor extractor = new ICalExtractor(new CrawlerConfig());

    @Test
    void extractsEventsAndSkipsBrokenOnes() throws DocumentParseException {
        ExtractionResult result = extractor.extract(utf8(CALENDAR),
                TestSources.context(TestSources.source("Kalender", SourceFormat.ICAL)));

        assertEquals(2, result.size());
        // one without SUMMARY, one never terminated
        assertEquals(2, result.getSkippedItems());

        CandidateRecord first = result.getRecords().get(0);
        assertEquals("Kinderflohmarkt im Hof", first.getTitle());
        assertEquals("Innenhof, Stadtteilzentrum", first.getLocationText());
        assertEquals("Spielzeug und Kleidung für Kinder bis 12 Jahre", first.getDescription());
        assertEquals(ZoneId.of("Europe/Berlin"), first.getStart().getZone());
        assertEquals(LocalDateTime.of(2025, 5, 10, 9, 0), first.getStart().getDateTime());
        assertEquals(LocalDateTime.of(2025, 5, 10, 13, 0), first.getEnd().getDateTime());
        assertNotNull(first.getCoordinates());
        assertEquals(48.137, first.getCoordinates().getLatitude(), 1e-9);
        assertEquals("https://ical.example/flohmarkt", first.getUrl());

        CandidateRecord second = result.getRecords().get(1);
        assertTrue(second.getStart().isDateOnly());
        assertEquals(LocalDate.of(2025, 8, 1), second.getStart().toLocalDate());
    }

    @Test
    void parsesUtcAndFloatingTimes() {
        EventTime utc = ICalExtractor.parseTime(ICalExtractor.Property.parse("DTSTART:20250901T100000Z"));
        EventTime floating = ICalExtractor.parseTime(ICalExtractor.Property.parse("DTSTART:20250901T100000"));
        EventTime unknownZone = ICalExtractor.parseTime(ICalExtractor.Property.parse("DTSTART;TZID=Mars/Olympus:20250901T100000"));

        assertEquals(ZoneOffset.UTC, utc.getZone());
        assertTrue(floating.isFloating());
        assertTrue(unknownZone.isFloating());
    }

    @Test
    void rejectsNonCalendarDocument() {
        assertThrows(DocumentParseException.class, () -> extractor.extract(utf8("<html></html>"),
                TestSources.context(TestSources.source("Kalender", SourceFormat.ICAL))));
    }
}
