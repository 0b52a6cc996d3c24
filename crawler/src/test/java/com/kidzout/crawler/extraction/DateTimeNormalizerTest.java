package com.kidzout.crawler.extraction;

import com.kidzout.crawler.model.EventTime;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.time.ZoneOffset;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class DateTimeNormalizerTest {

    @Test
    void parsesRfc822WithNumericOffset() {
        EventTime time = DateTimeNormalizer.parse("Tue, 04 Mar 2025 16:30:00 +0100", 2025);

        assertEquals(LocalDateTime.of(2025, 3, 4, 16, 30), time.getDateTime());
        assertEquals(ZoneOffset.ofHours(1), time.getZone());
        assertEquals("2025-03-04T16:30:00+01:00", time.toIsoString());
    }

    @Test
    void parsesRfc822WithNamedZone() {
        EventTime time = DateTimeNormalizer.parse("Tue, 04 Mar 2025 16:30:00 GMT", 2025);

        assertEquals(ZoneOffset.UTC, time.getZone());
    }

    @Test
    void isoUtcAndFloating() {
        assertEquals(ZoneOffset.UTC, DateTimeNormalizer.parse("2025-03-04T16:30:00Z", 2025).getZone());
        assertTrue(DateTimeNormalizer.parse("2025-03-04T16:30", 2025).isFloating());
        assertTrue(DateTimeNormalizer.parse("2025-03-04", 2025).isDateOnly());
    }

    @Test
    void parsesGermanNumericDates() {
        assertEquals(LocalDateTime.of(2025, 3, 8, 15, 0), DateTimeNormalizer.parse("Sa, 08.03.2025, 15:00 Uhr", 2025).getDateTime());
        assertEquals(LocalDate.of(2025, 3, 8), DateTimeNormalizer.parse("8.3.25", 2025).toLocalDate());
        assertTrue(DateTimeNormalizer.parse("08.03.2025", 2025).isDateOnly());
    }

    @Test
    void germanMonthNameUsesReferenceYearWhenMissing() {
        EventTime time = DateTimeNormalizer.parse("15. Oktober um 10.30 Uhr", 2026);

        assertEquals(LocalDateTime.of(2026, 10, 15, 10, 30), time.getDateTime());
        assertTrue(time.isFloating());
    }

    @Test
    void zoneIdIsKeptWhenNotAnOffset() {
        EventTime time = EventTime.zoned(LocalDateTime.of(2025, 7, 1, 9, 0), ZoneId.of("Europe/Berlin"));

        assertEquals("2025-07-01T09:00:00+02:00[Europe/Berlin]", time.toIsoString());
    }

    @Test
    void unreadableOrImpossibleDatesAreAbsent() {
        assertNull(DateTimeNormalizer.parse("jeden Samstag", 2025));
        assertNull(DateTimeNormalizer.parse("31.02.2025", 2025));
        assertNull(DateTimeNormalizer.parse("   ", 2025));
    }
}
