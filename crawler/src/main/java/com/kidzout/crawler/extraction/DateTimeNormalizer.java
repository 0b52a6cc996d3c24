package com.kidzout.crawler.extraction;

import com.kidzout.crawler.model.EventTime;
import java.time.DateTimeException;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses the date notations found in feeds and German event listings into {@link EventTime}.
 * <p>
 * Returns null instead of guessing when a value cannot be read; callers keep the raw text as the
 * record's time expression in that case.
 */
public final class DateTimeNormalizer {

    private static final Map<String, Integer> GERMAN_MONTHS = Map.ofEntries(
            Map.entry("januar", 1), Map.entry("jan", 1), Map.entry("jänner", 1),
            Map.entry("februar", 2), Map.entry("feb", 2),
            Map.entry("märz", 3), Map.entry("maerz", 3), Map.entry("mär", 3),
            Map.entry("april", 4), Map.entry("apr", 4),
            Map.entry("mai", 5),
            Map.entry("juni", 6), Map.entry("jun", 6),
            Map.entry("juli", 7), Map.entry("jul", 7),
            Map.entry("august", 8), Map.entry("aug", 8),
            Map.entry("september", 9), Map.entry("sep", 9), Map.entry("sept", 9),
            Map.entry("oktober", 10), Map.entry("okt", 10),
            Map.entry("november", 11), Map.entry("nov", 11),
            Map.entry("dezember", 12), Map.entry("dez", 12)
    );

    private static final String MONTH_NAMES =
            "Januar|Jänner|Februar|März|Maerz|April|Mai|Juni|Juli|August|September|Oktober|November|Dezember"
                    + "|Jan|Feb|Mär|Apr|Jun|Jul|Aug|Sept|Sep|Okt|Nov|Dez";

    // 01.03.2025, 1.3.25, optionally followed by a time such as "10:00" or "10.30 Uhr"
    private static final Pattern GERMAN_NUMERIC = Pattern.compile(
            "\\b(\\d{1,2})\\.(\\d{1,2})\\.(\\d{2,4})(?:\\s*,?\\s*(?:um\\s*)?(\\d{1,2})[:.](\\d{2})(?:\\s*Uhr)?)?");

    // 1. März 2025, 1. März (year optional)
    private static final Pattern GERMAN_MONTH_NAME = Pattern.compile(
            "\\b(\\d{1,2})\\.\\s*(" + MONTH_NAMES + ")\\.?(?:\\s+(\\d{4}))?"
                    + "(?:\\s*,?\\s*(?:um\\s*)?(\\d{1,2})[:.](\\d{2})(?:\\s*Uhr)?)?",
            Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE);

    private static final Pattern ISO_DATE_IN_TEXT = Pattern.compile("\\b\\d{4}-\\d{2}-\\d{2}(?:T\\d{2}:\\d{2}(?::\\d{2})?)?");

    private static final List<Pattern> DATE_PATTERNS = List.of(GERMAN_NUMERIC, GERMAN_MONTH_NAME, ISO_DATE_IN_TEXT);

    private static final DateTimeFormatter RFC_822_NAMED_ZONE =
            DateTimeFormatter.ofPattern("[EEE, ]d MMM yyyy HH:mm[:ss] z", Locale.ENGLISH);

    private DateTimeNormalizer() {
    }

    /**
     * Parse a machine-readable date (RFC 822, ISO 8601) or a German date notation.
     *
     * @param referenceYear year assumed when a German date omits it
     */
    public static EventTime parse(String value, int referenceYear) {
        if (value == null || value.isBlank()) return null;
        String text = value.trim();

        EventTime machine = parseMachineReadable(text);
        if (machine != null) return machine;

        return parseGerman(text, referenceYear);
    }

    /**
     * First substring of free text that looks like a date, in German or ISO notation
     */
    public static Optional<String> findDateText(String text) {
        if (text == null) return Optional.empty();
        for (Pattern pattern : DATE_PATTERNS) {
            Matcher matcher = pattern.matcher(text);
            if (matcher.find()) {
                return Optional.of(matcher.group());
            }
        }
        return Optional.empty();
    }

    private static EventTime parseMachineReadable(String text) {
        try {
            OffsetDateTime odt = OffsetDateTime.parse(text, DateTimeFormatter.RFC_1123_DATE_TIME);
            return withOffset(odt.toLocalDateTime(), odt.getOffset());
        } catch (DateTimeParseException ignored) {
            // try the next notation
        }
        try {
            ZonedDateTime zdt = ZonedDateTime.parse(text, RFC_822_NAMED_ZONE);
            return zdt.getZone().normalized() instanceof ZoneOffset
                    ? withOffset(zdt.toLocalDateTime(), (ZoneOffset) zdt.getZone().normalized())
                    : EventTime.zoned(zdt.toLocalDateTime(), zdt.getZone());
        } catch (DateTimeParseException ignored) {
            // try the next notation
        }
        try {
            OffsetDateTime odt = OffsetDateTime.parse(text, DateTimeFormatter.ISO_OFFSET_DATE_TIME);
            return withOffset(odt.toLocalDateTime(), odt.getOffset());
        } catch (DateTimeParseException ignored) {
            // try the next notation
        }
        try {
            return EventTime.floating(LocalDateTime.parse(text, DateTimeFormatter.ISO_LOCAL_DATE_TIME));
        } catch (DateTimeParseException ignored) {
            // try the next notation
        }
        try {
            return EventTime.date(LocalDate.parse(text, DateTimeFormatter.ISO_LOCAL_DATE));
        } catch (DateTimeParseException ignored) {
            return null;
        }
    }

    private static EventTime parseGerman(String text, int referenceYear) {
        Matcher numeric = GERMAN_NUMERIC.matcher(text);
        if (numeric.find()) {
            int year = Integer.parseInt(numeric.group(3));
            if (year < 100) year += 2000;
            return build(year, Integer.parseInt(numeric.group(2)), Integer.parseInt(numeric.group(1)),
                    numeric.group(4), numeric.group(5));
        }

        Matcher named = GERMAN_MONTH_NAME.matcher(text);
        if (named.find()) {
            Integer month = GERMAN_MONTHS.get(named.group(2).toLowerCase(Locale.GERMAN));
            if (month == null) return null;
            int year = named.group(3) != null ? Integer.parseInt(named.group(3)) : referenceYear;
            return build(year, month, Integer.parseInt(named.group(1)), named.group(4), named.group(5));
        }

        Matcher iso = ISO_DATE_IN_TEXT.matcher(text);
        if (iso.find()) {
            return parseMachineReadable(iso.group());
        }
        return null;
    }

    private static EventTime build(int year, int month, int day, String hour, String minute) {
        try {
            LocalDate date = LocalDate.of(year, month, day);
            if (hour == null) {
                return EventTime.date(date);
            }
            return EventTime.floating(date.atTime(Integer.parseInt(hour), Integer.parseInt(minute)));
        } catch (DateTimeException e) {
            return null;
        }
    }

    private static EventTime withOffset(LocalDateTime dateTime, ZoneOffset offset) {
        return ZoneOffset.UTC.equals(offset) ? EventTime.utc(dateTime) : EventTime.zoned(dateTime, offset);
    }
}
