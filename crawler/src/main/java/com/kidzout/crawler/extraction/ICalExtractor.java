package com.kidzout.crawler.extraction;

import com.kidzout.crawler.config.CrawlerConfig;
import com.kidzout.crawler.exception.DocumentParseException;
import com.kidzout.crawler.model.CandidateRecord;
import com.kidzout.crawler.model.Coordinates;
import com.kidzout.crawler.model.EventTime;
import com.kidzout.crawler.model.enums.ExtractionFormat;
import com.kidzout.crawler.model.enums.RecordKind;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.time.DateTimeException;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * iCalendar (RFC 5545) feeds. Only VEVENT components are read; nested components such as
 * VALARM are ignored.
 */
@Component
@Slf4j
public class ICalExtractor implements FormatExtractor {

    private static final DateTimeFormatter BASIC_DATE = DateTimeFormatter.ofPattern("yyyyMMdd");
    private static final DateTimeFormatter BASIC_DATE_TIME = DateTimeFormatter.ofPattern("yyyyMMdd'T'HHmm[ss]");

    private final int descriptionLimit;

    public ICalExtractor(CrawlerConfig crawlerConfig) {
        this.descriptionLimit = crawlerConfig.getExtraction().getDescriptionLimit();
    }

    @Override
    public ExtractionFormat format() {
        return ExtractionFormat.ICAL;
    }

    @Override
    public ExtractionResult extract(byte[] raw, ExtractionContext context) throws DocumentParseException {
        String text = new String(raw, charset(context));
        if (text.startsWith("\uFEFF")) {
            text = text.substring(1);
        }
        List<String> lines = unfold(text);
        if (lines.stream().noneMatch(line -> line.strip().equalsIgnoreCase("BEGIN:VCALENDAR"))) {
            throw new DocumentParseException("Not an iCalendar document at " + context.getBaseUrl());
        }

        List<CandidateRecord> records = new ArrayList<>();
        int skipped = 0;

        Map<String, Property> current = null;
        int nestedDepth = 0;

        for (String line : lines) {
            String upper = line.strip().toUpperCase(Locale.ROOT);

            if (upper.equals("BEGIN:VEVENT")) {
                if (current != null) {
                    log.debug("Skipping unterminated VEVENT in {}", context.sourceName());
                    skipped++;
                }
                current = new HashMap<>();
                nestedDepth = 0;
                continue;
            }
            if (current == null) continue;

            if (upper.startsWith("BEGIN:")) {
                nestedDepth++;
            } else if (upper.equals("END:VEVENT") && nestedDepth == 0) {
                CandidateRecord record = toRecord(current, records.size(), context);
                if (record == null) {
                    skipped++;
                } else {
                    records.add(record);
                }
                current = null;
            } else if (upper.startsWith("END:")) {
                if (nestedDepth == 0) {
                    // END:VCALENDAR (or a stray END) before END:VEVENT
                    log.debug("Skipping unterminated VEVENT in {}", context.sourceName());
                    skipped++;
                    current = null;
                } else {
                    nestedDepth--;
                }
            } else if (nestedDepth == 0) {
                Property property = Property.parse(line);
                if (property != null) {
                    current.putIfAbsent(property.name, property);
                }
            }
        }
        if (current != null) {
            log.debug("Skipping VEVENT cut off at end of document in {}", context.sourceName());
            skipped++;
        }

        return new ExtractionResult(records, skipped);
    }

    private CandidateRecord toRecord(Map<String, Property> properties, int index, ExtractionContext context) {
        String summary = ExtractionSupport.clean(value(properties, "SUMMARY"));
        if (summary == null) {
            log.debug("Skipping VEVENT without SUMMARY in {}", context.sourceName());
            return null;
        }

        Property dtStart = properties.get("DTSTART");
        EventTime start = dtStart != null ? parseTime(dtStart) : null;
        Property dtEnd = properties.get("DTEND");
        EventTime end = dtEnd != null ? parseTime(dtEnd) : null;

        Coordinates coordinates = null;
        String geo = value(properties, "GEO");
        if (geo != null && geo.contains(";")) {
            String[] parts = geo.split(";", 2);
            coordinates = Coordinates.parse(parts[0], parts[1]);
        }

        String url = ExtractionSupport.absoluteUrl(context.getBaseUrl(), value(properties, "URL"));
        return CandidateRecord.builder()
                .title(summary)
                .description(ExtractionSupport.truncate(ExtractionSupport.clean(value(properties, "DESCRIPTION")), descriptionLimit))
                .start(start)
                .end(end)
                .timeExpression(start == null && dtStart != null ? dtStart.value : null)
                .locationText(ExtractionSupport.clean(value(properties, "LOCATION")))
                .url(url != null ? url : context.getBaseUrl())
                .sourceName(context.sourceName())
                .format(ExtractionFormat.ICAL)
                .kind(RecordKind.EVENT)
                .itemIndex(index)
                .coordinates(coordinates)
                .build();
    }

    /**
     * DATE values become date-only times, a trailing Z means UTC, TZID qualifies the local time,
     * and anything else is a floating local time.
     */
    static EventTime parseTime(Property property) {
        String value = property.value.trim();
        try {
            if ("DATE".equalsIgnoreCase(property.params.get("VALUE")) || value.length() == 8) {
                return EventTime.date(LocalDate.parse(value.substring(0, 8), BASIC_DATE));
            }
            if (value.endsWith("Z") || value.endsWith("z")) {
                return EventTime.utc(LocalDateTime.parse(value.substring(0, value.length() - 1), BASIC_DATE_TIME));
            }
            LocalDateTime local = LocalDateTime.parse(value, BASIC_DATE_TIME);
            String tzid = property.params.get("TZID");
            if (tzid != null) {
                try {
                    return EventTime.zoned(local, ZoneId.of(tzid.replace("\"", "").trim()));
                } catch (DateTimeException e) {
                    log.debug("Unknown TZID '{}', keeping floating time", tzid);
                }
            }
            return EventTime.floating(local);
        } catch (DateTimeParseException | StringIndexOutOfBoundsException e) {
            return null;
        }
    }

    /**
     * Join folded continuation lines (leading space or tab) and drop blank lines
     */
    static List<String> unfold(String text) {
        List<String> lines = new ArrayList<>();
        StringBuilder current = null;
        for (String line : text.split("\\r?\\n|\\r")) {
            if (!line.isEmpty() && (line.charAt(0) == ' ' || line.charAt(0) == '\t') && current != null) {
                current.append(line, 1, line.length());
                continue;
            }
            if (current != null && current.length() > 0) {
                lines.add(current.toString());
            }
            current = new StringBuilder(line.strip().isEmpty() ? "" : line);
        }
        if (current != null && current.length() > 0) {
            lines.add(current.toString());
        }
        return lines;
    }

    private static String value(Map<String, Property> properties, String name) {
        Property property = properties.get(name);
        return property == null ? null : unescape(property.value);
    }

    private static String unescape(String value) {
        StringBuilder out = new StringBuilder(value.length());
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            if (c == '\\' && i + 1 < value.length()) {
                char next = value.charAt(++i);
                switch (next) {
                    case 'n', 'N' -> out.append('\n');
                    default -> out.append(next);
                }
            } else {
                out.append(c);
            }
        }
        return out.toString();
    }

    private static Charset charset(ExtractionContext context) {
        if (context.getCharsetName() != null) {
            try {
                return Charset.forName(context.getCharsetName());
            } catch (IllegalArgumentException e) {
                log.debug("Unknown charset '{}', falling back to UTF-8", context.getCharsetName());
            }
        }
        return StandardCharsets.UTF_8;
    }

    /**
     * One content line: {@code NAME;PARAM=VALUE;...:value}
     */
    static final class Property {
        final String name;
        final Map<String, String> params;
        final String value;

        private Property(String name, Map<String, String> params, String value) {
            this.name = name;
            this.params = params;
            this.value = value;
        }

        static Property parse(String line) {
            int colon = -1;
            boolean quoted = false;
            for (int i = 0; i < line.length(); i++) {
                char c = line.charAt(i);
                if (c == '"') quoted = !quoted;
                else if (c == ':' && !quoted) {
                    colon = i;
                    break;
                }
            }
            if (colon <= 0) return null;

            String[] head = line.substring(0, colon).split(";");
            Map<String, String> params = new HashMap<>();
            for (int i = 1; i < head.length; i++) {
                int eq = head[i].indexOf('=');
                if (eq > 0) {
                    params.put(head[i].substring(0, eq).toUpperCase(Locale.ROOT), head[i].substring(eq + 1));
                }
            }
            return new Property(head[0].trim().toUpperCase(Locale.ROOT), params, line.substring(colon + 1));
        }
    }
}
