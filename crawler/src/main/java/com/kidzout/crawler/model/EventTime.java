package com.kidzout.crawler.model;

import com.fasterxml.jackson.annotation.JsonValue;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import lombok.Value;

/**
 * A point in time as published by a source.
 * <p>
 * Feeds mix floating local times (no zone), UTC times and zone-qualified times, and some only
 * give a date. The zone is kept as published instead of being forced into one representation.
 */
@Value
public class EventTime {
    LocalDateTime dateTime;
    ZoneId zone;          // null for floating times
    boolean dateOnly;

    public static EventTime floating(LocalDateTime dateTime) {
        return new EventTime(dateTime, null, false);
    }

    public static EventTime zoned(LocalDateTime dateTime, ZoneId zone) {
        return new EventTime(dateTime, zone, false);
    }

    public static EventTime utc(LocalDateTime dateTime) {
        return new EventTime(dateTime, ZoneOffset.UTC, false);
    }

    public static EventTime date(LocalDate date) {
        return new EventTime(date.atStartOfDay(), null, true);
    }

    public boolean isFloating() {
        return zone == null;
    }

    public LocalDate toLocalDate() {
        return dateTime.toLocalDate();
    }

    @JsonValue
    public String toIsoString() {
        if (dateOnly) {
            return dateTime.toLocalDate().toString();
        }
        if (zone == null) {
            return dateTime.format(DateTimeFormatter.ISO_LOCAL_DATE_TIME);
        }
        if (zone instanceof ZoneOffset) {
            return dateTime.atOffset((ZoneOffset) zone).format(DateTimeFormatter.ISO_OFFSET_DATE_TIME);
        }
        return dateTime.atZone(zone).format(DateTimeFormatter.ISO_ZONED_DATE_TIME);
    }

    @Override
    public String toString() {
        return toIsoString();
    }
}
