package com.kidzout.crawler.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import java.time.DayOfWeek;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import lombok.Value;

/**
 * Result of parsing a free-text opening hours string.
 * <p>
 * The status is an explicit tri-state: a parsed weekly schedule, a venue that is closed
 * altogether, or text the parser could not interpret. Unparsed text is kept in
 * {@link #getOriginalText()} for manual review and is never treated as closed.
 */
@Value
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public class OpeningHours {

    public enum Status {
        PARSED,
        CLOSED,
        UNPARSED
    }

    Status status;
    Map<DayOfWeek, DayHours> days;
    String originalText;

    /**
     * Build a parsed schedule. Every weekday is present; days missing from the input map are closed.
     */
    public static OpeningHours parsed(Map<DayOfWeek, List<TimeInterval>> schedule, String originalText) {
        Map<DayOfWeek, DayHours> days = new EnumMap<>(DayOfWeek.class);
        for (DayOfWeek day : DayOfWeek.values()) {
            List<TimeInterval> intervals = schedule.get(day);
            days.put(day, intervals == null || intervals.isEmpty() ? DayHours.closedDay() : DayHours.open(intervals));
        }
        return new OpeningHours(Status.PARSED, Collections.unmodifiableMap(days), originalText);
    }

    public static OpeningHours closed(String originalText) {
        return new OpeningHours(Status.CLOSED, Map.of(), originalText);
    }

    public static OpeningHours unparsed(String originalText) {
        return new OpeningHours(Status.UNPARSED, Map.of(), originalText);
    }

    public boolean isClosedOn(DayOfWeek day) {
        if (status == Status.CLOSED) return true;
        DayHours hours = days.get(day);
        return hours != null && hours.isClosed();
    }

    public List<TimeInterval> intervalsOn(DayOfWeek day) {
        DayHours hours = days.get(day);
        return hours == null ? List.of() : hours.getIntervals();
    }
}
