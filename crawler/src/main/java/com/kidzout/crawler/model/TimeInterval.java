package com.kidzout.crawler.model;

import com.fasterxml.jackson.annotation.JsonFormat;
import java.time.LocalTime;
import lombok.Value;

/**
 * Half-open opening interval [start, end) within one day.
 */
@Value
public class TimeInterval implements Comparable<TimeInterval> {
    @JsonFormat(pattern = "HH:mm")
    LocalTime start;
    @JsonFormat(pattern = "HH:mm")
    LocalTime end;

    public static TimeInterval of(LocalTime start, LocalTime end) {
        return new TimeInterval(start, end);
    }

    public boolean overlapsOrTouches(TimeInterval other) {
        return !start.isAfter(other.end) && !other.start.isAfter(end);
    }

    public TimeInterval span(TimeInterval other) {
        LocalTime s = start.isBefore(other.start) ? start : other.start;
        LocalTime e = end.isAfter(other.end) ? end : other.end;
        return new TimeInterval(s, e);
    }

    @Override
    public int compareTo(TimeInterval other) {
        int byStart = start.compareTo(other.start);
        return byStart != 0 ? byStart : end.compareTo(other.end);
    }
}
