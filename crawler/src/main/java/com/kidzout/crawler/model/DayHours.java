package com.kidzout.crawler.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import java.util.List;
import lombok.Value;

/**
 * Opening state for one weekday: explicitly closed, or open during the listed intervals.
 */
@Value
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public class DayHours {
    boolean closed;
    List<TimeInterval> intervals;

    public static DayHours closedDay() {
        return new DayHours(true, List.of());
    }

    public static DayHours open(List<TimeInterval> intervals) {
        return new DayHours(false, List.copyOf(intervals));
    }
}
