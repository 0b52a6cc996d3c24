package com.kidzout.crawler.enrichment;

import com.kidzout.crawler.model.OpeningHours;
import com.kidzout.crawler.model.TimeInterval;
import java.time.DayOfWeek;
import java.time.LocalTime;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Parses free-text opening hours such as "Mo-Fr 9-17 Uhr, Sa 10:00-14:00" or
 * "Tue, Thu 10.30 - 12.00 and 14 - 18".
 * <p>
 * The text is read as a sequence of day groups, each followed by the times that apply to it.
 * A later group overrides an earlier one for the days it names, so "täglich 10-18, Mo geschlossen"
 * closes Mondays. Days that are never named are closed. Text with no recognizable times is
 * CLOSED when it says so, otherwise UNPARSED; the parser never throws.
 */
@Component
@Slf4j
public class OpeningHoursParser {

    private static final Map<String, DayOfWeek> DAY_TOKENS = Map.ofEntries(
            Map.entry("montag", DayOfWeek.MONDAY), Map.entry("monday", DayOfWeek.MONDAY),
            Map.entry("mon", DayOfWeek.MONDAY), Map.entry("mo", DayOfWeek.MONDAY),
            Map.entry("dienstag", DayOfWeek.TUESDAY), Map.entry("tuesday", DayOfWeek.TUESDAY),
            Map.entry("tues", DayOfWeek.TUESDAY), Map.entry("tue", DayOfWeek.TUESDAY),
            Map.entry("di", DayOfWeek.TUESDAY),
            Map.entry("mittwoch", DayOfWeek.WEDNESDAY), Map.entry("wednesday", DayOfWeek.WEDNESDAY),
            Map.entry("wed", DayOfWeek.WEDNESDAY), Map.entry("mi", DayOfWeek.WEDNESDAY),
            Map.entry("donnerstag", DayOfWeek.THURSDAY), Map.entry("thursday", DayOfWeek.THURSDAY),
            Map.entry("thurs", DayOfWeek.THURSDAY), Map.entry("thu", DayOfWeek.THURSDAY),
            Map.entry("do", DayOfWeek.THURSDAY),
            Map.entry("freitag", DayOfWeek.FRIDAY), Map.entry("friday", DayOfWeek.FRIDAY),
            Map.entry("fri", DayOfWeek.FRIDAY), Map.entry("fr", DayOfWeek.FRIDAY),
            Map.entry("samstag", DayOfWeek.SATURDAY), Map.entry("sonnabend", DayOfWeek.SATURDAY),
            Map.entry("saturday", DayOfWeek.SATURDAY), Map.entry("sat", DayOfWeek.SATURDAY),
            Map.entry("sa", DayOfWeek.SATURDAY),
            Map.entry("sonntag", DayOfWeek.SUNDAY), Map.entry("sunday", DayOfWeek.SUNDAY),
            Map.entry("sun", DayOfWeek.SUNDAY), Map.entry("so", DayOfWeek.SUNDAY)
    );

    private static final String DAY_WORD = "montags?|dienstags?|mittwochs?|donnerstags?|freitags?|samstags?|sonnabends?|sonntags?"
            + "|monday|tuesday|wednesday|thursday|friday|saturday|sunday"
            + "|mon|tues|tue|wed|thurs|thu|fri|sat|sun"
            + "|mo|di|mi|do|fr|sa|so";
    private static final String DAILY_WORD = "täglich|taeglich|daily|jeden tag|every day|alle tage";
    private static final String HOLIDAY_WORD = "feiertage|feiertags?|public holidays?|holidays?";

    private static final String TOKEN = "(?<!\\p{L})(" + DAILY_WORD + "|" + HOLIDAY_WORD + "|" + DAY_WORD + ")\\.?(?!\\p{L})";
    private static final Pattern TOKEN_PATTERN = Pattern.compile(TOKEN);
    private static final Pattern DAY_GROUP = Pattern.compile(
            TOKEN + "(?:\\s*(?:-|,|/|\\+|&|und|and)\\s*" + TOKEN + ")*");

    private static final String TIME = "(\\d{1,2})(?:[:.](\\d{2}))?\\s*(am|pm|a\\.m\\.|p\\.m\\.)?";
    private static final Pattern INTERVAL = Pattern.compile(
            "(?<![\\d.:])" + TIME + "\\s*-\\s*" + TIME + "(?![\\d:])");

    private static final Pattern CLOSED = Pattern.compile(
            "(?<!\\p{L})(geschlossen|closed|ruhetag|zu)(?!\\p{L})");

    public OpeningHours parse(String text) {
        if (text == null || text.isBlank()) {
            return OpeningHours.unparsed(text == null ? "" : text);
        }

        String normalized = normalize(text);
        Map<DayOfWeek, List<TimeInterval>> schedule = new EnumMap<>(DayOfWeek.class);
        boolean anyInterval = false;
        Set<DayOfWeek> pending = new LinkedHashSet<>();

        Matcher group = DAY_GROUP.matcher(normalized);
        List<int[]> groups = new ArrayList<>();
        while (group.find()) {
            groups.add(new int[]{group.start(), group.end()});
        }

        for (int i = 0; i < groups.size(); i++) {
            int[] bounds = groups.get(i);
            Set<DayOfWeek> days = days(normalized.substring(bounds[0], bounds[1]));
            int bodyEnd = i + 1 < groups.size() ? groups.get(i + 1)[0] : normalized.length();
            String body = normalized.substring(bounds[1], bodyEnd);

            List<TimeInterval> intervals = intervals(body);
            pending.addAll(days);
            if (!intervals.isEmpty()) {
                anyInterval = true;
                for (DayOfWeek day : pending) {
                    schedule.put(day, intervals);
                }
                pending.clear();
            } else if (CLOSED.matcher(body).find()) {
                for (DayOfWeek day : pending) {
                    schedule.remove(day);
                }
                pending.clear();
            }
            // Days without times of their own take the times of the next group ("Sa und So, Feiertage 10-18")
        }

        if (anyInterval) {
            return OpeningHours.parsed(schedule, text);
        }
        if (CLOSED.matcher(normalized).find() && !INTERVAL.matcher(normalized).find()) {
            return OpeningHours.closed(text);
        }
        log.debug("Could not interpret opening hours '{}'", text);
        return OpeningHours.unparsed(text);
    }

    private static String normalize(String text) {
        return text.toLowerCase(Locale.GERMAN)
                .replace('–', '-')
                .replace('—', '-')
                .replace('‐', '-')
                .replaceAll("(?<!\\p{L})(bis|to|until)(?!\\p{L})", "-")
                .replaceAll("(?<!\\p{L})uhr(?!\\p{L})", " ")
                .replaceAll("\\s+", " ");
    }

    /**
     * Expand a day group such as "mo-mi, fr" into its weekdays; holidays contribute none
     */
    private static Set<DayOfWeek> days(String groupText) {
        Set<DayOfWeek> days = new LinkedHashSet<>();
        Matcher token = TOKEN_PATTERN.matcher(groupText);
        DayOfWeek previous = null;
        int previousEnd = 0;
        while (token.find()) {
            String word = token.group(1);
            String separator = groupText.substring(previousEnd, token.start()).trim();
            previousEnd = token.end();

            if (word.matches(DAILY_WORD)) {
                days.addAll(List.of(DayOfWeek.values()));
                previous = null;
                continue;
            }
            DayOfWeek day = dayOf(word);
            if (day == null) {
                previous = null;
                continue;
            }
            if (previous != null && separator.equals("-")) {
                // Ranges may wrap around the week ("Fr-Mo")
                DayOfWeek d = previous;
                while (d != day) {
                    d = d.plus(1);
                    days.add(d);
                }
            } else {
                days.add(day);
            }
            previous = day;
        }
        return days;
    }

    private static DayOfWeek dayOf(String word) {
        DayOfWeek day = DAY_TOKENS.get(word);
        if (day == null && word.endsWith("s")) {
            day = DAY_TOKENS.get(word.substring(0, word.length() - 1));
        }
        return day;
    }

    /**
     * All valid intervals in a body of text, sorted and merged so they never overlap
     */
    private static List<TimeInterval> intervals(String body) {
        List<TimeInterval> found = new ArrayList<>();
        Matcher matcher = INTERVAL.matcher(body);
        while (matcher.find()) {
            LocalTime start = time(matcher.group(1), matcher.group(2), matcher.group(3), false);
            LocalTime end = time(matcher.group(4), matcher.group(5), matcher.group(6), true);
            if (start == null || end == null) continue;
            if (!end.isAfter(start)) {
                // Past midnight: the interval is capped at the end of the day
                end = LocalTime.MAX;
            }
            found.add(TimeInterval.of(start, end));
        }
        found.sort(null);

        List<TimeInterval> merged = new ArrayList<>();
        for (TimeInterval interval : found) {
            if (!merged.isEmpty() && merged.get(merged.size() - 1).overlapsOrTouches(interval)) {
                merged.set(merged.size() - 1, merged.get(merged.size() - 1).span(interval));
            } else {
                merged.add(interval);
            }
        }
        return merged;
    }

    private static LocalTime time(String hourText, String minuteText, String meridiem, boolean isEnd) {
        int hour = Integer.parseInt(hourText);
        int minute = minuteText != null ? Integer.parseInt(minuteText) : 0;
        if (meridiem != null) {
            if (hour < 1 || hour > 12) return null;
            boolean pm = meridiem.startsWith("p");
            hour = hour % 12 + (pm ? 12 : 0);
        }
        if (minute > 59 || hour > 24 || (hour == 24 && minute != 0)) return null;
        if (hour == 24) {
            return isEnd ? LocalTime.MAX : LocalTime.MIDNIGHT;
        }
        return LocalTime.of(hour, minute);
    }
}
