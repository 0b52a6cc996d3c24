package com.kidzout.crawler.enrichment;

import com.kidzout.crawler.model.CandidateRecord;
import com.kidzout.crawler.model.EnrichedEvent;
import com.kidzout.crawler.model.Source;
import com.kidzout.crawler.model.enums.RecordKind;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

/**
 * Infers the age range a record is meant for.
 * <p>
 * Explicit mentions win ("ab 6 Jahren", "3-10 Jahre", "ages 4-8", "U3"), then audience keywords
 * (Kita, Grundschule, ...), then a default per category. The range is also expressed as the
 * overlapping age groups 0-3, 3-6, 6-9 and 9-12.
 */
@Component
@Order(20)
public class AgeRangeStep implements EnrichmentStep {

    static final int MAX_CHILD_AGE = 12;
    private static final int[][] AGE_GROUPS = {{0, 3}, {3, 6}, {6, 9}, {9, 12}};

    private static final Pattern RANGE = Pattern.compile(
            "(?<!\\d)(\\d{1,2})\\s*(?:-|–|bis)\\s*(\\d{1,2})\\s*(?:jahre|jahren|jahr|j\\.|years?)(?!\\p{L})");
    private static final Pattern ENGLISH_RANGE = Pattern.compile(
            "(?<!\\p{L})ages?\\s*(\\d{1,2})\\s*(?:-|–|to)\\s*(\\d{1,2})(?!\\d)");
    private static final Pattern MINIMUM = Pattern.compile(
            "(?<!\\p{L})(?:ab|from)\\s*(\\d{1,2})\\s*(?:jahre|jahren|jahr|j\\.|years?)?(?!\\d)(?![.:]\\d)(?!\\s*(?:uhr|€|euro|eur))");
    private static final Pattern ENGLISH_MINIMUM = Pattern.compile("(?<!\\p{L})ages?\\s*(\\d{1,2})\\s*\\+");
    // "U3" only: U1..U8 are also subway lines
    private static final Pattern UNDER = Pattern.compile("(?<!\\p{L})(?:u3(?!\\d)|unter\\s*(\\d{1,2})\\s*jahre[n]?)");

    private static final KeywordTaxonomy AUDIENCE = KeywordTaxonomy.builder()
            .label("0-3", "baby", "kleinkind", "krippe", "krabbelgruppe", "toddler")
            .label("3-6", "kindergarten", "vorschule", "kita", "preschool")
            .label("6-9", "grundschule", "schulkind", "erstklässler")
            .label("9-12", "teenager", "jugend", "tween")
            .build();

    @Override
    public String name() {
        return "age-range";
    }

    @Override
    public void apply(CandidateRecord candidate, Source source, EnrichedEvent event) {
        String text = (candidate.getTitle() + " " + (candidate.getDescription() != null ? candidate.getDescription() : ""))
                .toLowerCase(Locale.GERMAN);

        int[] range = explicitRange(text);
        if (range == null) {
            range = audienceRange(text);
        }
        if (range == null) {
            range = categoryDefault(event.getCategory(), candidate.getKind());
        }

        event.setMinAge(range[0]);
        event.setMaxAge(range[1]);
        event.setAgeGroups(ageGroups(range[0], range[1]));
    }

    /**
     * Ages stated in the text as [min, max], or null. Adult-only mentions ("ab 18") are ignored.
     */
    static int[] explicitRange(String text) {
        for (Pattern pattern : List.of(RANGE, ENGLISH_RANGE)) {
            Matcher matcher = pattern.matcher(text);
            while (matcher.find()) {
                int min = Integer.parseInt(matcher.group(1));
                int max = Integer.parseInt(matcher.group(2));
                if (min <= max && max <= 17) return new int[]{min, max};
            }
        }
        for (Pattern pattern : List.of(MINIMUM, ENGLISH_MINIMUM)) {
            Matcher matcher = pattern.matcher(text);
            while (matcher.find()) {
                int min = Integer.parseInt(matcher.group(1));
                if (min <= 14) return new int[]{min, Math.max(min, MAX_CHILD_AGE)};
            }
        }
        Matcher under = UNDER.matcher(text);
        if (under.find()) {
            int max = under.group(1) != null ? Integer.parseInt(under.group(1)) : 3;
            if (max > 0) return new int[]{0, max};
        }
        return null;
    }

    private static int[] audienceRange(String text) {
        int min = Integer.MAX_VALUE;
        int max = Integer.MIN_VALUE;
        for (int[] group : AGE_GROUPS) {
            if (AUDIENCE.matches(group[0] + "-" + group[1], text)) {
                min = Math.min(min, group[0]);
                max = Math.max(max, group[1]);
            }
        }
        return min == Integer.MAX_VALUE ? null : new int[]{min, max};
    }

    private static int[] categoryDefault(String category, RecordKind kind) {
        if (category == null) return new int[]{3, 12};
        if (kind == RecordKind.LOCATION) {
            return switch (category) {
                case "spielplatz", "outdoor" -> new int[]{3, 9};
                case "museum", "indoor" -> new int[]{6, 12};
                default -> new int[]{3, 12};
            };
        }
        return switch (category) {
            case "theater", "museum" -> new int[]{3, 9};
            case "sport", "kreativ" -> new int[]{6, 12};
            default -> new int[]{3, 12};
        };
    }

    static List<String> ageGroups(int min, int max) {
        List<String> groups = new ArrayList<>();
        int upper = Math.max(max, min + 1);
        for (int[] group : AGE_GROUPS) {
            if (group[0] < upper && group[1] > min) {
                groups.add(group[0] + "-" + group[1]);
            }
        }
        return groups;
    }
}
