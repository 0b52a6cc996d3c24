package com.kidzout.crawler.enrichment;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Ordered keyword table: the first label whose keywords occur in a text wins.
 * <p>
 * Keywords match at the start of a word, so "park" matches "Parkanlage" but not "Skatepark".
 */
public final class KeywordTaxonomy {

    private final Map<String, Pattern> labels = new LinkedHashMap<>();

    private KeywordTaxonomy() {
    }

    public static Builder builder() {
        return new Builder();
    }

    public Optional<String> match(String text) {
        if (text == null || text.isBlank()) return Optional.empty();
        String lower = text.toLowerCase(Locale.GERMAN);
        for (Map.Entry<String, Pattern> entry : labels.entrySet()) {
            if (entry.getValue().matcher(lower).find()) {
                return Optional.of(entry.getKey());
            }
        }
        return Optional.empty();
    }

    public boolean matches(String label, String text) {
        Pattern pattern = labels.get(label);
        return pattern != null && text != null && pattern.matcher(text.toLowerCase(Locale.GERMAN)).find();
    }

    public static final class Builder {
        private final KeywordTaxonomy taxonomy = new KeywordTaxonomy();

        public Builder label(String label, String... keywords) {
            String alternatives = String.join("|", List.of(keywords).stream().map(Pattern::quote).collect(Collectors.toList()));
            taxonomy.labels.put(label, Pattern.compile("(?<!\\p{L})(?:" + alternatives + ")"));
            return this;
        }

        public KeywordTaxonomy build() {
            return taxonomy;
        }
    }
}
