package com.kidzout.crawler.scraping;

import com.kidzout.crawler.model.CandidateRecord;
import java.text.Normalizer;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import org.springframework.stereotype.Component;

/**
 * Collapses the same item published by several sources.
 * <p>
 * Records are duplicates when they have the same kind, the same normalized title prefix and the
 * same start date. The first occurrence keeps its position and identity and takes over the
 * longest description among its duplicates.
 */
@Component
public class RecordDeduplicator {

    static final int TITLE_PREFIX_LENGTH = 30;

    public List<CandidateRecord> deduplicate(List<CandidateRecord> ordered) {
        Map<String, CandidateRecord> unique = new LinkedHashMap<>();
        for (CandidateRecord record : ordered) {
            unique.merge(key(record), record, RecordDeduplicator::preferLongerDescription);
        }
        return new ArrayList<>(unique.values());
    }

    static String key(CandidateRecord record) {
        String date = record.getStart() != null ? record.getStart().toLocalDate().toString() : "";
        return record.getKind() + "|" + normalizedTitlePrefix(record.getTitle()) + "|" + date;
    }

    static String normalizedTitlePrefix(String title) {
        if (title == null) return "";
        String normalized = Normalizer.normalize(title, Normalizer.Form.NFC)
                .toLowerCase(Locale.GERMAN)
                .replaceAll("[^\\p{L}\\p{N}]+", " ")
                .trim();
        return normalized.length() > TITLE_PREFIX_LENGTH ? normalized.substring(0, TITLE_PREFIX_LENGTH) : normalized;
    }

    private static CandidateRecord preferLongerDescription(CandidateRecord first, CandidateRecord duplicate) {
        int firstLength = first.getDescription() != null ? first.getDescription().length() : 0;
        int duplicateLength = duplicate.getDescription() != null ? duplicate.getDescription().length() : 0;
        return duplicateLength > firstLength ? first.toBuilder().description(duplicate.getDescription()).build() : first;
    }
}
