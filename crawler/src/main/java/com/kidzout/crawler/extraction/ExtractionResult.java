package com.kidzout.crawler.extraction;

import com.kidzout.crawler.model.CandidateRecord;
import java.util.List;
import lombok.Value;

/**
 * Ordered records of one document plus the number of items dropped as malformed.
 */
@Value
public class ExtractionResult {
    List<CandidateRecord> records;
    int skippedItems;

    public ExtractionResult(List<CandidateRecord> records, int skippedItems) {
        this.records = List.copyOf(records);
        this.skippedItems = skippedItems;
    }

    public static ExtractionResult empty(int skippedItems) {
        return new ExtractionResult(List.of(), skippedItems);
    }

    public boolean isEmpty() {
        return records.isEmpty();
    }

    public int size() {
        return records.size();
    }
}
