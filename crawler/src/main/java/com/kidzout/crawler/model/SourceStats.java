package com.kidzout.crawler.model;

import com.kidzout.crawler.model.enums.FetchOutcome;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Rolling reliability history of one source, persisted across runs.
 */
@Data
@NoArgsConstructor
public class SourceStats {

    private String sourceName;
    private List<OutcomeEntry> recentOutcomes = new ArrayList<>();
    private Map<FetchOutcome, Long> totals = new EnumMap<>(FetchOutcome.class);
    private long totalAttempts;
    private long totalItems;
    private int consecutiveFailures;
    private Instant lastAttempt;
    private Instant lastSuccess;
    private boolean excludeNextRun;

    public SourceStats(String sourceName) {
        this.sourceName = sourceName;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class OutcomeEntry {
        private FetchOutcome outcome;
        private Integer httpStatus;
        private Instant at;
        private int items;
    }
}
