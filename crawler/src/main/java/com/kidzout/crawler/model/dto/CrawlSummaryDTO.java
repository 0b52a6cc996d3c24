package com.kidzout.crawler.model.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.kidzout.crawler.model.enums.RunState;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Outcome of one crawl run. Logged when the run ends and embedded in the dataset metadata.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class CrawlSummaryDTO {
    private Instant startedAt;
    private Instant finishedAt;
    private Double durationSeconds;
    private RunState finalState;

    private int sourcesConfigured;
    @Builder.Default
    private List<String> sourcesSkipped = new ArrayList<>();
    private int sourcesAttempted;
    private int sourcesSucceeded;
    private int sourcesEmpty;
    private int sourcesFailed;
    private int timeouts;

    private int candidateCount;
    private int duplicatesRemoved;
    private int droppedRecords;
    private int skippedItems;
    private int eventCount;
    private int locationCount;
    private int geocodeLookups;

    @Builder.Default
    private List<SourceResultDTO> sources = new ArrayList<>();
    private String error;
}
