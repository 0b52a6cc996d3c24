package com.kidzout.crawler.model;

import com.kidzout.crawler.model.enums.FetchOutcome;
import java.time.Instant;
import lombok.Builder;
import lombok.Value;

/**
 * One fetch-and-extract attempt against a source. Consumed by the quality tracker, never stored as-is.
 */
@Value
@Builder
public class FetchAttempt {
    String sourceName;
    Instant timestamp;
    FetchOutcome outcome;
    Integer httpStatus;
    long responseSize;
    long latencyMs;
    int retries;
    int itemCount;
    int skippedItems;
    String error;
}
