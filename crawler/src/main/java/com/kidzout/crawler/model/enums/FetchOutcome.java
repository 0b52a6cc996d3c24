package com.kidzout.crawler.model.enums;

import lombok.Getter;

/**
 * Outcome of one source fetch as seen by the quality tracker.
 */
@Getter
public enum FetchOutcome {
    SUCCESS(1.0, false),
    EMPTY(0.5, false),
    PARSE_ERROR(0.25, true),
    HTTP_ERROR(0.0, true),
    TIMEOUT(0.0, true);

    // Contribution of one outcome to the weighted success ratio
    private final double weight;
    private final boolean failure;

    FetchOutcome(double weight, boolean failure) {
        this.weight = weight;
        this.failure = failure;
    }
}
