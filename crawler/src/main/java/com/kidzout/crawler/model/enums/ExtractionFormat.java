package com.kidzout.crawler.model.enums;

/**
 * Closed set of extractor variants. Each candidate record is tagged with the one that produced it.
 */
public enum ExtractionFormat {
    STRUCTURED_DATA,
    RSS,
    ATOM,
    ICAL,
    HTML_HEURISTIC
}
