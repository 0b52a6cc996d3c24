package com.kidzout.crawler.model;

import com.kidzout.crawler.model.enums.ExtractionFormat;
import com.kidzout.crawler.model.enums.RecordKind;
import lombok.Builder;
import lombok.Value;

/**
 * Raw item produced by an extractor, before enrichment.
 */
@Value
@Builder(toBuilder = true)
public class CandidateRecord {
    String title;
    String description;
    EventTime start;
    EventTime end;
    String timeExpression;        // raw date text when it could not be parsed
    String locationText;
    String address;
    String url;
    String sourceName;
    ExtractionFormat format;
    RecordKind kind;
    int itemIndex;
    String openingHoursText;
    Coordinates coordinates;      // present when the markup already carries geo data
}
