package com.kidzout.crawler.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.kidzout.crawler.model.enums.ExtractionFormat;
import com.kidzout.crawler.model.enums.RecordKind;
import java.time.Instant;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Unit written to the output dataset: a candidate record plus everything derived from it.
 * <p>
 * Locations use the same type with {@link RecordKind#LOCATION}. Derived fields that could not be
 * determined stay null and are omitted from the JSON output.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class EnrichedEvent {

    // ── Identity ────────────────────────────────────────────────────────────
    private String id;
    private RecordKind kind;
    private String source;
    private String sourceUrl;
    private ExtractionFormat extractionFormat;
    @JsonIgnore
    private int itemIndex;

    // ── Extracted fields ────────────────────────────────────────────────────
    private String title;
    private String description;
    private EventTime start;
    private EventTime end;
    private String timeExpression;
    private String location;
    private String address;
    private String url;

    // ── Derived fields ──────────────────────────────────────────────────────
    private String nameKids;
    private String category;
    private Integer minAge;
    private Integer maxAge;
    private List<String> ageGroups;
    private OpeningHours openingHours;
    private Coordinates coordinates;
    private String weatherSuitability;
    private String energyLevel;
    private List<String> amenities;
    private List<String> highlights;

    private String city;
    private String region;
    private String country;
    private Instant lastUpdated;
}
