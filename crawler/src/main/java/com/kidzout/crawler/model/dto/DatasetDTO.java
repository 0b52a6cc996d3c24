package com.kidzout.crawler.model.dto;

import com.kidzout.crawler.model.EnrichedEvent;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Top-level shape of data.json.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class DatasetDTO {
    private List<EnrichedEvent> events;
    private List<EnrichedEvent> locations;
    private CrawlSummaryDTO metadata;
}
