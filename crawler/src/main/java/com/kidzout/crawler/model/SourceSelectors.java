package com.kidzout.crawler.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * CSS selectors for the HTML heuristic extractor, all optional.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SourceSelectors {
    private String item;         // repeating item block
    private String title;
    private String date;
    private String description;
    private String name;         // venue name (location directories)
    private String address;      // venue address (location directories)
}
