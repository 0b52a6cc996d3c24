package com.kidzout.crawler.model;

import com.kidzout.crawler.model.enums.RecordKind;
import com.kidzout.crawler.model.enums.SourceFormat;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A configured origin the crawler fetches from.
 * <p>
 * Loaded once per run from sources.yml. Reliability data for a source lives in {@link SourceStats},
 * keyed by {@link #getName()}, so it can be carried across runs independently of the configuration.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Source {
    private String name;
    private String url;
    private SourceFormat format;
    @Builder.Default
    private List<String> categories = List.of();
    private SourceSelectors selectors;
    private String city;          // overrides crawler.defaults.city

    /**
     * Get the domain name from the URL
     */
    public String getDomain() {
        if (url == null) return null;
        return url.replaceAll("(?i)^https?://", "")
                .replaceAll("[/?#].*", "")
                .replaceAll(":\\d+$", "")
                .toLowerCase();
    }

    public RecordKind getRecordKind() {
        return format != null ? format.getRecordKind() : RecordKind.EVENT;
    }

    public boolean isLocationSource() {
        return getRecordKind() == RecordKind.LOCATION;
    }
}
