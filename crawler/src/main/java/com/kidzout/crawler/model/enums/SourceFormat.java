package com.kidzout.crawler.model.enums;

import lombok.Getter;

/**
 * Declared wire format of a configured source.
 */
@Getter
public enum SourceFormat {
    HTML("html", RecordKind.EVENT),
    RSS("rss", RecordKind.EVENT),
    ATOM("atom", RecordKind.EVENT),
    ICAL("ical", RecordKind.EVENT),
    LOCATION_DIRECTORY("locations", RecordKind.LOCATION);

    private final String yamlKey;
    private final RecordKind recordKind;

    SourceFormat(String yamlKey, RecordKind recordKind) {
        this.yamlKey = yamlKey;
        this.recordKind = recordKind;
    }

    /**
     * Resolve the format named in sources.yml (case-insensitive, accepts enum names too)
     */
    public static SourceFormat fromYamlKey(String key) {
        if (key == null) return null;
        String normalized = key.trim().toLowerCase().replace('-', '_');
        for (SourceFormat format : values()) {
            if (format.yamlKey.equals(normalized) || format.name().toLowerCase().equals(normalized)) {
                return format;
            }
        }
        if ("location".equals(normalized) || "location_directory".equals(normalized)) {
            return LOCATION_DIRECTORY;
        }
        if ("ics".equals(normalized) || "icalendar".equals(normalized)) {
            return ICAL;
        }
        return null;
    }
}
