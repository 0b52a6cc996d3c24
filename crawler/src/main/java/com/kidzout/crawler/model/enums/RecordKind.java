package com.kidzout.crawler.model.enums;

/**
 * Output bucket of a record: a dated event or a permanent venue.
 */
public enum RecordKind {
    EVENT("ev-"),
    LOCATION("loc-");

    private final String idPrefix;

    RecordKind(String idPrefix) {
        this.idPrefix = idPrefix;
    }

    public String getIdPrefix() {
        return idPrefix;
    }
}
