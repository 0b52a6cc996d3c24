package com.kidzout.crawler.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import java.time.Instant;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Cached geocoding result for one normalized address. An unresolvable marker has no coordinates.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class GeocodeCacheEntry {
    private Double latitude;
    private Double longitude;
    private boolean unresolvable;
    private Instant resolvedAt;

    public static GeocodeCacheEntry resolved(Coordinates coordinates, Instant at) {
        return new GeocodeCacheEntry(coordinates.getLatitude(), coordinates.getLongitude(), false, at);
    }

    public static GeocodeCacheEntry unresolvable(Instant at) {
        return new GeocodeCacheEntry(null, null, true, at);
    }

    @JsonIgnore
    public Coordinates toCoordinates() {
        if (unresolvable || latitude == null || longitude == null) return null;
        return Coordinates.of(latitude, longitude);
    }
}
