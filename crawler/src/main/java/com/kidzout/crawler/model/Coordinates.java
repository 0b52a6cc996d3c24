package com.kidzout.crawler.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Value;

/**
 * WGS84 latitude/longitude pair.
 */
@Value
public class Coordinates {
    double latitude;
    double longitude;

    @JsonCreator
    public Coordinates(@JsonProperty("latitude") double latitude, @JsonProperty("longitude") double longitude) {
        this.latitude = latitude;
        this.longitude = longitude;
    }

    public static Coordinates of(double latitude, double longitude) {
        return new Coordinates(latitude, longitude);
    }

    /**
     * Parse coordinates from markup values, returning null when either side is missing or not a number
     */
    public static Coordinates parse(String latitude, String longitude) {
        if (latitude == null || longitude == null || latitude.isBlank() || longitude.isBlank()) {
            return null;
        }
        try {
            double lat = Double.parseDouble(latitude.trim());
            double lon = Double.parseDouble(longitude.trim());
            if (lat < -90 || lat > 90 || lon < -180 || lon > 180) return null;
            return new Coordinates(lat, lon);
        } catch (NumberFormatException e) {
            return null;
        }
    }
}
