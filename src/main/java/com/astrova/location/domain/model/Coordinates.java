package com.astrova.location.domain.model;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * Value object representing a geographic coordinate pair in decimal degrees.
 */
@Getter
@EqualsAndHashCode
@ToString
public class Coordinates {
    private final double lat;
    private final double lng;

    public Coordinates(double lat, double lng) {
        if (!Double.isFinite(lat) || !Double.isFinite(lng)) {
            throw new IllegalArgumentException("Latitude and longitude must be finite numbers");
        }
        if (lat < -90 || lat > 90) {
            throw new IllegalArgumentException("Latitude must be between -90 and 90");
        }
        if (lng < -180 || lng > 180) {
            throw new IllegalArgumentException("Longitude must be between -180 and 180");
        }
        this.lat = lat;
        this.lng = lng;
    }

    /**
     * Checks the same rules as the constructor without throwing.
     */
    public static boolean isValid(double lat, double lng) {
        return Double.isFinite(lat) && Double.isFinite(lng)
            && lat >= -90 && lat <= 90
            && lng >= -180 && lng <= 180;
    }
}
