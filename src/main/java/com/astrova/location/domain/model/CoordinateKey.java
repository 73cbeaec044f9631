package com.astrova.location.domain.model;

import lombok.EqualsAndHashCode;
import lombok.Getter;

import java.math.BigDecimal;

/**
 * Value object representing rounded coordinates used as a deduplication key.
 */
@Getter
@EqualsAndHashCode
public class CoordinateKey {
    private final BigDecimal lat;
    private final BigDecimal lng;

    public CoordinateKey(BigDecimal lat, BigDecimal lng) {
        if (lat == null || lng == null) {
            throw new IllegalArgumentException("Rounded latitude and longitude must not be null");
        }
        this.lat = lat;
        this.lng = lng;
    }

    @Override
    public String toString() {
        return lat.toPlainString() + "," + lng.toPlainString();
    }
}
