package com.astrova.location.domain.service;

import com.astrova.location.domain.model.CoordinateKey;
import com.astrova.location.domain.model.LocationCandidate;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Domain service for transforming coordinates into deduplication keys.
 *
 * Transformation Rule: Round to 3 decimal places (~100m precision)
 *
 * Near-identical points reported by different providers map to the same key,
 * while neighbouring towns stay apart.
 */
@Service
public class CoordinateTransformer {

    private static final int DECIMAL_PLACES = 3;

    /**
     * Rounds latitude and longitude half-up to 3 decimal places.
     *
     * @param lat Original latitude, must be finite
     * @param lng Original longitude, must be finite
     * @return Rounded coordinate key
     */
    public CoordinateKey transform(double lat, double lng) {
        BigDecimal roundedLat = BigDecimal.valueOf(lat)
            .setScale(DECIMAL_PLACES, RoundingMode.HALF_UP);
        BigDecimal roundedLng = BigDecimal.valueOf(lng)
            .setScale(DECIMAL_PLACES, RoundingMode.HALF_UP);

        return new CoordinateKey(roundedLat, roundedLng);
    }

    public CoordinateKey transform(LocationCandidate candidate) {
        return transform(candidate.getLatitude(), candidate.getLongitude());
    }
}
