package com.astrova.location.domain.service;

import lombok.AllArgsConstructor;
import lombok.Getter;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Coarse timezone classifier used when a provider does not report a zone.
 *
 * The Indian subcontinent gets a precise override; everywhere else the zone comes
 * from fixed longitude bands. This is an approximation, good enough for relative-time
 * display but not an authoritative boundary lookup.
 */
@Service
public class TimezoneEstimator {

    public static final String FALLBACK_ZONE = "UTC";
    public static final String INDIA_ZONE = "Asia/Kolkata";

    private static final double INDIA_MIN_LAT = 6;
    private static final double INDIA_MAX_LAT = 38;
    private static final double INDIA_MIN_LNG = 68;
    private static final double INDIA_MAX_LNG = 98;

    static final List<LongitudeBand> DEFAULT_BANDS = List.of(
        new LongitudeBand(-180, -150, "Pacific/Honolulu"),
        new LongitudeBand(-150, -122, "America/Anchorage"),
        new LongitudeBand(-122, -112, "America/Los_Angeles"),
        new LongitudeBand(-112, -102, "America/Denver"),
        new LongitudeBand(-102, -87, "America/Chicago"),
        new LongitudeBand(-87, -52, "America/New_York"),
        new LongitudeBand(-52, -30, "America/Sao_Paulo"),
        new LongitudeBand(-30, 15, "Europe/London"),
        new LongitudeBand(15, 30, "Europe/Berlin"),
        new LongitudeBand(30, 50, "Europe/Moscow"),
        new LongitudeBand(50, 80, "Asia/Tashkent"),
        new LongitudeBand(80, 95, INDIA_ZONE),
        new LongitudeBand(95, 110, "Asia/Bangkok"),
        new LongitudeBand(110, 125, "Asia/Shanghai"),
        new LongitudeBand(125, 140, "Asia/Tokyo"),
        new LongitudeBand(140, 180, "Pacific/Auckland")
    );

    private final List<LongitudeBand> bands;

    public TimezoneEstimator() {
        this(DEFAULT_BANDS);
    }

    TimezoneEstimator(List<LongitudeBand> bands) {
        validate(bands);
        this.bands = List.copyOf(bands);
    }

    /**
     * Estimates an IANA zone identifier. Never fails.
     *
     * @param lat Latitude in degrees
     * @param lng Longitude in degrees
     * @return Zone identifier, {@value #FALLBACK_ZONE} when nothing applies
     */
    public String estimate(double lat, double lng) {
        if (!Double.isFinite(lat) || !Double.isFinite(lng)) {
            return FALLBACK_ZONE;
        }
        if (lat >= INDIA_MIN_LAT && lat <= INDIA_MAX_LAT
            && lng >= INDIA_MIN_LNG && lng <= INDIA_MAX_LNG) {
            return INDIA_ZONE;
        }
        LongitudeBand last = bands.get(bands.size() - 1);
        for (LongitudeBand band : bands) {
            if (lng >= band.getFromInclusive() && lng < band.getToExclusive()) {
                return band.getZone();
            }
        }
        if (lng == last.getToExclusive()) {
            return last.getZone();
        }
        return FALLBACK_ZONE;
    }

    private static void validate(List<LongitudeBand> bands) {
        if (bands == null || bands.isEmpty()) {
            throw new IllegalStateException("At least one longitude band is required");
        }
        if (bands.get(0).getFromInclusive() != -180) {
            throw new IllegalStateException("Longitude bands must start at -180");
        }
        if (bands.get(bands.size() - 1).getToExclusive() != 180) {
            throw new IllegalStateException("Longitude bands must end at 180");
        }
        for (int i = 0; i < bands.size(); i++) {
            LongitudeBand band = bands.get(i);
            if (band.getFromInclusive() >= band.getToExclusive()) {
                throw new IllegalStateException("Empty longitude band: " + band.getZone());
            }
            if (i > 0 && bands.get(i - 1).getToExclusive() != band.getFromInclusive()) {
                throw new IllegalStateException("Longitude bands are not contiguous at " + band.getFromInclusive());
            }
        }
    }

    /**
     * Half-open longitude range [from, to) mapped to one zone. The last band also
     * includes its upper bound.
     */
    @Getter
    @AllArgsConstructor
    static final class LongitudeBand {
        private final double fromInclusive;
        private final double toExclusive;
        private final String zone;
    }
}
