package com.astrova.location.application.mapper;

import com.astrova.location.application.port.out.GeocoderRecord;
import com.astrova.location.application.port.out.GeocoderRecord.AddressedRecord;
import com.astrova.location.application.port.out.GeocoderRecord.UnaddressedRecord;
import com.astrova.location.domain.model.Coordinates;
import com.astrova.location.domain.model.GazetteerEntry;
import com.astrova.location.domain.model.LocationCandidate;
import com.astrova.location.domain.model.LocationSource;
import com.astrova.location.domain.service.DisplayNameFormatter;
import com.astrova.location.domain.service.TimezoneEstimator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Optional;
import java.util.OptionalDouble;

/**
 * Converts raw gazetteer entries and geocoder records into canonical candidates.
 *
 * Records whose coordinates are missing, unparsable or out of range are dropped.
 * Search candidates leave {@code displayName} empty; it is synthesized after deduplication.
 */
@Component
public class CandidateNormalizer {

    private static final Logger logger = LoggerFactory.getLogger(CandidateNormalizer.class);

    static final String DEFAULT_GAZETTEER_COUNTRY = "India";

    static final ExtractorChain<AddressedRecord> CITY = ExtractorChain.of(
        AddressedRecord::getCity,
        AddressedRecord::getTown,
        AddressedRecord::getVillage,
        AddressedRecord::getHamlet);

    static final ExtractorChain<AddressedRecord> LOCALITY =
        CITY.orElse(record -> firstSegment(record.getDisplayName()));

    static final ExtractorChain<AddressedRecord> STATE = ExtractorChain.of(
        AddressedRecord::getState,
        AddressedRecord::getRegion,
        AddressedRecord::getStateDistrict);

    static final ExtractorChain<AddressedRecord> COUNTRY = ExtractorChain.of(
        AddressedRecord::getCountry);

    private final TimezoneEstimator timezoneEstimator;
    private final DisplayNameFormatter displayNameFormatter;

    public CandidateNormalizer(TimezoneEstimator timezoneEstimator, DisplayNameFormatter displayNameFormatter) {
        this.timezoneEstimator = timezoneEstimator;
        this.displayNameFormatter = displayNameFormatter;
    }

    /**
     * Maps a curated entry. Entries always carry their own timezone.
     */
    public Optional<LocationCandidate> fromGazetteer(GazetteerEntry entry) {
        if (entry == null || !Coordinates.isValid(entry.getLatitude(), entry.getLongitude())) {
            logger.debug("Dropping gazetteer entry with invalid coordinates: {}", entry);
            return Optional.empty();
        }
        String country = isBlank(entry.getCountry()) ? DEFAULT_GAZETTEER_COUNTRY : entry.getCountry();
        return Optional.of(LocationCandidate.builder()
            .name(entry.getName())
            .latitude(entry.getLatitude())
            .longitude(entry.getLongitude())
            .city(entry.getName())
            .state(entry.getState())
            .country(country)
            .timezone(entry.getTimezone())
            .source(LocationSource.LOCAL)
            .build());
    }

    /**
     * Maps a forward-search record. Display name is left for the deduplicator.
     */
    public Optional<LocationCandidate> fromGeocoder(GeocoderRecord record) {
        if (record == null) {
            return Optional.empty();
        }
        OptionalDouble lat = parseCoordinate(record.getLatitude());
        OptionalDouble lng = parseCoordinate(record.getLongitude());
        if (lat.isEmpty() || lng.isEmpty() || !Coordinates.isValid(lat.getAsDouble(), lng.getAsDouble())) {
            logger.debug("Dropping geocoder record with invalid coordinates: {}", record);
            return Optional.empty();
        }
        return Optional.of(toCandidate(record, lat.getAsDouble(), lng.getAsDouble(), ""));
    }

    /**
     * Maps a reverse-lookup record, keeping the requested point and the provider's
     * formatted address as the label.
     */
    public LocationCandidate fromReverse(GeocoderRecord record, double lat, double lng) {
        String displayName = isBlank(record.getDisplayName())
            ? displayNameFormatter.coordinatePair(lat, lng)
            : record.getDisplayName();
        return toCandidate(record, lat, lng, displayName);
    }

    /**
     * Coordinate-only candidate used when reverse lookup fails.
     */
    public LocationCandidate coordinateFallback(double lat, double lng) {
        String label = displayNameFormatter.coordinatePair(lat, lng);
        return LocationCandidate.builder()
            .name(label)
            .displayName(label)
            .latitude(lat)
            .longitude(lng)
            .timezone(timezoneEstimator.estimate(lat, lng))
            .source(LocationSource.LOCAL)
            .build();
    }

    private LocationCandidate toCandidate(GeocoderRecord record, double lat, double lng, String displayName) {
        String timezone = isBlank(record.getTimezone())
            ? timezoneEstimator.estimate(lat, lng)
            : record.getTimezone().trim();
        LocationCandidate.LocationCandidateBuilder builder = LocationCandidate.builder()
            .displayName(displayName)
            .latitude(lat)
            .longitude(lng)
            .timezone(timezone)
            .source(LocationSource.EXTERNAL);

        if (record instanceof AddressedRecord addressed) {
            builder.name(LOCALITY.extractOrEmpty(addressed))
                .city(CITY.extractOrEmpty(addressed))
                .state(STATE.extractOrEmpty(addressed))
                .country(COUNTRY.extractOrEmpty(addressed));
        } else if (record instanceof UnaddressedRecord unaddressed) {
            builder.name(firstSegment(unaddressed.getDisplayName()));
        }
        return builder.build();
    }

    /**
     * Parses a provider coordinate; empty when absent, unparsable or not finite.
     */
    static OptionalDouble parseCoordinate(String raw) {
        if (isBlank(raw)) {
            return OptionalDouble.empty();
        }
        try {
            double value = Double.parseDouble(raw.trim());
            return Double.isFinite(value) ? OptionalDouble.of(value) : OptionalDouble.empty();
        } catch (NumberFormatException e) {
            return OptionalDouble.empty();
        }
    }

    static String firstSegment(String displayName) {
        if (isBlank(displayName)) {
            return "";
        }
        int comma = displayName.indexOf(',');
        return (comma < 0 ? displayName : displayName.substring(0, comma)).trim();
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
