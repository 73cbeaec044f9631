package com.astrova.location.application.port.out;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

/**
 * Raw place returned by an external geocoder, before normalization.
 *
 * Providers return either a structured address breakdown or only a formatted label;
 * each shape is a separate type with its own mapping. Coordinates stay as the provider
 * sent them and are parsed during normalization.
 */
public sealed interface GeocoderRecord permits GeocoderRecord.AddressedRecord, GeocoderRecord.UnaddressedRecord {

    String getLatitude();

    String getLongitude();

    String getDisplayName();

    /**
     * Provider-supplied IANA zone, or null.
     */
    String getTimezone();

    /**
     * Place with an address breakdown.
     */
    @Getter
    @Builder
    @ToString
    @AllArgsConstructor
    final class AddressedRecord implements GeocoderRecord {
        private final String latitude;
        private final String longitude;
        private final String displayName;
        private final String timezone;
        private final String city;
        private final String town;
        private final String village;
        private final String hamlet;
        private final String state;
        private final String region;
        private final String stateDistrict;
        private final String country;
    }

    /**
     * Place known only by its formatted label.
     */
    @Getter
    @ToString
    @AllArgsConstructor
    final class UnaddressedRecord implements GeocoderRecord {
        private final String latitude;
        private final String longitude;
        private final String displayName;
        private final String timezone;
    }
}
