package com.astrova.location.domain.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;
import lombok.With;

/**
 * One resolved location suggestion.
 *
 * Candidates are created per query and never mutated; relabelling goes through
 * {@link #withDisplayName(String)}. Text fields are never null, absence is the empty string.
 */
@Getter
@EqualsAndHashCode
@ToString
public final class LocationCandidate {

    private final String name;
    @With
    private final String displayName;
    private final double latitude;
    private final double longitude;
    private final String city;
    private final String state;
    private final String country;
    private final String timezone;
    private final LocationSource source;

    @Builder
    @JsonCreator
    public LocationCandidate(
        @JsonProperty("name") String name,
        @JsonProperty("displayName") String displayName,
        @JsonProperty("latitude") double latitude,
        @JsonProperty("longitude") double longitude,
        @JsonProperty("city") String city,
        @JsonProperty("state") String state,
        @JsonProperty("country") String country,
        @JsonProperty("timezone") String timezone,
        @JsonProperty("source") LocationSource source
    ) {
        if (!Coordinates.isValid(latitude, longitude)) {
            throw new IllegalArgumentException(
                "Coordinates out of range: " + latitude + ", " + longitude);
        }
        if (timezone == null || timezone.isBlank()) {
            throw new IllegalArgumentException("Timezone must not be blank");
        }
        if (source == null) {
            throw new IllegalArgumentException("Source must not be null");
        }
        this.name = orEmpty(name);
        this.displayName = orEmpty(displayName);
        this.latitude = latitude;
        this.longitude = longitude;
        this.city = orEmpty(city);
        this.state = orEmpty(state);
        this.country = orEmpty(country);
        this.timezone = timezone;
        this.source = source;
    }

    private static String orEmpty(String value) {
        return value == null ? "" : value.trim();
    }
}
