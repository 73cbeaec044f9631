package com.astrova.location.domain.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * Curated locality with pre-verified coordinates and timezone.
 */
@Getter
@EqualsAndHashCode
@ToString
public class GazetteerEntry {

    private final String name;
    private final double latitude;
    private final double longitude;
    private final String state;
    private final String country;
    private final String timezone;

    @JsonCreator
    public GazetteerEntry(
        @JsonProperty("name") String name,
        @JsonProperty("latitude") double latitude,
        @JsonProperty("longitude") double longitude,
        @JsonProperty("state") String state,
        @JsonProperty("country") String country,
        @JsonProperty("timezone") String timezone
    ) {
        this.name = name;
        this.latitude = latitude;
        this.longitude = longitude;
        this.state = state;
        this.country = country;
        this.timezone = timezone;
    }
}
