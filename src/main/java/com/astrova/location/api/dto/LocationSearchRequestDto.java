package com.astrova.location.api.dto;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * Query parameters for location search.
 * A missing or too-short query is not an error; it simply yields no results.
 */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
public class LocationSearchRequestDto {

    private String q;

    @Min(value = 1, message = "Limit must be at least 1")
    @Max(value = 50, message = "Limit must be at most 50")
    private Integer limit;
}
