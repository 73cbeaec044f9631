package com.astrova.location.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.util.List;

@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
public class LocationSearchResponseDto {

    @JsonProperty("query")
    private String query;

    @JsonProperty("count")
    private Integer count;

    @JsonProperty("locations")
    private List<LocationResponseDto> locations;
}
