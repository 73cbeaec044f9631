package com.astrova.location.application.mapper;

import com.astrova.location.api.dto.LocationResponseDto;
import com.astrova.location.api.dto.LocationSearchResponseDto;
import com.astrova.location.domain.model.LocationCandidate;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Mapper for converting between domain models and DTOs.
 */
@Component
public class LocationMapper {

  /**
   * Maps a domain LocationCandidate to a LocationResponseDto.
   *
   * @param candidate Domain model
   * @return DTO representation
   */
  public LocationResponseDto toDto(LocationCandidate candidate) {
    return new LocationResponseDto(
        candidate.getName(),
        candidate.getDisplayName(),
        candidate.getLatitude(),
        candidate.getLongitude(),
        candidate.getCity(),
        candidate.getState(),
        candidate.getCountry(),
        candidate.getTimezone(),
        candidate.getSource().getLabel());
  }

  public LocationSearchResponseDto toSearchResponse(String query, List<LocationCandidate> candidates) {
    List<LocationResponseDto> locations = candidates.stream()
        .map(this::toDto)
        .toList();
    return new LocationSearchResponseDto(query, locations.size(), locations);
  }
}
