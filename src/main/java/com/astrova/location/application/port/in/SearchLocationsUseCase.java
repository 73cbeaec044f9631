package com.astrova.location.application.port.in;

import com.astrova.location.domain.model.LocationCandidate;

import java.util.List;

/**
 * Input port for free-text location search.
 */
public interface SearchLocationsUseCase {

  /**
   * Search the gazetteer and the external geocoder, merge and deduplicate.
   * Strategy: [gazetteer || geocoder (cache first)] → dedup → rank → truncate
   *
   * @param query Free-text place name; shorter than the minimum length yields no results
   * @param limit Maximum number of results
   * @return Ordered, deduplicated candidates; never null
   */
  List<LocationCandidate> searchLocations(String query, int limit);
}
