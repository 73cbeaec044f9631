package com.astrova.location.application.port.in;

import com.astrova.location.domain.model.LocationCandidate;

/**
 * Input port for reverse resolution of coordinates.
 */
public interface ResolveLocationUseCase {

  /**
   * Resolve a point to a single best-effort candidate. Falls back to a
   * coordinate-only candidate when the provider cannot be reached.
   *
   * @param latitude Latitude in [-90, 90]
   * @param longitude Longitude in [-180, 180]
   * @return Candidate, never null
   * @throws IllegalArgumentException if the coordinates are out of range
   */
  LocationCandidate getLocationDetails(double latitude, double longitude);
}
