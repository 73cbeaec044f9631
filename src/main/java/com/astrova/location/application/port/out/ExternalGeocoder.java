package com.astrova.location.application.port.out;

import reactor.core.publisher.Mono;

import java.util.List;

/**
 * Output port for a third-party geocoding provider.
 * Implementations signal provider failures as errors; callers decide how to recover.
 */
public interface ExternalGeocoder {

  /**
   * Forward search for a free-text place name.
   *
   * @param query Place name
   * @param limit Result cap sent to the provider
   * @return Parsed provider records in provider order
   */
  Mono<List<GeocoderRecord>> search(String query, int limit);

  /**
   * Reverse lookup of the place containing the given point.
   */
  Mono<GeocoderRecord> reverse(double lat, double lng);
}
