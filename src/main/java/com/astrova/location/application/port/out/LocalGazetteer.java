package com.astrova.location.application.port.out;

import com.astrova.location.domain.model.LocationCandidate;

import java.util.List;

/**
 * Output port for the curated, in-memory table of known localities.
 */
public interface LocalGazetteer {

  /**
   * Case-insensitive substring match on locality names, in table order.
   * Never performs I/O and never fails.
   */
  List<LocationCandidate> search(String query, int limit);
}
