package com.astrova.location.domain.service;

import com.astrova.location.domain.model.LocationCandidate;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Builds the human-readable labels shown for candidates.
 */
@Service
public class DisplayNameFormatter {

    /**
     * {@code "{name-or-city}, {state}, {country} ({lat}, {lng})"} with empty segments omitted
     * and coordinates at 4 decimals, so same-name places stay distinguishable in a list.
     */
    public String synthesize(LocationCandidate candidate) {
        String label = candidate.getName().isBlank() ? candidate.getCity() : candidate.getName();
        List<String> parts = new ArrayList<>(3);
        if (!label.isBlank()) {
            parts.add(label);
        }
        if (!candidate.getState().isBlank()) {
            parts.add(candidate.getState());
        }
        if (!candidate.getCountry().isBlank()) {
            parts.add(candidate.getCountry());
        }
        String coordinates = coordinatePair(candidate.getLatitude(), candidate.getLongitude());
        if (parts.isEmpty()) {
            return coordinates;
        }
        return String.join(", ", parts) + " (" + coordinates + ")";
    }

    public String coordinatePair(double lat, double lng) {
        return String.format(Locale.ROOT, "%.4f, %.4f", lat, lng);
    }
}
