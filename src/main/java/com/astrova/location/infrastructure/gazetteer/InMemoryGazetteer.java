package com.astrova.location.infrastructure.gazetteer;

import com.astrova.location.application.mapper.CandidateNormalizer;
import com.astrova.location.application.port.out.LocalGazetteer;
import com.astrova.location.domain.model.Coordinates;
import com.astrova.location.domain.model.GazetteerEntry;
import com.astrova.location.domain.model.LocationCandidate;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Immutable table of curated localities, matched by case-insensitive name substring.
 * Safe for concurrent reads.
 */
public class InMemoryGazetteer implements LocalGazetteer {

    private final List<GazetteerEntry> entries;
    private final CandidateNormalizer candidateNormalizer;

    /**
     * @throws IllegalStateException if an entry lacks a name or timezone, or has invalid coordinates
     */
    public InMemoryGazetteer(List<GazetteerEntry> entries, CandidateNormalizer candidateNormalizer) {
        entries.forEach(InMemoryGazetteer::validate);
        this.entries = List.copyOf(entries);
        this.candidateNormalizer = candidateNormalizer;
    }

    @Override
    public List<LocationCandidate> search(String query, int limit) {
        if (query == null || query.isBlank() || limit <= 0) {
            return List.of();
        }
        String needle = query.trim().toLowerCase(Locale.ROOT);

        List<LocationCandidate> results = new ArrayList<>();
        for (GazetteerEntry entry : entries) {
            if (results.size() >= limit) {
                break;
            }
            if (entry.getName().toLowerCase(Locale.ROOT).contains(needle)) {
                Optional<LocationCandidate> candidate = candidateNormalizer.fromGazetteer(entry);
                candidate.ifPresent(results::add);
            }
        }
        return results;
    }

    public int size() {
        return entries.size();
    }

    private static void validate(GazetteerEntry entry) {
        if (entry == null || entry.getName() == null || entry.getName().isBlank()) {
            throw new IllegalStateException("Gazetteer entry without a name: " + entry);
        }
        if (entry.getTimezone() == null || entry.getTimezone().isBlank()) {
            throw new IllegalStateException("Gazetteer entry without a timezone: " + entry.getName());
        }
        if (!Coordinates.isValid(entry.getLatitude(), entry.getLongitude())) {
            throw new IllegalStateException("Gazetteer entry with invalid coordinates: " + entry.getName());
        }
    }
}
