package com.astrova.location.application.service;

import com.astrova.location.application.mapper.CandidateNormalizer;
import com.astrova.location.application.port.in.ResolveLocationUseCase;
import com.astrova.location.application.port.in.SearchLocationsUseCase;
import com.astrova.location.application.port.out.LocalGazetteer;
import com.astrova.location.domain.model.Coordinates;
import com.astrova.location.domain.model.LocationCandidate;
import com.astrova.location.domain.service.CandidateDeduplicator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Application service for resolving free text and coordinates into location candidates.
 * Fans out to the gazetteer and the external geocoder, then merges the results.
 */
@Service
public class LocationResolutionService implements SearchLocationsUseCase, ResolveLocationUseCase {

    private static final Logger logger = LoggerFactory.getLogger(LocationResolutionService.class);

    private final LocalGazetteer localGazetteer;
    private final ExternalGeocoderAdapter externalGeocoderAdapter;
    private final CandidateDeduplicator candidateDeduplicator;
    private final CandidateNormalizer candidateNormalizer;
    private final int minQueryLength;
    private final int maxLimit;

    public LocationResolutionService(
            LocalGazetteer localGazetteer,
            ExternalGeocoderAdapter externalGeocoderAdapter,
            CandidateDeduplicator candidateDeduplicator,
            CandidateNormalizer candidateNormalizer,
            @Value("${app.location.min-query-length:2}") int minQueryLength,
            @Value("${app.location.max-limit:50}") int maxLimit) {
        this.localGazetteer = localGazetteer;
        this.externalGeocoderAdapter = externalGeocoderAdapter;
        this.candidateDeduplicator = candidateDeduplicator;
        this.candidateNormalizer = candidateNormalizer;
        this.minQueryLength = minQueryLength;
        this.maxLimit = maxLimit;
    }

    /**
     * Search locations by free text.
     * Strategy: [gazetteer || geocoder] → external-first concatenation → dedup → rank → truncate
     *
     * @param query Place name
     * @param limit Maximum number of results, capped at the configured maximum
     * @return Ordered candidates, empty for short queries
     */
    @Override
    public List<LocationCandidate> searchLocations(String query, int limit) {
        String trimmed = query == null ? "" : query.trim();
        if (trimmed.length() < minQueryLength || limit <= 0) {
            logger.debug("Skipping search for short query '{}' or limit {}", trimmed, limit);
            return List.of();
        }
        int effectiveLimit = Math.min(limit, maxLimit);

        try {
            List<LocationCandidate> merged = Mono.zip(
                    externalGeocoderAdapter.search(trimmed, effectiveLimit),
                    Mono.fromCallable(() -> localGazetteer.search(trimmed, effectiveLimit))
                        .subscribeOn(Schedulers.boundedElastic()))
                .map(results -> {
                    List<LocationCandidate> combined = new ArrayList<>(results.getT1());
                    combined.addAll(results.getT2());
                    logger.debug("Search '{}': {} external, {} local candidates",
                        trimmed, results.getT1().size(), results.getT2().size());
                    return candidateDeduplicator.deduplicate(combined, effectiveLimit);
                })
                .block();
            return merged == null ? List.of() : merged;
        } catch (RuntimeException e) {
            logger.error("Location search failed for '{}', falling back to gazetteer results", trimmed, e);
            return candidateDeduplicator.deduplicate(localGazetteer.search(trimmed, effectiveLimit), effectiveLimit);
        }
    }

    /**
     * Resolve coordinates to a single candidate.
     * Strategy: reverse geocode → on failure, coordinate-only candidate
     */
    @Override
    public LocationCandidate getLocationDetails(double latitude, double longitude) {
        if (!Coordinates.isValid(latitude, longitude)) {
            throw new IllegalArgumentException(
                "Coordinates out of range: " + latitude + ", " + longitude);
        }

        Optional<LocationCandidate> resolved;
        try {
            resolved = externalGeocoderAdapter.reverse(latitude, longitude).block();
        } catch (RuntimeException e) {
            logger.error("Reverse resolution failed for {}, {}", latitude, longitude, e);
            resolved = Optional.empty();
        }

        if (resolved == null || resolved.isEmpty()) {
            logger.debug("Using coordinate fallback for {}, {}", latitude, longitude);
            return candidateNormalizer.coordinateFallback(latitude, longitude);
        }
        return resolved.get();
    }
}
