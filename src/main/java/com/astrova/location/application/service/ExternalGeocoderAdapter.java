package com.astrova.location.application.service;

import com.astrova.location.application.mapper.CandidateNormalizer;
import com.astrova.location.application.port.out.ExternalGeocoder;
import com.astrova.location.domain.model.LocationCandidate;
import com.astrova.location.infrastructure.cache.GeocoderSearchCache;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.Optional;

/**
 * Fail-soft access to the external geocoder.
 *
 * Provider failures (network errors, timeouts, non-2xx, malformed bodies) are logged
 * and turned into an empty result; they never reach the caller. Only successful
 * searches are cached.
 */
@Service
public class ExternalGeocoderAdapter {

    private static final Logger logger = LoggerFactory.getLogger(ExternalGeocoderAdapter.class);

    private final ExternalGeocoder externalGeocoder;
    private final CandidateNormalizer candidateNormalizer;
    private final GeocoderSearchCache searchCache;

    public ExternalGeocoderAdapter(
            ExternalGeocoder externalGeocoder,
            CandidateNormalizer candidateNormalizer,
            GeocoderSearchCache searchCache) {
        this.externalGeocoder = externalGeocoder;
        this.candidateNormalizer = candidateNormalizer;
        this.searchCache = searchCache;
    }

    /**
     * Search the provider, cache first.
     *
     * @return Normalized external candidates; empty on any failure, never an error signal
     */
    public Mono<List<LocationCandidate>> search(String query, int limit) {
        Optional<List<LocationCandidate>> cached = searchCache.get(query, limit);
        if (cached.isPresent()) {
            return Mono.just(cached.get());
        }

        return Mono.defer(() -> externalGeocoder.search(query, limit))
                .map(records -> records.stream()
                        .map(candidateNormalizer::fromGeocoder)
                        .flatMap(Optional::stream)
                        .toList())
                .doOnNext(candidates -> searchCache.put(query, limit, candidates))
                .onErrorResume(e -> {
                    logger.warn("External geocoder search failed for '{}', continuing without external results: {}",
                            query, e.getMessage());
                    return Mono.just(List.of());
                })
                .defaultIfEmpty(List.of());
    }

    /**
     * Reverse lookup.
     *
     * @return The resolved candidate, or empty when the provider failed
     */
    public Mono<Optional<LocationCandidate>> reverse(double lat, double lng) {
        return Mono.defer(() -> externalGeocoder.reverse(lat, lng))
                .map(record -> Optional.of(candidateNormalizer.fromReverse(record, lat, lng)))
                .onErrorResume(e -> {
                    logger.warn("Reverse geocoding failed for {}, {}: {}", lat, lng, e.getMessage());
                    return Mono.just(Optional.empty());
                })
                .defaultIfEmpty(Optional.empty());
    }
}
