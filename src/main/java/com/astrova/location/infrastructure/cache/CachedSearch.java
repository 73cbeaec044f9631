package com.astrova.location.infrastructure.cache;

import com.astrova.location.domain.model.LocationCandidate;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.util.ArrayList;
import java.util.List;

/**
 * Cached geocoder search result with the instant it was stored.
 */
@Getter
@Setter
@NoArgsConstructor
public class CachedSearch {

    private List<LocationCandidate> candidates;
    private long storedAtEpochMillis;

    public CachedSearch(List<LocationCandidate> candidates, long storedAtEpochMillis) {
        // mutable copy so the Redis JSON serializer can round-trip the list type
        this.candidates = new ArrayList<>(candidates);
        this.storedAtEpochMillis = storedAtEpochMillis;
    }
}
