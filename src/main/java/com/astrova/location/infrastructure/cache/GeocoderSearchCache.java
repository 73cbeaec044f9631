package com.astrova.location.infrastructure.cache;

import com.astrova.location.domain.model.LocationCandidate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.cache.Cache;
import org.springframework.cache.CacheManager;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * TTL cache for successful geocoder search results.
 *
 * Expiry is measured with the injected {@link Clock}, independent of any TTL the
 * backing store applies. Cache infrastructure failures (e.g. Redis connection errors)
 * are logged and treated as misses.
 */
@Component
public class GeocoderSearchCache {

    public static final String CACHE_NAME = "geocoderSearches";

    private static final Logger logger = LoggerFactory.getLogger(GeocoderSearchCache.class);

    private final CacheManager cacheManager;
    private final Clock clock;
    private final Duration ttl;

    @Autowired
    public GeocoderSearchCache(
            CacheManager cacheManager,
            Clock clock,
            @Value("${app.cache.geocoder-ttl-seconds:${CACHE_TTL_SECONDS:600}}") long ttlSeconds) {
        this(cacheManager, clock, Duration.ofSeconds(ttlSeconds));
    }

    public GeocoderSearchCache(CacheManager cacheManager, Clock clock, Duration ttl) {
        this.cacheManager = cacheManager;
        this.clock = clock;
        this.ttl = ttl;
    }

    /**
     * Cached candidates for the query, if present and younger than the TTL.
     */
    public Optional<List<LocationCandidate>> get(String query, int limit) {
        if (isDisabled()) {
            return Optional.empty();
        }
        String cacheKey = buildCacheKey(query, limit);
        try {
            Cache cache = cacheManager.getCache(CACHE_NAME);
            if (cache == null) {
                return Optional.empty();
            }
            CachedSearch cached = cache.get(cacheKey, CachedSearch.class);
            if (cached == null) {
                logger.debug("Geocoder cache miss for key: {}", cacheKey);
                return Optional.empty();
            }
            long ageMillis = clock.millis() - cached.getStoredAtEpochMillis();
            if (ageMillis >= ttl.toMillis()) {
                logger.debug("Geocoder cache entry expired for key: {} (age {} ms)", cacheKey, ageMillis);
                cache.evict(cacheKey);
                return Optional.empty();
            }
            logger.debug("Geocoder cache hit for key: {}", cacheKey);
            return Optional.of(List.copyOf(cached.getCandidates()));
        } catch (Exception e) {
            logger.warn("Failed to read geocoder cache, continuing without cache: {}", e.getMessage());
            return Optional.empty();
        }
    }

    public void put(String query, int limit, List<LocationCandidate> candidates) {
        if (isDisabled()) {
            return;
        }
        String cacheKey = buildCacheKey(query, limit);
        try {
            Cache cache = cacheManager.getCache(CACHE_NAME);
            if (cache != null) {
                cache.put(cacheKey, new CachedSearch(candidates, clock.millis()));
                logger.debug("Geocoder cache populated for key: {}", cacheKey);
            }
        } catch (Exception e) {
            logger.warn("Failed to populate geocoder cache, continuing without cache: {}", e.getMessage());
        }
    }

    /**
     * Cache key from the normalized query and the limit.
     */
    String buildCacheKey(String query, int limit) {
        String normalized = query == null ? "" : query.trim().replaceAll("\\s+", " ").toLowerCase(Locale.ROOT);
        return normalized + ":" + limit;
    }

    private boolean isDisabled() {
        return ttl.isZero() || ttl.isNegative();
    }
}
