package com.astrova.location.infrastructure.cache;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.cache.CacheManager;
import org.springframework.cache.annotation.EnableCaching;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Profile;
import org.springframework.data.redis.cache.RedisCacheConfiguration;
import org.springframework.data.redis.cache.RedisCacheManager;
import org.springframework.data.redis.connection.RedisConnectionFactory;
import org.springframework.data.redis.serializer.GenericJackson2JsonRedisSerializer;
import org.springframework.data.redis.serializer.RedisSerializationContext;
import org.springframework.data.redis.serializer.StringRedisSerializer;

import java.time.Clock;
import java.time.Duration;

/**
 * Cache configuration using Redis (distributed cache).
 *
 * Geocoder results are shared across instances, which keeps the request rate
 * against the public geocoder low. The store TTL bounds memory; freshness is
 * checked again by {@link GeocoderSearchCache} against the application clock.
 */
@Configuration
@EnableCaching
public class CacheConfig {

    @Value("${app.cache.geocoder-ttl-seconds:${CACHE_TTL_SECONDS:600}}")
    private long cacheTtlSeconds;

    @Bean
    @Profile("!test")
    public CacheManager cacheManager(RedisConnectionFactory redisConnectionFactory) {
        RedisCacheConfiguration cacheConfig = RedisCacheConfiguration.defaultCacheConfig()
            .entryTtl(Duration.ofSeconds(Math.max(cacheTtlSeconds, 1)))
            .serializeKeysWith(RedisSerializationContext.SerializationPair.fromSerializer(new StringRedisSerializer()))
            .serializeValuesWith(RedisSerializationContext.SerializationPair.fromSerializer(new GenericJackson2JsonRedisSerializer()))
            .disableCachingNullValues();

        return RedisCacheManager.builder(redisConnectionFactory)
            .cacheDefaults(cacheConfig)
            .withCacheConfiguration(GeocoderSearchCache.CACHE_NAME, cacheConfig)
            .build();
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
