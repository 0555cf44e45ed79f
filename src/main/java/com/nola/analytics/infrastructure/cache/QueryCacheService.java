package com.nola.analytics.infrastructure.cache;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.stereotype.Service;

import java.util.Optional;
import java.util.concurrent.TimeUnit;

/**
 * Redis access for cached query results and filter lists.
 *
 * Values are stored as JSON strings with a TTL. There is no explicit
 * invalidation: writes to the sales dataset happen out-of-band and the TTL
 * bounds how stale a cached answer can be.
 *
 * Failure Handling:
 * - Redis errors propagate out of get/set so the "redis" circuit breaker
 *   counts them; the fallbacks turn them into a miss or a dropped write
 * - While the breaker is open Redis is not called at all
 * - A stored value that no longer parses is a miss
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class QueryCacheService {

    public static final String ABSENT = "none";

    private final RedisTemplate<String, String> redisTemplate;
    private final ObjectMapper objectMapper;

    /**
     * Get cached value. Empty on miss; Redis failures are handled by the fallback.
     */
    @CircuitBreaker(name = "redis", fallbackMethod = "getCacheFallback")
    public <T> Optional<T> get(String key, TypeReference<T> type) {
        String cached = redisTemplate.opsForValue().get(key);

        if (cached == null) {
            log.debug("Cache miss for key: {}", key);
            return Optional.empty();
        }

        try {
            // Decimals stay BigDecimal so a hit carries the same digits as the query result
            T value = objectMapper.readerFor(type)
                    .with(DeserializationFeature.USE_BIG_DECIMAL_FOR_FLOATS)
                    .readValue(cached);
            log.debug("Cache hit for key: {}", key);
            return Optional.ofNullable(value);

        } catch (JsonProcessingException e) {
            log.error("Unreadable cache entry for key {}: {}", key, e.getMessage());
            return Optional.empty();
        }
    }

    /**
     * Store value in cache with the given TTL.
     */
    @CircuitBreaker(name = "redis", fallbackMethod = "setCacheFallback")
    public void set(String key, Object value, long ttlSeconds) {
        String json;
        try {
            json = objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            log.error("Error serializing cache value for key {}: {}", key, e.getMessage());
            return;
        }

        redisTemplate.opsForValue().set(key, json, ttlSeconds, TimeUnit.SECONDS);
        log.debug("Cached result for key: {} (TTL: {}s)", key, ttlSeconds);
    }

    /**
     * Generate cache key from query parameters.
     *
     * Absent values are written as {@value #ABSENT} so every position in the
     * key is always filled and keys of different requests cannot line up.
     */
    public String generateCacheKey(String prefix, Object... params) {
        StringBuilder key = new StringBuilder(prefix);
        for (Object param : params) {
            key.append(":").append(param != null ? param.toString() : ABSENT);
        }
        return key.toString();
    }

    // Fallback methods (circuit breaker): Redis error or open circuit

    private <T> Optional<T> getCacheFallback(String key, TypeReference<T> type, Exception e) {
        log.warn("Cache read skipped for key {}, falling back to database: {}", key, e.getMessage());
        return Optional.empty();
    }

    private void setCacheFallback(String key, Object value, long ttlSeconds, Exception e) {
        log.warn("Cache write skipped for key {}: {}", key, e.getMessage());
    }
}
