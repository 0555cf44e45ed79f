package com.nola.analytics.infrastructure.cache;

import com.fasterxml.jackson.core.type.TypeReference;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Optional;
import java.util.function.Supplier;

/**
 * Cache-aside policy on top of {@link QueryCacheService}.
 *
 * Flow:
 * 1. Look the key up in Redis
 * 2. On hit, return the stored value without calling the loader
 * 3. On miss, call the loader, store its result, return it
 *
 * An unreachable Redis behaves as a permanent miss, so callers always get
 * data from the loader. A loader failure propagates and nothing is stored.
 * Concurrent misses on the same key may both load; last write wins.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class CacheAsideService {

    private final QueryCacheService cacheService;
    private final MeterRegistry meterRegistry;

    public <T> T getOrCompute(String key, TypeReference<T> type, Supplier<T> loader, long ttlSeconds) {
        Optional<T> cached = cacheService.get(key, type);

        if (cached.isPresent()) {
            countLookup(key, "hit");
            return cached.get();
        }

        countLookup(key, "miss");

        T value = loader.get();
        cacheService.set(key, value, ttlSeconds);
        return value;
    }

    private void countLookup(String key, String result) {
        Counter.builder("query.cache")
                .tag("result", result)
                .tag("prefix", prefixOf(key))
                .register(meterRegistry)
                .increment();
    }

    private static String prefixOf(String key) {
        int separator = key.indexOf(':');
        return separator < 0 ? key : key.substring(0, separator);
    }
}
