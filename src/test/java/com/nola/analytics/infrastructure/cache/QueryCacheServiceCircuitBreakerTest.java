package com.nola.analytics.infrastructure.cache;

import com.fasterxml.jackson.core.type.TypeReference;
import com.nola.analytics.domain.model.FilterOption;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import io.github.resilience4j.springboot3.circuitbreaker.autoconfigure.CircuitBreakerAutoConfiguration;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.autoconfigure.ImportAutoConfiguration;
import org.springframework.boot.autoconfigure.aop.AopAutoConfiguration;
import org.springframework.boot.autoconfigure.jackson.JacksonAutoConfiguration;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Import;
import org.springframework.data.redis.RedisConnectionFailureException;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.data.redis.core.ValueOperations;

import java.util.List;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

/**
 * QueryCacheService behind its "redis" circuit breaker.
 *
 * Runs the real Resilience4j aspect so Redis failures are recorded by the
 * breaker and absorbed by the fallbacks.
 */
@SpringBootTest(
        classes = {QueryCacheService.class, CacheAsideService.class},
        properties = {
                "resilience4j.circuitbreaker.instances.redis.sliding-window-size=5",
                "resilience4j.circuitbreaker.instances.redis.minimum-number-of-calls=5",
                "resilience4j.circuitbreaker.instances.redis.failure-rate-threshold=50",
                "resilience4j.circuitbreaker.instances.redis.wait-duration-in-open-state=60s"
        })
@ImportAutoConfiguration({
        AopAutoConfiguration.class,
        JacksonAutoConfiguration.class,
        CircuitBreakerAutoConfiguration.class})
@Import(QueryCacheServiceCircuitBreakerTest.MetricsConfig.class)
class QueryCacheServiceCircuitBreakerTest {

    private static final TypeReference<List<FilterOption>> OPTIONS = new TypeReference<>() {
    };

    @TestConfiguration
    static class MetricsConfig {
        @Bean
        MeterRegistry meterRegistry() {
            return new SimpleMeterRegistry();
        }
    }

    @MockBean
    private RedisTemplate<String, String> redisTemplate;

    @Autowired
    private QueryCacheService cacheService;

    @Autowired
    private CacheAsideService cacheAside;

    @Autowired
    private CircuitBreakerRegistry circuitBreakerRegistry;

    @SuppressWarnings("unchecked")
    private final ValueOperations<String, String> valueOperations = mock(ValueOperations.class);

    private CircuitBreaker breaker;

    @BeforeEach
    void setUp() {
        breaker = circuitBreakerRegistry.circuitBreaker("redis");
        breaker.reset();
        when(redisTemplate.opsForValue()).thenReturn(valueOperations);
    }

    @Test
    void testGet_RepeatedRedisFailures_OpenCircuitAndStopCallingRedis() {
        // Given
        when(valueOperations.get(anyString()))
                .thenThrow(new RedisConnectionFailureException("Unable to connect to Redis"));

        // When
        for (int i = 0; i < 20; i++) {
            assertTrue(cacheService.get("filtros:canais", OPTIONS).isEmpty());
        }

        // Then: only the calls inside the sliding window reached Redis
        assertEquals(CircuitBreaker.State.OPEN, breaker.getState());
        assertEquals(5, breaker.getMetrics().getNumberOfFailedCalls());
        verify(valueOperations, times(5)).get("filtros:canais");
    }

    @Test
    void testGetOrCompute_RedisDown_ReturnsLoaderValue() {
        // Given
        when(valueOperations.get(anyString()))
                .thenThrow(new RedisConnectionFailureException("Unable to connect to Redis"));
        doThrow(new RedisConnectionFailureException("Unable to connect to Redis"))
                .when(valueOperations).set(anyString(), anyString(), anyLong(), any(TimeUnit.class));
        List<FilterOption> stores = List.of(new FilterOption(5, "Loja Centro"));

        // When
        List<FilterOption> result = cacheAside.getOrCompute("filtros:lojas", OPTIONS, () -> stores, 3600);

        // Then
        assertEquals(stores, result);
        assertEquals(2, breaker.getMetrics().getNumberOfFailedCalls());
    }

    @Test
    void testGet_CorruptedValue_IsMissButNotFailure() {
        when(valueOperations.get("filtros:canais")).thenReturn("{not json");

        for (int i = 0; i < 10; i++) {
            assertTrue(cacheService.get("filtros:canais", OPTIONS).isEmpty());
        }

        assertEquals(CircuitBreaker.State.CLOSED, breaker.getState());
        assertEquals(0, breaker.getMetrics().getNumberOfFailedCalls());
        verify(valueOperations, times(10)).get("filtros:canais");
    }
}
