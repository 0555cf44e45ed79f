package com.nola.analytics.domain.service;

import com.fasterxml.jackson.core.type.TypeReference;
import com.nola.analytics.domain.model.AnalyticsQueryRequest;
import com.nola.analytics.domain.model.AnalyticsRow;
import com.nola.analytics.domain.model.BuiltQuery;
import com.nola.analytics.domain.model.FilterSet;
import com.nola.analytics.domain.query.AnalyticsQueryBuilder;
import com.nola.analytics.infrastructure.cache.CacheAsideService;
import com.nola.analytics.infrastructure.cache.QueryCacheService;
import com.nola.analytics.infrastructure.persistence.repository.AnalyticsQueryRepository;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Grouped sales aggregations.
 *
 * Query Flow:
 * 1. Derive cache key from every parameter of the request
 * 2. Check cache (Redis)
 * 3. If cache miss, build SQL and query the database
 * 4. Store result in cache
 * 5. Return result
 *
 * Cached rows may lag behind the database by up to the analytics TTL.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AnalyticsService {

    private static final TypeReference<List<AnalyticsRow>> ROWS = new TypeReference<>() {
    };

    private final AnalyticsQueryBuilder queryBuilder;
    private final AnalyticsQueryRepository analyticsQueryRepository;
    private final QueryCacheService cacheService;
    private final CacheAsideService cacheAside;
    private final MeterRegistry meterRegistry;

    @Value("${app.cache.ttl.analytics:600}")
    private long analyticsTtl;

    /**
     * Cached aggregation, used by the dashboard.
     */
    public List<AnalyticsRow> query(AnalyticsQueryRequest request) {
        return cacheAside.getOrCompute(cacheKeyFor(request), ROWS, () -> execute(request), analyticsTtl);
    }

    /**
     * Runs the aggregation against the database, bypassing the cache.
     */
    public List<AnalyticsRow> execute(AnalyticsQueryRequest request) {
        BuiltQuery query = queryBuilder.build(request);
        String type = request.isLimited() ? "dashboard" : "export";
        Timer.Sample sample = Timer.start(meterRegistry);

        try {
            long startTime = System.currentTimeMillis();

            List<AnalyticsRow> rows = analyticsQueryRepository.execute(query);

            long queryTime = System.currentTimeMillis() - startTime;

            sample.stop(Timer.builder("query.latency")
                    .tag("type", type)
                    .tag("metric", request.getMetric().getToken())
                    .register(meterRegistry));

            Counter.builder("query.executed")
                    .tag("type", type)
                    .register(meterRegistry)
                    .increment();

            log.info("Analytics query executed: metric={}, dimension={}, {} rows, {} ms",
                    request.getMetric().getToken(), request.getDimension().getToken(), rows.size(), queryTime);

            return rows;

        } catch (DataAccessException e) {
            log.error("Erro na query de analytics: {}", e.getMessage(), e);

            Counter.builder("query.executed")
                    .tag("type", type)
                    .tag("result", "error")
                    .register(meterRegistry)
                    .increment();

            throw StoreFailures.translate(e);
        }
    }

    /**
     * Key covering metric, dimension, each filter and the row limit.
     */
    public String cacheKeyFor(AnalyticsQueryRequest request) {
        FilterSet filters = request.getFilters();
        return cacheService.generateCacheKey(
                "analytics",
                request.getMetric().getToken(),
                request.getDimension().getToken(),
                filters.getChannelId(),
                filters.getStoreId(),
                filters.getWeekday() != null ? filters.getWeekday().getIndex() : null,
                filters.getDateFrom(),
                filters.getDateTo(),
                request.getLimit()
        );
    }
}
