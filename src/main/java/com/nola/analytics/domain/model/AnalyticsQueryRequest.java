package com.nola.analytics.domain.model;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * Fully validated analytics request.
 *
 * Determines both the emitted SQL and the cache key. {@code limit} is set for
 * dashboard queries and left null for exports, which must return every row.
 */
@Value
@Builder(toBuilder = true)
public class AnalyticsQueryRequest {

    @NonNull
    Metric metric;

    @NonNull
    Dimension dimension;

    @NonNull
    @Builder.Default
    FilterSet filters = FilterSet.none();

    Integer limit;

    public boolean isLimited() {
        return limit != null;
    }

    public AnalyticsQueryRequest unlimited() {
        return toBuilder().limit(null).build();
    }
}
