package com.nola.analytics.infrastructure.persistence.repository;

import com.nola.analytics.domain.model.AnalyticsRow;
import com.nola.analytics.domain.model.BuiltQuery;
import com.nola.analytics.domain.model.Dimension;
import com.nola.analytics.domain.query.AnalyticsQueryBuilder;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.util.List;

/**
 * Runs the dynamic aggregation SQL produced by {@link AnalyticsQueryBuilder}.
 *
 * The SQL text is assembled from whitelisted fragments only, so it cannot be
 * expressed as a static {@code @Query}; parameters are bound positionally.
 */
@Repository
@RequiredArgsConstructor
public class AnalyticsQueryRepository {

    private static final RowMapper<AnalyticsRow> ROW_MAPPER = (rs, rowNum) -> new AnalyticsRow(
            rs.getObject(Dimension.ALIAS),
            (Number) rs.getObject(AnalyticsQueryBuilder.VALUE_ALIAS));

    private final JdbcTemplate jdbcTemplate;

    public List<AnalyticsRow> execute(BuiltQuery query) {
        return jdbcTemplate.query(query.getSql(), ROW_MAPPER, query.parameterArray());
    }
}
