package com.nola.analytics.domain.query;

import com.nola.analytics.domain.model.AnalyticsQueryRequest;
import com.nola.analytics.domain.model.BuiltQuery;
import com.nola.analytics.domain.model.Dimension;
import com.nola.analytics.domain.model.FilterSet;
import com.nola.analytics.domain.model.Metric;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Turns an analytics request into a grouped aggregation over {@code sales}.
 *
 * Only fragments owned by {@link Metric} and {@link Dimension} are concatenated
 * into the SQL text. Filter values and the row limit always travel as positional
 * parameters, appended in the same order as their placeholders.
 *
 * Shape:
 * <pre>
 * SELECT &lt;dimension&gt; AS nome_entidade, &lt;metric&gt; AS valor_metrica
 * FROM sales v [join]
 * WHERE v.sale_status_desc = 'COMPLETED' [AND filters...]
 * GROUP BY &lt;dimension&gt;
 * ORDER BY valor_metrica DESC [LIMIT ?]
 * </pre>
 */
@Component
public class AnalyticsQueryBuilder {

    public static final String BASE_TABLE = "sales v";
    public static final String VALUE_ALIAS = "valor_metrica";
    public static final String COMPLETED_ONLY = "v.sale_status_desc = 'COMPLETED'";

    public BuiltQuery build(AnalyticsQueryRequest request) {
        Metric metric = request.getMetric();
        Dimension dimension = request.getDimension();
        FilterSet filters = request.getFilters();

        List<String> predicates = new ArrayList<>();
        List<Object> params = new ArrayList<>();

        predicates.add(COMPLETED_ONLY);

        if (filters.getChannelId() != null) {
            predicates.add("v.channel_id = ?");
            params.add(filters.getChannelId());
        }
        if (filters.getStoreId() != null) {
            predicates.add("v.store_id = ?");
            params.add(filters.getStoreId());
        }
        if (filters.getWeekday() != null) {
            predicates.add("EXTRACT(DOW FROM v.created_at) = ?");
            params.add(filters.getWeekday().getIndex());
        }
        if (filters.getDateFrom() != null) {
            predicates.add("CAST(v.created_at AS DATE) >= ?");
            params.add(filters.getDateFrom());
        }
        if (filters.getDateTo() != null) {
            predicates.add("CAST(v.created_at AS DATE) <= ?");
            params.add(filters.getDateTo());
        }
        metric.requiredNonNullColumn()
                .ifPresent(column -> predicates.add(column + " IS NOT NULL"));

        StringBuilder sql = new StringBuilder()
                .append("SELECT ").append(dimension.getExpression()).append(" AS ").append(dimension.getAlias())
                .append(", ").append(metric.getExpression()).append(" AS ").append(VALUE_ALIAS)
                .append(" FROM ").append(BASE_TABLE);
        if (dimension.hasJoin()) {
            sql.append(" ").append(dimension.getJoin());
        }
        sql.append(" WHERE ").append(String.join(" AND ", predicates))
                .append(" GROUP BY ").append(dimension.getExpression())
                .append(" ORDER BY ").append(VALUE_ALIAS).append(" DESC");

        if (request.isLimited()) {
            sql.append(" LIMIT ?");
            params.add(request.getLimit());
        }

        return new BuiltQuery(sql.toString(), List.copyOf(params));
    }
}
