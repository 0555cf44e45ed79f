package com.nola.analytics.infrastructure.persistence.repository;

import com.nola.analytics.domain.model.AtRiskCustomer;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.sql.Timestamp;
import java.util.List;

/**
 * Customer segmentation queries.
 */
@Repository
@RequiredArgsConstructor
public class CustomerSegmentRepository {

    /**
     * Recurring customers (at least {@code minPurchases} completed sales) whose last
     * purchase is older than {@code inactiveDays}. Longest-inactive first.
     */
    static final String AT_RISK_SQL = """
            WITH customer_kpis AS (
                SELECT customer_id,
                       COUNT(id) AS total_compras,
                       MAX(created_at) AS ultima_compra,
                       SUM(total_amount) AS ltv_total
                FROM sales
                WHERE customer_id IS NOT NULL AND sale_status_desc = 'COMPLETED'
                GROUP BY customer_id
            )
            SELECT c.customer_name, c.phone_number, c.email,
                   k.total_compras, k.ultima_compra, k.ltv_total,
                   (CURRENT_DATE - k.ultima_compra::date) AS dias_desde_ultima_compra
            FROM customer_kpis k
            JOIN customers c ON k.customer_id = c.id
            WHERE k.total_compras >= ? AND (CURRENT_DATE - k.ultima_compra::date) > ?
            ORDER BY dias_desde_ultima_compra DESC, k.total_compras DESC
            """;

    private static final RowMapper<AtRiskCustomer> ROW_MAPPER = (rs, rowNum) -> {
        Timestamp lastPurchase = rs.getTimestamp("ultima_compra");
        return AtRiskCustomer.builder()
                .customerName(rs.getString("customer_name"))
                .phoneNumber(rs.getString("phone_number"))
                .email(rs.getString("email"))
                .totalPurchases(rs.getLong("total_compras"))
                .lastPurchaseAt(lastPurchase != null ? lastPurchase.toLocalDateTime() : null)
                .lifetimeValue(rs.getBigDecimal("ltv_total"))
                .daysSinceLastPurchase(rs.getInt("dias_desde_ultima_compra"))
                .build();
    };

    private final JdbcTemplate jdbcTemplate;

    public List<AtRiskCustomer> findAtRiskCustomers(int minPurchases, int inactiveDays) {
        return jdbcTemplate.query(AT_RISK_SQL, ROW_MAPPER, minPurchases, inactiveDays);
    }
}
