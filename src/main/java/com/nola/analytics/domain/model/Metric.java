package com.nola.analytics.domain.model;

import com.nola.analytics.domain.exception.InvalidParameterException;
import lombok.Getter;

import java.util.Arrays;
import java.util.Optional;

/**
 * Aggregations that can be requested through the API.
 *
 * The set is closed: the token is what clients send, the expression is the only
 * SQL that ever reaches the SELECT list for the metric column.
 */
@Getter
public enum Metric {

    FATURAMENTO_TOTAL("faturamento_total", "SUM(v.total_amount)", "Faturamento Total (R$)", null),
    TOTAL_DE_VENDAS("total_de_vendas", "COUNT(v.id)", "Total de Vendas", null),
    TICKET_MEDIO("ticket_medio", "AVG(v.total_amount)", "Ticket Médio (R$)", null),
    TEMPO_ENTREGA_MIN("tempo_entrega_min", "AVG(v.delivery_seconds) / 60.0",
            "Tempo Médio de Entrega (min)", "v.delivery_seconds");

    private final String token;
    private final String expression;
    private final String reportLabel;

    // Column that must be populated for the aggregate to be meaningful
    private final String requiredColumn;

    Metric(String token, String expression, String reportLabel, String requiredColumn) {
        this.token = token;
        this.expression = expression;
        this.reportLabel = reportLabel;
        this.requiredColumn = requiredColumn;
    }

    public Optional<String> requiredNonNullColumn() {
        return Optional.ofNullable(requiredColumn);
    }

    public static Metric fromToken(String token) {
        return Arrays.stream(values())
                .filter(m -> m.token.equals(token))
                .findFirst()
                .orElseThrow(() -> new InvalidParameterException("Métrica inválida"));
    }
}
