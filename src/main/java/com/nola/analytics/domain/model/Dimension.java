package com.nola.analytics.domain.model;

import com.nola.analytics.domain.exception.InvalidParameterException;
import lombok.Getter;

import java.util.Arrays;

/**
 * Grouping axes for analytics queries.
 *
 * Every dimension is projected under the same alias so the JSON payload has a
 * stable shape regardless of how the rows were grouped.
 */
@Getter
public enum Dimension {

    LOJA("loja", "s.name", "JOIN stores s ON v.store_id = s.id", "Loja"),
    CANAL("canal", "c.name", "JOIN channels c ON v.channel_id = c.id", "Canal"),
    PRODUTO("produto", "p.name",
            "JOIN product_sales ps ON ps.sale_id = v.id JOIN products p ON ps.product_id = p.id", "Produto"),
    DIA_DA_SEMANA("dia_da_semana", Weekday.caseExpression("v.created_at"), "", "Dia da Semana"),
    HORA_DO_DIA("hora_do_dia", "EXTRACT(HOUR FROM v.created_at)::INTEGER", "", "Hora do Dia");

    public static final String ALIAS = "nome_entidade";

    private final String token;
    private final String expression;
    private final String join;
    private final String reportLabel;

    Dimension(String token, String expression, String join, String reportLabel) {
        this.token = token;
        this.expression = expression;
        this.join = join;
        this.reportLabel = reportLabel;
    }

    public String getAlias() {
        return ALIAS;
    }

    public boolean hasJoin() {
        return !join.isEmpty();
    }

    public static Dimension fromToken(String token) {
        return Arrays.stream(values())
                .filter(d -> d.token.equals(token))
                .findFirst()
                .orElseThrow(() -> new InvalidParameterException("Dimensão inválida"));
    }
}
