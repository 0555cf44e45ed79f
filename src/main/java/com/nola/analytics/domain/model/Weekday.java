package com.nola.analytics.domain.model;

import com.nola.analytics.domain.exception.InvalidParameterException;
import lombok.Getter;

import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Weekdays indexed the way PostgreSQL's {@code EXTRACT(DOW ...)} numbers them (0 = Sunday).
 */
@Getter
public enum Weekday {

    DOMINGO(0, "Domingo"),
    SEGUNDA(1, "Segunda-feira"),
    TERCA(2, "Terça-feira"),
    QUARTA(3, "Quarta-feira"),
    QUINTA(4, "Quinta-feira"),
    SEXTA(5, "Sexta-feira"),
    SABADO(6, "Sábado");

    private final int index;
    private final String displayName;

    Weekday(int index, String displayName) {
        this.index = index;
        this.displayName = displayName;
    }

    public static Weekday fromIndex(int index) {
        return Arrays.stream(values())
                .filter(w -> w.index == index)
                .findFirst()
                .orElseThrow(() -> new InvalidParameterException("Dia da semana inválido"));
    }

    public static List<FilterOption> options() {
        return Arrays.stream(values())
                .map(w -> new FilterOption(w.index, w.displayName))
                .collect(Collectors.toList());
    }

    /**
     * SQL CASE mapping the day-of-week of {@code column} to its display name.
     */
    static String caseExpression(String column) {
        StringBuilder sql = new StringBuilder("CASE EXTRACT(DOW FROM ").append(column).append(")");
        for (Weekday day : values()) {
            sql.append(" WHEN ").append(day.index)
                    .append(" THEN '").append(day.displayName).append("'");
        }
        return sql.append(" END").toString();
    }
}
