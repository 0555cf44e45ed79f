package com.nola.analytics.domain.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One grouped row: the entity the metric was grouped by and the aggregated value.
 *
 * The label is a String for most dimensions and an Integer for the hour of day.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class AnalyticsRow {

    @JsonProperty("nome_entidade")
    private Object label;

    @JsonProperty("valor_metrica")
    private Number value;
}
