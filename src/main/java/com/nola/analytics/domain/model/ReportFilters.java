package com.nola.analytics.domain.model;

import lombok.Builder;
import lombok.Value;

import java.time.LocalDate;

/**
 * Filters as they are printed in the report header, with ids already resolved to names.
 */
@Value
@Builder
public class ReportFilters {

    public static final String ALL_STORES = "Todas as Lojas";
    public static final String ALL_CHANNELS = "Todos os Canais";
    public static final String ALL_DAYS = "Todos os Dias";
    public static final String OPEN_START = "Inicio";
    public static final String OPEN_END = "Fim";

    @Builder.Default
    String storeName = ALL_STORES;

    @Builder.Default
    String channelName = ALL_CHANNELS;

    @Builder.Default
    String weekdayName = ALL_DAYS;

    LocalDate dateFrom;
    LocalDate dateTo;

    public String dateFromLabel() {
        return dateFrom != null ? dateFrom.toString() : OPEN_START;
    }

    public String dateToLabel() {
        return dateTo != null ? dateTo.toString() : OPEN_END;
    }
}
