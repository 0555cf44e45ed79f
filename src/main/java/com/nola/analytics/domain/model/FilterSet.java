package com.nola.analytics.domain.model;

import lombok.Builder;
import lombok.Value;

import java.time.LocalDate;

/**
 * Optional row filters, combined with AND. A null field means "not filtered".
 */
@Value
@Builder
public class FilterSet {

    Integer channelId;
    Integer storeId;
    Weekday weekday;
    LocalDate dateFrom;
    LocalDate dateTo;

    public static FilterSet none() {
        return FilterSet.builder().build();
    }
}
