package com.nola.analytics.domain.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Entry of a filter dropdown (channel, store or weekday).
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class FilterOption {

    private Integer id;
    private String name;
}
