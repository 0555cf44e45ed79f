package com.nola.analytics.domain.model;

import lombok.Value;

import java.util.List;

/**
 * SQL text with its positional parameters, in placeholder order.
 */
@Value
public class BuiltQuery {

    String sql;
    List<Object> parameters;

    public Object[] parameterArray() {
        return parameters.toArray();
    }
}
