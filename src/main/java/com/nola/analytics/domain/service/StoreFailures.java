package com.nola.analytics.domain.service;

import com.nola.analytics.domain.exception.StoreQueryException;
import com.nola.analytics.domain.exception.StoreUnavailableException;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataAccessResourceFailureException;

/**
 * Maps Spring's data access exceptions onto the API's store failure types.
 */
final class StoreFailures {

    private StoreFailures() {
    }

    static RuntimeException translate(DataAccessException e) {
        if (e instanceof DataAccessResourceFailureException) {
            return new StoreUnavailableException(e);
        }
        return new StoreQueryException(e.getMostSpecificCause().getMessage(), e);
    }
}
