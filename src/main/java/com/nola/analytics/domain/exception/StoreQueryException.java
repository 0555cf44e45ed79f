package com.nola.analytics.domain.exception;

/**
 * A query reached the store but failed while executing.
 *
 * The message carries the driver's own message so it can be returned to the caller.
 */
public class StoreQueryException extends RuntimeException {

    public StoreQueryException(String message, Throwable cause) {
        super(message, cause);
    }
}
