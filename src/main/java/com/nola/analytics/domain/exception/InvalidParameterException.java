package com.nola.analytics.domain.exception;

/**
 * Raised when a request parameter is outside the accepted set
 * (unknown metric or dimension token, weekday index out of range).
 *
 * Always thrown before any cache or store access.
 */
public class InvalidParameterException extends RuntimeException {

    public InvalidParameterException(String message) {
        super(message);
    }
}
