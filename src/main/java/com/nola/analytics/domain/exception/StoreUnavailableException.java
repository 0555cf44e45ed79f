package com.nola.analytics.domain.exception;

/**
 * The relational store could not hand out a connection.
 */
public class StoreUnavailableException extends RuntimeException {

    public static final String MESSAGE = "Não foi possível conectar ao banco de dados";

    public StoreUnavailableException(Throwable cause) {
        super(MESSAGE, cause);
    }
}
