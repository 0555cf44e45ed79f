package com.nola.analytics.domain.exception;

public class EmptyExportResultException extends RuntimeException {

    public EmptyExportResultException(String message) {
        super(message);
    }
}
