package com.nola.analytics.api;

import com.nola.analytics.domain.exception.EmptyExportResultException;
import com.nola.analytics.domain.exception.InvalidParameterException;
import com.nola.analytics.domain.exception.StoreQueryException;
import com.nola.analytics.domain.exception.StoreUnavailableException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.transaction.CannotCreateTransactionException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

/**
 * Maps domain failures to HTTP responses with a {@code {"detail": ...}} body.
 *
 * 400 invalid parameters, 404 empty export, 500 store failures.
 */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    @ExceptionHandler(InvalidParameterException.class)
    public ResponseEntity<ErrorResponse> handleInvalidParameter(InvalidParameterException e) {
        return status(HttpStatus.BAD_REQUEST, e.getMessage());
    }

    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public ResponseEntity<ErrorResponse> handleTypeMismatch(MethodArgumentTypeMismatchException e) {
        return status(HttpStatus.BAD_REQUEST, "Parâmetro inválido: " + e.getName());
    }

    @ExceptionHandler(EmptyExportResultException.class)
    public ResponseEntity<ErrorResponse> handleEmptyExport(EmptyExportResultException e) {
        return status(HttpStatus.NOT_FOUND, e.getMessage());
    }

    @ExceptionHandler(StoreUnavailableException.class)
    public ResponseEntity<ErrorResponse> handleStoreUnavailable(StoreUnavailableException e) {
        return status(HttpStatus.INTERNAL_SERVER_ERROR, e.getMessage());
    }

    // JPA repositories fail while opening their read-only transaction when the pool is down
    @ExceptionHandler(CannotCreateTransactionException.class)
    public ResponseEntity<ErrorResponse> handleCannotCreateTransaction(CannotCreateTransactionException e) {
        log.error("Erro ao conectar ao banco de dados: {}", e.getMessage());
        return status(HttpStatus.INTERNAL_SERVER_ERROR, StoreUnavailableException.MESSAGE);
    }

    @ExceptionHandler(StoreQueryException.class)
    public ResponseEntity<ErrorResponse> handleStoreQuery(StoreQueryException e) {
        return status(HttpStatus.INTERNAL_SERVER_ERROR, e.getMessage());
    }

    private static ResponseEntity<ErrorResponse> status(HttpStatus status, String detail) {
        return ResponseEntity.status(status).body(new ErrorResponse(detail));
    }
}
