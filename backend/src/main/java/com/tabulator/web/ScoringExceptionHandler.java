package com.tabulator.web;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.TransientDataAccessException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.transaction.CannotCreateTransactionException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

@RestControllerAdvice
public class ScoringExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ScoringExceptionHandler.class);

    @ExceptionHandler(ScoringException.class)
    public ResponseEntity<ScoringErrorResponse> handle(ScoringException ex) {
        if (ex.getStatus().is5xxServerError()) {
            log.warn("Scoring request failed ({}): {}", ex.getCode(), ex.getMessage(), ex.getCause());
        }
        return ResponseEntity
                .status(ex.getStatus())
                .body(new ScoringErrorResponse(ex.getCode(), ex.getMessage()));
    }

    @ExceptionHandler({
            TransientDataAccessException.class,
            DataAccessResourceFailureException.class,
            CannotCreateTransactionException.class
    })
    public ResponseEntity<ScoringErrorResponse> handleStoreUnavailable(RuntimeException ex) {
        log.warn("Score store unavailable: {}", ex.getMessage());
        return ResponseEntity
                .status(HttpStatus.SERVICE_UNAVAILABLE)
                .body(new ScoringErrorResponse("store_unavailable", "Score store is unavailable, retry the request"));
    }

    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public ResponseEntity<ScoringErrorResponse> handleTypeMismatch(MethodArgumentTypeMismatchException ex) {
        return ResponseEntity
                .badRequest()
                .body(new ScoringErrorResponse("invalid_request", "Invalid value for " + ex.getName()));
    }

    public record ScoringErrorResponse(
            String code,
            String message
    ) {
    }
}
