package com.tabulator.web;

import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Renders rejected request bodies with the same {@code invalid_request} code as service-side
 * validation, plus the first message reported for each offending field.
 */
@RestControllerAdvice
public class ValidationExceptionHandler {

    static final String INVALID_REQUEST = "invalid_request";

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<RequestValidationErrorResponse> handleInvalidBody(MethodArgumentNotValidException ex) {
        Map<String, String> fieldErrors = new LinkedHashMap<>();
        for (FieldError fieldError : ex.getBindingResult().getFieldErrors()) {
            fieldErrors.putIfAbsent(fieldError.getField(), fieldError.getDefaultMessage());
        }
        ex.getBindingResult().getGlobalErrors()
                .forEach(error -> fieldErrors.putIfAbsent(error.getObjectName(), error.getDefaultMessage()));

        String message = fieldErrors.isEmpty()
                ? "Request body is invalid"
                : "Request body is invalid: " + String.join("; ", fieldErrors.values());
        return ResponseEntity.badRequest()
                .body(new RequestValidationErrorResponse(INVALID_REQUEST, message, fieldErrors));
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<RequestValidationErrorResponse> handleUnreadableBody(HttpMessageNotReadableException ex) {
        return ResponseEntity.badRequest()
                .body(new RequestValidationErrorResponse(INVALID_REQUEST, "Request body is not readable", Map.of()));
    }

    public record RequestValidationErrorResponse(
            String code,
            String message,
            Map<String, String> fieldErrors
    ) {
    }
}
