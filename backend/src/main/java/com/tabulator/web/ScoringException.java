package com.tabulator.web;

import lombok.Getter;
import org.springframework.http.HttpStatus;

@Getter
public class ScoringException extends RuntimeException {

    private final HttpStatus status;
    private final String code;

    public ScoringException(HttpStatus status, String code, String message) {
        super(message);
        this.status = status;
        this.code = code;
    }

    public ScoringException(HttpStatus status, String code, String message, Throwable cause) {
        super(message, cause);
        this.status = status;
        this.code = code;
    }

    public static ScoringException invalidScore(String detail) {
        return new ScoringException(
                HttpStatus.BAD_REQUEST,
                "invalid_score",
                detail
        );
    }

    public static ScoringException invalidRequest(String detail) {
        return new ScoringException(
                HttpStatus.BAD_REQUEST,
                "invalid_request",
                detail
        );
    }

    public static ScoringException notFound(String detail) {
        return new ScoringException(
                HttpStatus.NOT_FOUND,
                "not_found",
                detail
        );
    }

    public static ScoringException alreadySubmitted(String detail) {
        return new ScoringException(
                HttpStatus.CONFLICT,
                "already_submitted",
                detail
        );
    }

    public static ScoringException duplicate(String detail) {
        return new ScoringException(
                HttpStatus.CONFLICT,
                "duplicate",
                detail
        );
    }

    public static ScoringException incompleteSubmission(String detail, Throwable cause) {
        return new ScoringException(
                HttpStatus.SERVICE_UNAVAILABLE,
                "incomplete_submission",
                detail,
                cause
        );
    }

    public static ScoringException storeUnavailable(String detail, Throwable cause) {
        return new ScoringException(
                HttpStatus.SERVICE_UNAVAILABLE,
                "store_unavailable",
                detail,
                cause
        );
    }
}
