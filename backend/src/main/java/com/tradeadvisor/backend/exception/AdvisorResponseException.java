package com.tradeadvisor.backend.exception;

import lombok.Getter;

/**
 * The advisor answered, but the answer was not a usable recommendation.
 */
@Getter
public class AdvisorResponseException extends RuntimeException {

    private final String field;

    public AdvisorResponseException(String field, String message) {
        super(field + ": " + message);
        this.field = field;
    }

    public AdvisorResponseException(String field, String message, Throwable cause) {
        super(field + ": " + message, cause);
        this.field = field;
    }
}
