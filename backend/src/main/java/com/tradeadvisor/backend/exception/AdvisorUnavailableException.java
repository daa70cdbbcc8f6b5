package com.tradeadvisor.backend.exception;

import lombok.Getter;

/**
 * The AI advisor could not produce a response. Retryable failures (throttling, 5xx, I/O)
 * are attempted again under the retry policy; the rest end the advisor stage at once.
 */
@Getter
public class AdvisorUnavailableException extends RuntimeException {

    private final boolean retryable;

    public AdvisorUnavailableException(String message, boolean retryable) {
        super(message);
        this.retryable = retryable;
    }

    public AdvisorUnavailableException(String message, boolean retryable, Throwable cause) {
        super(message, cause);
        this.retryable = retryable;
    }
}
