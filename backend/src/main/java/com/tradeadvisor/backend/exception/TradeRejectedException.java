package com.tradeadvisor.backend.exception;

import lombok.Getter;

/**
 * Aborts a trade unit of work so the surrounding database transaction rolls back.
 * Services convert it into a typed result before it reaches callers.
 */
@Getter
public class TradeRejectedException extends RuntimeException {

    private final RejectionReason reason;

    public TradeRejectedException(RejectionReason reason, String message) {
        super(message);
        this.reason = reason;
    }
}
