package com.tradeadvisor.backend.exception;

public enum RejectionReason {
    INSUFFICIENT_FUNDS,
    INSUFFICIENT_SHARES,
    EXPIRED,
    ALREADY_RESOLVED,
    NOT_EXECUTABLE,
    PERSISTENCE_FAILED
}
