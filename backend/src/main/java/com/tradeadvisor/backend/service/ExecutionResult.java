package com.tradeadvisor.backend.service;

import com.tradeadvisor.backend.exception.RejectionReason;
import com.tradeadvisor.backend.model.Transaction;

/**
 * Outcome of a confirmation: either the transaction written or the reason nothing happened.
 */
public record ExecutionResult(Long recommendationId, Transaction transaction, RejectionReason rejection, String message) {

    public static ExecutionResult executed(Long recommendationId, Transaction transaction) {
        return new ExecutionResult(recommendationId, transaction, null, null);
    }

    public static ExecutionResult rejected(Long recommendationId, RejectionReason reason, String message) {
        return new ExecutionResult(recommendationId, null, reason, message);
    }

    public boolean isExecuted() {
        return transaction != null;
    }
}
