package com.tradeadvisor.backend.service;

import com.tradeadvisor.backend.exception.RejectionReason;
import com.tradeadvisor.backend.model.Transaction;

public record LedgerResult(Transaction transaction, RejectionReason rejection, String message) {

    public static LedgerResult applied(Transaction transaction) {
        return new LedgerResult(transaction, null, null);
    }

    public static LedgerResult rejected(RejectionReason reason, String message) {
        return new LedgerResult(null, reason, message);
    }

    public boolean isApplied() {
        return transaction != null;
    }
}
