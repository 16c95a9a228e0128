package com.flagship.treasury_ledger.ledger;

/**
 * Lifecycle of a ledger transaction.
 *
 * PENDING is the only non-terminal state. Balance effects are applied at
 * the moment a transaction becomes COMPLETED, whether at creation or on
 * the PENDING to COMPLETED transition.
 */
public enum TransactionStatus {
    PENDING,
    COMPLETED,
    FAILED,
    CANCELLED,
    /**
     * Recorded for bookkeeping only; carries no balance effect.
     */
    REFUNDED;

    public boolean isTerminal() {
        return this != PENDING;
    }

    public boolean canTransitionTo(TransactionStatus target) {
        if (isTerminal()) {
            return false;
        }
        return target == COMPLETED || target == FAILED || target == CANCELLED;
    }
}
