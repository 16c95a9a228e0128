package com.flagship.treasury_ledger.ledger;

import com.flagship.treasury_ledger.exception.InvalidTransactionShapeException;

import java.util.UUID;

/**
 * Transaction types and the account-flow shape each one requires.
 *
 * Deposits come from outside (no source account), withdrawals leave the
 * treasury (no target account), everything else moves value between two
 * internal accounts. The same rule is enforced by a CHECK constraint.
 */
public enum TransactionType {
    EXTERNAL_DEPOSIT,
    EXTERNAL_WITHDRAWAL,
    INTERNAL_ALLOCATION,
    PAYMENT,
    REFUND,
    FEE,
    NFT_MINT,
    REWARD;

    /**
     * Rejects account combinations this type does not allow.
     *
     * @throws InvalidTransactionShapeException if {@code from}/{@code to}
     *         nullability does not match the type
     */
    public void validateShape(UUID fromAccountId, UUID toAccountId) {
        switch (this) {
            case EXTERNAL_DEPOSIT -> {
                if (fromAccountId != null || toAccountId == null) {
                    throw new InvalidTransactionShapeException(
                        "EXTERNAL_DEPOSIT requires a target account and no source account");
                }
            }
            case EXTERNAL_WITHDRAWAL -> {
                if (fromAccountId == null || toAccountId != null) {
                    throw new InvalidTransactionShapeException(
                        "EXTERNAL_WITHDRAWAL requires a source account and no target account");
                }
            }
            default -> {
                if (fromAccountId == null || toAccountId == null) {
                    throw new InvalidTransactionShapeException(
                        name() + " requires both a source and a target account");
                }
            }
        }
    }
}
