package com.flagship.treasury_ledger.exception;

import java.math.BigDecimal;
import java.util.Map;
import java.util.UUID;

/**
 * Raised when a debit would take an account balance below zero.
 * The surrounding unit of work is rolled back.
 */
public class InsufficientFundsException extends TreasuryException {

    public InsufficientFundsException(UUID accountId, BigDecimal requested) {
        super(ErrorKind.INSUFFICIENT_FUNDS,
                String.format("Insufficient funds in account %s for debit of %s", accountId, requested.toPlainString()),
                Map.of("account_id", accountId.toString(), "requested", requested.toPlainString()));
    }
}
