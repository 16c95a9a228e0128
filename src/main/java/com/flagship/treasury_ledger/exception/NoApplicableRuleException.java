package com.flagship.treasury_ledger.exception;

import java.math.BigDecimal;
import java.util.Map;
import java.util.UUID;

/**
 * No active allocation rule accepts the deposit amount.
 *
 * On the deposit recording path this is caught and reported: the deposit
 * stays COMPLETED and unallocated. It only surfaces as an API error on the
 * explicit allocation retry endpoint.
 */
public class NoApplicableRuleException extends TreasuryException {

    public NoApplicableRuleException(UUID depositId, BigDecimal amount) {
        super(ErrorKind.NO_APPLICABLE_RULE,
                String.format("No active allocation rule applies to deposit %s of amount %s",
                        depositId, amount.toPlainString()),
                Map.of("deposit_id", depositId.toString(), "amount", amount.toPlainString()));
    }
}
