package com.flagship.treasury_ledger.exception;

import java.util.Map;
import java.util.UUID;

public class InvalidStatusTransitionException extends TreasuryException {

    public InvalidStatusTransitionException(UUID transactionId, String from, String to) {
        super(ErrorKind.INVALID_STATUS_TRANSITION,
                String.format("Cannot move transaction %s from %s to %s", transactionId, from, to),
                Map.of("transaction_id", transactionId.toString(), "from", from, "to", to));
    }
}
