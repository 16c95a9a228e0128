package com.flagship.treasury_ledger.exception;

import java.util.Map;
import java.util.UUID;

public class AlreadyResolvedException extends TreasuryException {

    public AlreadyResolvedException(UUID recordId) {
        super(ErrorKind.ALREADY_RESOLVED, "Reconciliation record " + recordId + " is already resolved",
                Map.of("record_id", recordId.toString()));
    }
}
