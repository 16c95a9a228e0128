package com.flagship.treasury_ledger.exception;

import java.util.Map;

/**
 * Contention on the store persisted past the bounded retry policy.
 * Callers should retry the whole request.
 */
public class TransientConflictException extends TreasuryException {

    public TransientConflictException(String operation, Throwable cause) {
        super(ErrorKind.TRANSIENT_CONFLICT,
                "Concurrent update conflict during " + operation + ", retry the request",
                Map.of("operation", operation), cause);
    }
}
