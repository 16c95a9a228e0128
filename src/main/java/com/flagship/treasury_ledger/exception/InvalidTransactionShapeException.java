package com.flagship.treasury_ledger.exception;

public class InvalidTransactionShapeException extends TreasuryException {

    public InvalidTransactionShapeException(String message) {
        super(ErrorKind.INVALID_TRANSACTION_SHAPE, message);
    }
}
