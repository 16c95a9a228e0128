package com.flagship.treasury_ledger.exception;

public class InvalidTokenException extends TreasuryException {

    public InvalidTokenException(String message) {
        super(ErrorKind.INVALID_TOKEN, message);
    }
}
