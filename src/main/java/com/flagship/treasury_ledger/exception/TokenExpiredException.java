package com.flagship.treasury_ledger.exception;

public class TokenExpiredException extends TreasuryException {

    public TokenExpiredException() {
        super(ErrorKind.TOKEN_EXPIRED, "Bearer token has expired");
    }
}
