package com.flagship.treasury_ledger.exception;

import java.util.Map;

public class DuplicateAccountException extends TreasuryException {

    public DuplicateAccountException(String accountName) {
        super(ErrorKind.DUPLICATE_ACCOUNT, "Account with name '" + accountName + "' already exists",
                Map.of("account_name", accountName));
    }
}
