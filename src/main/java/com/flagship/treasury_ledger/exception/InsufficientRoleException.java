package com.flagship.treasury_ledger.exception;

import java.util.Map;

public class InsufficientRoleException extends TreasuryException {

    public InsufficientRoleException(String subject, String actualRole, String requiredRole) {
        super(ErrorKind.INSUFFICIENT_ROLE,
                "Role '" + requiredRole + "' required for this operation",
                Map.of("subject", subject, "role", String.valueOf(actualRole), "required_role", requiredRole));
    }
}
