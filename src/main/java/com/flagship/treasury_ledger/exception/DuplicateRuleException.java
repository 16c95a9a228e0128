package com.flagship.treasury_ledger.exception;

import java.util.Map;

public class DuplicateRuleException extends TreasuryException {

    public DuplicateRuleException(String ruleName) {
        super(ErrorKind.DUPLICATE_RULE, "Allocation rule with name '" + ruleName + "' already exists",
                Map.of("rule_name", ruleName));
    }
}
