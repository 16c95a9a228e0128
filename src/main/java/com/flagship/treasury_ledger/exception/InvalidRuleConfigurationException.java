package com.flagship.treasury_ledger.exception;

import java.util.Map;

public class InvalidRuleConfigurationException extends TreasuryException {

    public InvalidRuleConfigurationException(String message) {
        super(ErrorKind.INVALID_RULE_CONFIGURATION, message);
    }

    public InvalidRuleConfigurationException(String message, Map<String, String> details) {
        super(ErrorKind.INVALID_RULE_CONFIGURATION, message, details);
    }
}
