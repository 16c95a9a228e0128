package com.flagship.treasury_ledger.audit;

public enum AuditEntityType {
    LEDGER_TRANSACTION,
    ALLOCATION_RULE,
    LOGICAL_ACCOUNT,
    RECONCILIATION
}
