package com.flagship.treasury_ledger.audit;

public enum AuditAction {
    CREATE,
    UPDATE,
    DELETE,
    EXECUTE
}
