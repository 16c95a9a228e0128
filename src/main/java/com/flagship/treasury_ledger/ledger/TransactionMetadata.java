package com.flagship.treasury_ledger.ledger;

/**
 * Well-known keys of the transaction metadata map. Callers may add others.
 */
public final class TransactionMetadata {

    public static final String ALLOCATION_RULE_ID = "allocation_rule_id";
    public static final String ALLOCATION_RULE_NAME = "allocation_rule_name";
    public static final String PERCENTAGE = "percentage";
    public static final String SOURCE = "source";
    public static final String MEMO = "memo";
    public static final String UNALLOCATED_REASON = "unallocated_reason";
    public static final String EVENT_ID = "event_id";

    private TransactionMetadata() {
    }
}
