package com.flagship.treasury_ledger.ledger;

import lombok.Value;

/**
 * A recorded transaction together with the allocation outcome, when the
 * transaction was a completed deposit. {@code replayed} is true when an
 * idempotency key matched an earlier request.
 */
@Value
public class RecordedTransaction {
    LedgerTransaction transaction;
    AllocationResult allocation;
    boolean replayed;
}
