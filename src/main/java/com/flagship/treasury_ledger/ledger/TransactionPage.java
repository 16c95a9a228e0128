package com.flagship.treasury_ledger.ledger;

import lombok.Value;

import java.util.List;

@Value
public class TransactionPage {
    List<LedgerTransaction> items;
    long total;
    int limit;
    int offset;
}
