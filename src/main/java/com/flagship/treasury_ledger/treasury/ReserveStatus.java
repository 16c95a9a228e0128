package com.flagship.treasury_ledger.treasury;

import lombok.Value;

import java.math.BigDecimal;

/**
 * Reserve balance relative to the active total. An empty treasury, or one
 * without a reserve account, reports healthy with a zero percentage.
 */
@Value
public class ReserveStatus {
    String accountName;
    BigDecimal balance;
    BigDecimal actualPercentage;
    BigDecimal minimumPercentage;
    boolean healthy;
}
