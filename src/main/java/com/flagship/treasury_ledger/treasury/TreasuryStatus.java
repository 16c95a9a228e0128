package com.flagship.treasury_ledger.treasury;

import com.flagship.treasury_ledger.ledger.LogicalAccount;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;

@Value
public class TreasuryStatus {
    List<LogicalAccount> accounts;
    BigDecimal totalBalance;
    ReserveStatus reserve;
    String mode;
    Instant computedAt;
}
