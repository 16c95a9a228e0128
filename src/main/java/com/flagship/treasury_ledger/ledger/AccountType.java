package com.flagship.treasury_ledger.ledger;

public enum AccountType {
    OPERATING,
    RESERVE,
    REWARDS,
    DEVELOPMENT,
    MARKETING,
    CUSTOM
}
