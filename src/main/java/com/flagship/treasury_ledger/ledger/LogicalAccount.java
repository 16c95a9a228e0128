package com.flagship.treasury_ledger.ledger;

import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * A named internal sub-account of the treasury.
 *
 * Balances are logical only and never go below zero. They change solely
 * through completed ledger transactions.
 */
@Value
public class LogicalAccount {
    UUID id;
    String name;
    AccountType type;
    String description;
    BigDecimal balance;
    boolean active;
    Instant createdAt;
    Instant updatedAt;
}
