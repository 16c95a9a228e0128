package com.flagship.treasury_ledger.event;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.time.Instant;
import java.util.UUID;

/**
 * Fact published on the treasury events topic via the outbox.
 *
 * The aggregate id becomes the Kafka key, so events about the same deposit
 * or reconciliation record land on one partition in order.
 */
public interface TreasuryEvent {

    /**
     * Unique per event instance; consumers deduplicate on it.
     */
    UUID getEventId();

    Instant getOccurredAt();

    String getEventType();

    @JsonIgnore
    UUID getAggregateId();

    @JsonIgnore
    String getAggregateType();
}
