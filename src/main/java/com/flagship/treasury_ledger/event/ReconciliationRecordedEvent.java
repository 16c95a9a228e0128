package com.flagship.treasury_ledger.event;

import com.flagship.treasury_ledger.reconciliation.ReconciliationRecord;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

@Value
public class ReconciliationRecordedEvent implements TreasuryEvent {
    public static final String EVENT_TYPE = "ReconciliationRecorded";

    UUID eventId;
    UUID recordId;
    String status;
    BigDecimal externalBalance;
    BigDecimal internalTotal;
    BigDecimal discrepancy;
    BigDecimal discrepancyPercentage;
    String source;
    Instant computedAt;
    Instant occurredAt;

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    @Override
    public UUID getAggregateId() {
        return recordId;
    }

    @Override
    public String getAggregateType() {
        return "Reconciliation";
    }

    public static ReconciliationRecordedEvent from(ReconciliationRecord record) {
        return new ReconciliationRecordedEvent(UUID.randomUUID(), record.getId(), record.getStatus().name(),
                record.getExternalBalance(), record.getInternalTotal(), record.getDiscrepancy(),
                record.getDiscrepancyPercentage(), record.getSource(), record.getComputedAt(), Instant.now());
    }
}
