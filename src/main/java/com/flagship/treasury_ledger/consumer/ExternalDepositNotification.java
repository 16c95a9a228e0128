package com.flagship.treasury_ledger.consumer;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.util.UUID;

/**
 * Inbound notification that funds arrived at the treasury's external
 * wallet. {@code accountName} names the pool account to credit.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class ExternalDepositNotification {

    @JsonProperty("eventId")
    private UUID eventId;

    @JsonProperty("accountName")
    private String accountName;

    @JsonProperty("amount")
    private BigDecimal amount;

    @JsonProperty("externalReference")
    private String externalReference;
}
