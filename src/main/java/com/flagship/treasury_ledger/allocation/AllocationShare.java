package com.flagship.treasury_ledger.allocation;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Value;

import java.math.BigDecimal;

/**
 * One target of an allocation rule: an account name and its percentage
 * of the deposit. Serialized as {@code {"account_name", "percentage"}}.
 */
@Value
public class AllocationShare {
    @JsonProperty("account_name")
    String accountName;
    @JsonProperty("percentage")
    BigDecimal percentage;

    @JsonCreator
    public AllocationShare(@JsonProperty("account_name") String accountName,
                           @JsonProperty("percentage") BigDecimal percentage) {
        this.accountName = accountName;
        this.percentage = percentage;
    }

    public static AllocationShare of(String accountName, String percentage) {
        return new AllocationShare(accountName, new BigDecimal(percentage));
    }
}
