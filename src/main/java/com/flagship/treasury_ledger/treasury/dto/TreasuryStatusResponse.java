package com.flagship.treasury_ledger.treasury.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.treasury_ledger.treasury.ReserveStatus;
import com.flagship.treasury_ledger.treasury.TreasuryStatus;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;

@Value
@Builder
public class TreasuryStatusResponse {

    @JsonProperty("total_balance")
    BigDecimal totalBalance;

    @JsonProperty("accounts")
    List<AccountResponse> accounts;

    @JsonProperty("reserve_status")
    Reserve reserveStatus;

    @JsonProperty("mode")
    String mode;

    @JsonProperty("last_updated")
    Instant lastUpdated;

    @Value
    public static class Reserve {
        @JsonProperty("account_name")
        String accountName;

        @JsonProperty("reserve_balance")
        BigDecimal balance;

        @JsonProperty("actual_reserve_percentage")
        BigDecimal actualPercentage;

        @JsonProperty("minimum_reserve_percentage")
        BigDecimal minimumPercentage;

        @JsonProperty("is_healthy")
        boolean healthy;

        static Reserve from(ReserveStatus status) {
            return new Reserve(status.getAccountName(), status.getBalance(), status.getActualPercentage(),
                    status.getMinimumPercentage(), status.isHealthy());
        }
    }

    public static TreasuryStatusResponse from(TreasuryStatus status) {
        return TreasuryStatusResponse.builder()
            .totalBalance(status.getTotalBalance())
            .accounts(status.getAccounts().stream().map(AccountResponse::from).toList())
            .reserveStatus(Reserve.from(status.getReserve()))
            .mode(status.getMode())
            .lastUpdated(status.getComputedAt())
            .build();
    }
}
