package com.flagship.treasury_ledger.observability;

import com.flagship.treasury_ledger.ledger.AccountService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Refreshes the gauges that need a database read.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class MetricsScheduler {

    private final OutboxMetrics outboxMetrics;
    private final TreasuryMetrics treasuryMetrics;
    private final AccountService accountService;

    @Scheduled(fixedRateString = "${metrics.refresh.interval:15000}")
    public void refreshGauges() {
        outboxMetrics.refreshMetrics();
        try {
            treasuryMetrics.updateTotalBalance(accountService.totalActiveBalance());
        } catch (Exception e) {
            log.warn("Failed to refresh treasury balance gauge: {}", e.getMessage());
        }
    }
}
