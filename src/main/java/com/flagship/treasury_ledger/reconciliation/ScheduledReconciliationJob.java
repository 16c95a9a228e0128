package com.flagship.treasury_ledger.reconciliation;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;

/**
 * Periodic reconciliation against the registered {@link ExternalBalanceSource}.
 * Off unless {@code treasury.reconciliation.schedule.enabled=true}.
 */
@Component
@ConditionalOnProperty(name = "treasury.reconciliation.schedule.enabled", havingValue = "true")
@Slf4j
public class ScheduledReconciliationJob {

    static final String SCHEDULER_ACTOR = "scheduler";

    private final ReconciliationService reconciliationService;
    private final ObjectProvider<ExternalBalanceSource> balanceSource;

    public ScheduledReconciliationJob(ReconciliationService reconciliationService,
                                      ObjectProvider<ExternalBalanceSource> balanceSource) {
        this.reconciliationService = reconciliationService;
        this.balanceSource = balanceSource;
    }

    @Scheduled(cron = "${treasury.reconciliation.schedule.cron:0 0 * * * *}")
    public void run() {
        ExternalBalanceSource source = balanceSource.getIfAvailable();
        if (source == null) {
            log.warn("Scheduled reconciliation skipped: no ExternalBalanceSource bean registered");
            return;
        }

        try {
            BigDecimal external = source.fetchBalance();
            ReconciliationRecord record = reconciliationService.reconcile(
                    external, source.sourceName(), "scheduled reconciliation", SCHEDULER_ACTOR);
            log.info("Scheduled reconciliation {} recorded as {}", record.getId(), record.getStatus());
        } catch (Exception e) {
            log.error("Scheduled reconciliation against {} failed", source.sourceName(), e);
        }
    }
}
