package com.flagship.treasury_ledger.reconciliation;

import java.math.BigDecimal;

/**
 * Supplies the externally observed treasury balance for scheduled
 * reconciliation. Deployments register one bean; without it the scheduled
 * job skips.
 */
public interface ExternalBalanceSource {

    BigDecimal fetchBalance();

    /**
     * Label stored with each record, e.g. a wallet or bank account id.
     */
    String sourceName();
}
