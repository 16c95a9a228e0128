package com.flagship.treasury_ledger.ledger;

import com.flagship.treasury_ledger.allocation.AllocationCalculator;
import com.flagship.treasury_ledger.allocation.AllocationRule;
import com.flagship.treasury_ledger.allocation.AllocationRuleService;
import com.flagship.treasury_ledger.allocation.AllocationShare;
import com.flagship.treasury_ledger.audit.AuditAction;
import com.flagship.treasury_ledger.audit.AuditEntityType;
import com.flagship.treasury_ledger.audit.AuditService;
import com.flagship.treasury_ledger.event.DepositAllocatedEvent;
import com.flagship.treasury_ledger.exception.InvalidRuleConfigurationException;
import com.flagship.treasury_ledger.exception.InvalidStatusTransitionException;
import com.flagship.treasury_ledger.exception.InvalidTransactionShapeException;
import com.flagship.treasury_ledger.exception.NoApplicableRuleException;
import com.flagship.treasury_ledger.exception.NotFoundException;
import com.flagship.treasury_ledger.observability.TreasuryMetrics;
import com.flagship.treasury_ledger.outbox.OutboxService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.UUID;

/**
 * Fans a completed deposit out into INTERNAL_ALLOCATION children.
 *
 * Runs inside the unit of work that completed the deposit (or inside an
 * explicit retry). The deposit's target account acts as the source pool:
 * each child debits the pool and credits one rule target, so the
 * children always sum to the deposit amount.
 *
 * Exactly-once per deposit rests on two things: the deposit row lock taken
 * first, and the unique (parent, target) index on allocation rows.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class AllocationEngine {

    private final LedgerTransactionRepository transactions;
    private final AccountService accountService;
    private final AllocationRuleService ruleService;
    private final AuditService auditService;
    private final OutboxService outboxService;
    private final TreasuryMetrics metrics;

    /**
     * Allocates the deposit, or returns the existing allocation untouched.
     *
     * @throws NoApplicableRuleException if no active rule accepts the amount;
     *         nothing has been written at that point
     * @throws InvalidRuleConfigurationException if the selected rule is
     *         broken at the time of use
     */
    @Transactional(propagation = Propagation.MANDATORY, noRollbackFor = NoApplicableRuleException.class)
    public AllocationResult allocate(UUID depositId, String actor) {
        LedgerTransaction deposit = transactions.findByIdForUpdate(depositId)
                .orElseThrow(() -> new NotFoundException("LedgerTransaction", depositId));

        if (deposit.getType() != TransactionType.EXTERNAL_DEPOSIT) {
            throw new InvalidTransactionShapeException(
                "Only EXTERNAL_DEPOSIT transactions can be allocated, got " + deposit.getType());
        }
        if (deposit.getStatus() != TransactionStatus.COMPLETED) {
            throw new InvalidStatusTransitionException(depositId, deposit.getStatus().name(), "ALLOCATED");
        }

        List<AllocationResult.Share> existing = transactions.findAllocationShares(depositId);
        if (!existing.isEmpty()) {
            log.info("Deposit {} already allocated into {} children, returning them unchanged",
                    depositId, existing.size());
            metrics.recordAllocation(AllocationResult.Status.ALREADY_ALLOCATED.name());
            Map<String, String> firstChild = transactions.findAllocations(depositId).get(0).getMetadata();
            return AllocationResult.alreadyAllocated(depositId,
                    parseUuid(firstChild.get(TransactionMetadata.ALLOCATION_RULE_ID)),
                    firstChild.get(TransactionMetadata.ALLOCATION_RULE_NAME),
                    existing);
        }

        AllocationRule rule = ruleService.selectApplicable(deposit.getAmount())
                .orElseThrow(() -> new NoApplicableRuleException(depositId, deposit.getAmount()));

        // rules are validated on creation; re-check in case stored data drifted
        rule.validate();

        List<LogicalAccount> targets = resolveTargets(rule);
        List<BigDecimal> amounts = AllocationCalculator.split(deposit.getAmount(), rule.getShares());

        UUID pool = deposit.getToAccountId();
        Instant now = Instant.now();
        List<AllocationResult.Share> shares = new ArrayList<>();
        TreeMap<UUID, BigDecimal> deltas = new TreeMap<>();

        for (int i = 0; i < targets.size(); i++) {
            LogicalAccount target = targets.get(i);
            AllocationShare share = rule.getShares().get(i);
            BigDecimal amount = amounts.get(i);

            Map<String, String> metadata = new LinkedHashMap<>();
            metadata.put(TransactionMetadata.ALLOCATION_RULE_ID, rule.getId().toString());
            metadata.put(TransactionMetadata.ALLOCATION_RULE_NAME, rule.getName());
            metadata.put(TransactionMetadata.PERCENTAGE, share.getPercentage().stripTrailingZeros().toPlainString());

            LedgerTransaction child = new LedgerTransaction(
                UUID.randomUUID(),
                TransactionType.INTERNAL_ALLOCATION,
                TransactionStatus.COMPLETED,
                amount,
                pool,
                target.getId(),
                depositId,
                deposit.getExternalReference(),
                null,
                metadata,
                actor,
                now,
                now
            );
            transactions.insert(child);
            auditService.record(AuditEntityType.LEDGER_TRANSACTION, child.getId(), AuditAction.CREATE,
                    null, LedgerService.snapshot(child), actor);

            deltas.merge(pool, amount.negate(), BigDecimal::add);
            deltas.merge(target.getId(), amount, BigDecimal::add);
            shares.add(new AllocationResult.Share(child.getId(), target.getId(), target.getName(),
                    amount, share.getPercentage()));
        }

        // ascending account id order keeps lock acquisition consistent across writers
        for (Map.Entry<UUID, BigDecimal> delta : deltas.entrySet()) {
            if (delta.getValue().signum() != 0) {
                accountService.adjustBalance(delta.getKey(), delta.getValue(), depositId);
            }
        }

        AllocationResult result = AllocationResult.allocated(depositId, rule.getId(), rule.getName(), shares);

        Map<String, Object> executed = new LinkedHashMap<>();
        executed.put("allocation_rule_id", rule.getId().toString());
        executed.put("allocation_rule_name", rule.getName());
        executed.put("allocations", shares.stream()
                .map(s -> Map.of("transaction_id", s.getTransactionId().toString(),
                        "account_name", s.getAccountName(),
                        "amount", s.getAmount().toPlainString()))
                .toList());
        auditService.record(AuditEntityType.LEDGER_TRANSACTION, depositId, AuditAction.EXECUTE,
                null, executed, actor);
        outboxService.saveEvent(DepositAllocatedEvent.from(deposit, result));

        metrics.recordAllocation(AllocationResult.Status.ALLOCATED.name());
        log.info("Allocated deposit {} of {} via rule '{}' into {} accounts",
                depositId, deposit.getAmount().toPlainString(), rule.getName(), shares.size());
        return result;
    }

    private List<LogicalAccount> resolveTargets(AllocationRule rule) {
        List<LogicalAccount> targets = new ArrayList<>(rule.getShares().size());
        for (AllocationShare share : rule.getShares()) {
            LogicalAccount account = accountService.findByName(share.getAccountName())
                    .filter(LogicalAccount::isActive)
                    .orElseThrow(() -> new InvalidRuleConfigurationException(
                        "Rule '" + rule.getName() + "' targets unknown or inactive account '"
                            + share.getAccountName() + "'",
                        Map.of("rule_name", rule.getName(), "account_name", share.getAccountName())));
            targets.add(account);
        }
        return targets;
    }

    private static UUID parseUuid(String value) {
        return value != null ? UUID.fromString(value) : null;
    }
}
