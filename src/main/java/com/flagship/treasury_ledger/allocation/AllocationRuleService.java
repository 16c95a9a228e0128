package com.flagship.treasury_ledger.allocation;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.treasury_ledger.audit.AuditAction;
import com.flagship.treasury_ledger.audit.AuditEntityType;
import com.flagship.treasury_ledger.audit.AuditService;
import com.flagship.treasury_ledger.exception.DuplicateRuleException;
import com.flagship.treasury_ledger.exception.InvalidRuleConfigurationException;
import com.flagship.treasury_ledger.exception.NotFoundException;
import com.flagship.treasury_ledger.ledger.AccountService;
import com.flagship.treasury_ledger.ledger.LogicalAccount;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Manages allocation rules and picks the rule for a deposit.
 *
 * Rules are never deleted; deactivation keeps the row so past allocations
 * still resolve their rule id.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class AllocationRuleService {

    private static final TypeReference<List<AllocationShare>> SHARE_LIST = new TypeReference<>() {
    };

    private final AllocationRuleRepository repository;
    private final AccountService accountService;
    private final AuditService auditService;
    private final ObjectMapper objectMapper;

    /**
     * Validates and stores a new active rule.
     *
     * @throws InvalidRuleConfigurationException if shares do not sum to 100,
     *         repeat an account, target an unknown or inactive account, or
     *         the bounds are inverted
     * @throws DuplicateRuleException if the name is taken
     */
    @Transactional
    public AllocationRule createRule(String name, int priority, List<AllocationShare> shares,
                                     BigDecimal minAmount, BigDecimal maxAmount,
                                     String description, String actor) {
        AllocationRule rule = AllocationRule.create(name, priority, shares, minAmount, maxAmount, description, actor);
        rule.validate();

        for (AllocationShare share : rule.getShares()) {
            Optional<LogicalAccount> account = accountService.findByName(share.getAccountName());
            if (account.isEmpty() || !account.get().isActive()) {
                throw new InvalidRuleConfigurationException(
                    "Allocation target '" + share.getAccountName() + "' is not an active account",
                    Map.of("account_name", share.getAccountName()));
            }
        }

        if (repository.existsByName(rule.getName())) {
            throw new DuplicateRuleException(rule.getName());
        }

        try {
            repository.saveAndFlush(AllocationRuleEntity.fromDomain(rule, writeShares(rule.getShares())));
        } catch (DataIntegrityViolationException e) {
            throw new DuplicateRuleException(rule.getName());
        }

        auditService.record(AuditEntityType.ALLOCATION_RULE, rule.getId(), AuditAction.CREATE,
                null, snapshot(rule), actor);
        log.info("Created allocation rule '{}' id={} priority={}", rule.getName(), rule.getId(), priority);
        return rule;
    }

    @Transactional(readOnly = true)
    public List<AllocationRule> listRules(boolean activeOnly) {
        List<AllocationRuleEntity> rows = activeOnly
            ? repository.findByActiveTrueOrderByPriorityAscCreatedAtAscNameAsc()
            : repository.findAllByOrderByPriorityAscCreatedAtAscNameAsc();
        return rows.stream().map(this::toDomain).toList();
    }

    @Transactional(readOnly = true)
    public AllocationRule getRule(UUID id) {
        return repository.findById(id)
                .map(this::toDomain)
                .orElseThrow(() -> new NotFoundException("AllocationRule", id));
    }

    /**
     * Marks the rule inactive. Deactivating an inactive rule is a no-op.
     */
    @Transactional
    public AllocationRule deactivateRule(UUID id, String actor) {
        AllocationRuleEntity entity = repository.findById(id)
                .orElseThrow(() -> new NotFoundException("AllocationRule", id));
        AllocationRule before = toDomain(entity);
        if (!before.isActive()) {
            return before;
        }

        AllocationRule after = before.deactivate();
        entity.setActive(false);
        entity.setUpdatedAt(after.getUpdatedAt());
        repository.save(entity);

        auditService.record(AuditEntityType.ALLOCATION_RULE, id, AuditAction.DELETE,
                snapshot(before), snapshot(after), actor);
        log.info("Deactivated allocation rule '{}' id={}", before.getName(), id);
        return after;
    }

    /**
     * The active rule that governs a deposit of this amount, if any.
     * Runs in the caller's transaction when there is one.
     */
    @Transactional(readOnly = true)
    public Optional<AllocationRule> selectApplicable(BigDecimal amount) {
        return repository.findByActiveTrueOrderByPriorityAscCreatedAtAscNameAsc().stream()
                .map(this::toDomain)
                .filter(rule -> rule.accepts(amount))
                .findFirst();
    }

    static Map<String, Object> snapshot(AllocationRule rule) {
        Map<String, Object> values = new LinkedHashMap<>();
        values.put("rule_name", rule.getName());
        values.put("is_active", rule.isActive());
        values.put("priority", rule.getPriority());
        values.put("allocations", rule.getShares().stream()
                .map(s -> Map.of("account_name", s.getAccountName(),
                        "percentage", s.getPercentage().stripTrailingZeros().toPlainString()))
                .toList());
        values.put("min_amount", rule.getMinAmount() != null ? rule.getMinAmount().toPlainString() : null);
        values.put("max_amount", rule.getMaxAmount() != null ? rule.getMaxAmount().toPlainString() : null);
        return values;
    }

    private AllocationRule toDomain(AllocationRuleEntity entity) {
        return entity.toDomain(readShares(entity.getAllocations()));
    }

    private String writeShares(List<AllocationShare> shares) {
        try {
            return objectMapper.writeValueAsString(shares);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Failed to serialize allocation shares", e);
        }
    }

    private List<AllocationShare> readShares(String json) {
        try {
            return List.copyOf(objectMapper.readValue(json, SHARE_LIST));
        } catch (JsonProcessingException e) {
            throw new InvalidRuleConfigurationException("Stored allocation shares are unreadable: " + e.getOriginalMessage());
        }
    }
}
