package com.flagship.treasury_ledger.allocation;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import jakarta.persistence.Version;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * JPA entity for allocation rules. The share list is stored as a JSONB
 * array of {@code {"account_name", "percentage"}} objects.
 */
@Entity
@Table(name = "allocation_rules")
@Getter
@Setter
@NoArgsConstructor
public class AllocationRuleEntity {

    @Id
    @Column(name = "id", nullable = false, updatable = false)
    private UUID id;

    @Column(name = "rule_name", nullable = false, length = 100)
    private String name;

    @Column(name = "is_active", nullable = false)
    private boolean active;

    @Column(name = "priority", nullable = false)
    private int priority;

    @Column(name = "allocations", nullable = false, columnDefinition = "jsonb")
    @JdbcTypeCode(SqlTypes.JSON)
    private String allocations;

    @Column(name = "min_amount", precision = 20, scale = 8)
    private BigDecimal minAmount;

    @Column(name = "max_amount", precision = 20, scale = 8)
    private BigDecimal maxAmount;

    @Column(name = "description", columnDefinition = "TEXT")
    private String description;

    @Column(name = "created_by", nullable = false, length = 100, updatable = false)
    private String createdBy;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @Version
    @Column(name = "version", nullable = false)
    private Long version;

    public static AllocationRuleEntity fromDomain(AllocationRule rule, String allocationsJson) {
        AllocationRuleEntity entity = new AllocationRuleEntity();
        entity.setId(rule.getId());
        entity.setName(rule.getName());
        entity.setActive(rule.isActive());
        entity.setPriority(rule.getPriority());
        entity.setAllocations(allocationsJson);
        entity.setMinAmount(rule.getMinAmount());
        entity.setMaxAmount(rule.getMaxAmount());
        entity.setDescription(rule.getDescription());
        entity.setCreatedBy(rule.getCreatedBy());
        entity.setCreatedAt(rule.getCreatedAt());
        entity.setUpdatedAt(rule.getUpdatedAt());
        return entity;
    }

    public AllocationRule toDomain(List<AllocationShare> shares) {
        return new AllocationRule(id, name, active, priority, shares, minAmount, maxAmount,
                description, createdBy, createdAt, updatedAt);
    }
}
