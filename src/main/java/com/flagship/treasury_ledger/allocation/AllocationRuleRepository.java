package com.flagship.treasury_ledger.allocation;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface AllocationRuleRepository extends JpaRepository<AllocationRuleEntity, UUID> {

    /**
     * Active rules in selection order: priority, then age, then name.
     */
    List<AllocationRuleEntity> findByActiveTrueOrderByPriorityAscCreatedAtAscNameAsc();

    List<AllocationRuleEntity> findAllByOrderByPriorityAscCreatedAtAscNameAsc();

    Optional<AllocationRuleEntity> findByName(String name);

    boolean existsByName(String name);
}
