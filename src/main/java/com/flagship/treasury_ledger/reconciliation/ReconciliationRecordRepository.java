package com.flagship.treasury_ledger.reconciliation;

import jakarta.persistence.LockModeType;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface ReconciliationRecordRepository extends JpaRepository<ReconciliationRecordEntity, UUID> {

    Optional<ReconciliationRecordEntity> findFirstByOrderByCreatedAtDesc();

    List<ReconciliationRecordEntity> findAllByOrderByCreatedAtDesc(Pageable pageable);

    List<ReconciliationRecordEntity> findByStatusOrderByCreatedAtDesc(ReconciliationStatus status, Pageable pageable);

    /**
     * Serialises concurrent resolutions of one record.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT r FROM ReconciliationRecordEntity r WHERE r.id = :id")
    Optional<ReconciliationRecordEntity> findByIdForUpdate(@Param("id") UUID id);
}
