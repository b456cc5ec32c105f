package com.contractorscheduling.scheduling.domain.repository;

import com.contractorscheduling.scheduling.domain.model.ContractorLedger;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.Optional;

/**
 * Access to the per-contractor ledger row that booking writes serialize on.
 */
public interface ContractorLedgerRepository extends JpaRepository<ContractorLedger, Long> {

    /**
     * SELECT ... FOR UPDATE on the contractor's ledger row. Every booking for the same contractor
     * queues here until the holder commits or rolls back.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT l FROM ContractorLedger l WHERE l.contractorId = :contractorId")
    Optional<ContractorLedger> findByContractorIdWithLock(@Param("contractorId") Long contractorId);
}
