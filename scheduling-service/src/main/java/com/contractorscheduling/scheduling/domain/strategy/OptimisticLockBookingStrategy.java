package com.contractorscheduling.scheduling.domain.strategy;

import com.contractorscheduling.common.exception.ResourceNotFoundException;
import com.contractorscheduling.scheduling.domain.model.Appointment;
import com.contractorscheduling.scheduling.domain.model.ContractorLedger;
import com.contractorscheduling.scheduling.domain.repository.ContractorLedgerRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.OptimisticLockingFailureException;
import org.springframework.retry.annotation.Backoff;
import org.springframework.retry.annotation.Retryable;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

/**
 * Booking strategy using the {@code @Version} column of the contractor's ledger row.
 *
 * The version bump is flushed before the re-check, so of two concurrent bookings for the
 * same contractor only one gets past the flush. The loser rolls back and is retried up to
 * 3 times; the retry sees the winner's appointment and fails with a conflict if the
 * slots overlap.
 */
@Slf4j
@Component("optimistic")
@RequiredArgsConstructor
public class OptimisticLockBookingStrategy implements BookingStrategy {

    private final ContractorLedgerRepository ledgerRepository;
    private final LedgerCommitSupport commitSupport;

    @Override
    @Retryable(
            retryFor = OptimisticLockingFailureException.class,
            maxAttempts = 3,
            backoff = @Backoff(delay = 100, multiplier = 2)
    )
    @Transactional
    public Appointment commit(BookingDraft draft) {
        ContractorLedger ledger = ledgerRepository.findById(draft.contractorId())
                .orElseThrow(() -> new ResourceNotFoundException("Contractor ledger", draft.contractorId()));

        // Throws OptimisticLockingFailureException if another booking bumped the version first
        ledger.recordBooking();
        ledgerRepository.saveAndFlush(ledger);
        log.debug("Ledger version for contractor {} advanced to {}", draft.contractorId(), ledger.getVersion());

        return commitSupport.recheckAndInsert(draft);
    }

    @Override
    public String getStrategyType() {
        return "OPTIMISTIC_LOCK";
    }
}
