package com.contractorscheduling.scheduling.domain.strategy;

import com.contractorscheduling.common.exception.ResourceNotFoundException;
import com.contractorscheduling.scheduling.domain.model.Appointment;
import com.contractorscheduling.scheduling.domain.model.ContractorLedger;
import com.contractorscheduling.scheduling.domain.repository.ContractorLedgerRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

/**
 * Booking strategy using a row lock (SELECT FOR UPDATE) on the contractor's ledger row.
 *
 * Flow:
 * 1. Lock the ledger row; concurrent bookings for the same contractor wait here
 * 2. Re-check the slot against committed appointments
 * 3. Insert the appointment and bump the booking sequence
 * 4. Commit (releases the lock)
 *
 * Bookings for different contractors never contend.
 */
@Slf4j
@Component("pessimistic")
@RequiredArgsConstructor
public class PessimisticLockBookingStrategy implements BookingStrategy {

    private final ContractorLedgerRepository ledgerRepository;
    private final LedgerCommitSupport commitSupport;

    @Override
    @Transactional
    public Appointment commit(BookingDraft draft) {
        ContractorLedger ledger = ledgerRepository.findByContractorIdWithLock(draft.contractorId())
                .orElseThrow(() -> new ResourceNotFoundException("Contractor ledger", draft.contractorId()));
        log.debug("Holding ledger row lock for contractor {}", draft.contractorId());

        Appointment saved = commitSupport.recheckAndInsert(draft);
        ledger.recordBooking();
        return saved;
    }

    @Override
    public String getStrategyType() {
        return "PESSIMISTIC_LOCK";
    }
}
