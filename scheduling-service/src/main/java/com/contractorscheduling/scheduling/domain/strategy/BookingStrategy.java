package com.contractorscheduling.scheduling.domain.strategy;

import com.contractorscheduling.scheduling.domain.model.Appointment;

/**
 * Commits a booking while holding exclusive write access to the contractor's ledger.
 *
 * Implementations (bean names, selected by {@code scheduling.ledger.strategy}):
 * - pessimistic: SELECT FOR UPDATE on the contractor ledger row
 * - optimistic: version check on the contractor ledger row, retried on conflict
 * - distributed: Redisson lock around a programmatic transaction
 */
public interface BookingStrategy {

    /**
     * Re-checks the slot against the current ledger and inserts the appointment.
     *
     * @throws com.contractorscheduling.scheduling.exception.BookingConflictException if the slot
     *         is no longer free at commit time
     */
    Appointment commit(BookingDraft draft);

    String getStrategyType();
}
