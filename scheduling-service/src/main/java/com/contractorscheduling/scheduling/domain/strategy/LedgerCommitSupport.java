package com.contractorscheduling.scheduling.domain.strategy;

import com.contractorscheduling.scheduling.domain.availability.AvailabilityCalculator;
import com.contractorscheduling.scheduling.domain.availability.UnavailabilityReason;
import com.contractorscheduling.scheduling.domain.model.Appointment;
import com.contractorscheduling.scheduling.domain.model.AppointmentStatus;
import com.contractorscheduling.scheduling.domain.model.AppointmentStatusChange;
import com.contractorscheduling.scheduling.domain.repository.AppointmentRepository;
import com.contractorscheduling.scheduling.domain.repository.AppointmentStatusChangeRepository;
import com.contractorscheduling.scheduling.events.AppointmentBookedEvent;
import com.contractorscheduling.scheduling.exception.BookingConflictException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * The critical section shared by every strategy. Must run inside the strategy's transaction,
 * after the strategy has obtained exclusive access to the contractor.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class LedgerCommitSupport {

    private final AppointmentRepository appointmentRepository;
    private final AppointmentStatusChangeRepository statusChangeRepository;
    private final AvailabilityCalculator availabilityCalculator;
    private final ApplicationEventPublisher eventPublisher;
    private final Clock clock;

    /**
     * Inserts the draft if the slot is still free. A draft whose idempotency key was committed by a
     * concurrent request while this one waited for the contractor returns that appointment instead.
     */
    public Appointment recheckAndInsert(BookingDraft draft) {
        String key = draft.command().idempotencyKey();
        if (key != null && !key.isBlank()) {
            Optional<Appointment> committed = appointmentRepository.findByIdempotencyKey(key);
            if (committed.isPresent()) {
                log.info("Idempotency key {} was committed concurrently as appointment {}", key, committed.get().getId());
                return committed.get();
            }
        }

        Instant now = clock.instant();
        Duration reach = draft.schedule().buffer().multipliedBy(2);
        List<Appointment> nearby = appointmentRepository.findIntersecting(
                draft.contractorId(),
                AppointmentStatus.ACTIVE,
                draft.requestedStart().minus(reach),
                draft.requestedEnd().plus(reach));

        Optional<UnavailabilityReason> failure = availabilityCalculator.checkRequestedSlot(
                draft.schedule(), draft.service(), nearby, draft.requestedStart(), now);
        if (failure.isPresent()) {
            log.warn("Commit re-check rejected contractor {} start {}: {}",
                    draft.contractorId(), draft.requestedStart(), failure.get());
            throw new BookingConflictException(draft.contractorId(), draft.requestedStart(), failure.get());
        }

        Appointment saved = appointmentRepository.save(draft.newAppointment(now));
        statusChangeRepository.save(AppointmentStatusChange.builder()
                .appointmentId(saved.getId())
                .fromStatus(null)
                .toStatus(saved.getStatus())
                .changedBy(draft.command().requestedBy())
                .reason("Booked")
                .changedAt(now)
                .build());
        eventPublisher.publishEvent(AppointmentBookedEvent.from(saved, now));
        return saved;
    }
}
