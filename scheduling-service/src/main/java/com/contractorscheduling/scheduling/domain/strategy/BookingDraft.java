package com.contractorscheduling.scheduling.domain.strategy;

import com.contractorscheduling.scheduling.domain.availability.ScheduleSnapshot;
import com.contractorscheduling.scheduling.domain.model.Appointment;
import com.contractorscheduling.scheduling.domain.model.AppointmentStatus;
import com.contractorscheduling.scheduling.domain.model.PaymentStatus;
import com.contractorscheduling.scheduling.domain.model.ServiceDefinition;
import com.contractorscheduling.scheduling.domain.service.BookingCommand;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Everything a strategy needs to commit one booking. Pricing and deposit terms are decided
 * before the commit and do not change on retry.
 */
public record BookingDraft(BookingCommand command,
                           ScheduleSnapshot schedule,
                           ServiceDefinition service,
                           boolean depositRequired,
                           BigDecimal depositAmount) {

    public Long contractorId() {
        return command.contractorId();
    }

    public Instant requestedStart() {
        return command.requestedStart();
    }

    public Instant requestedEnd() {
        return command.requestedStart().plus(service.blockLength());
    }

    /**
     * A fresh, unsaved appointment. Each commit attempt builds its own so a rolled-back attempt
     * leaves nothing behind for the retry.
     */
    public Appointment newAppointment(Instant now) {
        AppointmentStatus status = schedule.autoConfirmBookings() ? AppointmentStatus.CONFIRMED : AppointmentStatus.REQUESTED;
        return Appointment.builder()
                .contractorId(command.contractorId())
                .serviceId(service.getId())
                .serviceName(service.getName())
                .clientId(command.client().clientId())
                .clientName(command.client().name())
                .clientEmail(command.client().email())
                .clientPhone(command.client().phone())
                .notes(command.client().notes())
                .scheduledStart(requestedStart())
                .scheduledEnd(requestedEnd())
                .status(status)
                .confirmedAt(status == AppointmentStatus.CONFIRMED ? now : null)
                .totalPrice(service.getPrice())
                .depositRequired(depositRequired)
                .depositAmount(depositAmount)
                .depositPaid(false)
                .paymentStatus(depositRequired ? PaymentStatus.DEPOSIT_PENDING : PaymentStatus.NOT_REQUIRED)
                .idempotencyKey(command.idempotencyKey())
                .build();
    }
}
