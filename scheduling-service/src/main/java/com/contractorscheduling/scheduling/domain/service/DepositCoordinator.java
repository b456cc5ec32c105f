package com.contractorscheduling.scheduling.domain.service;

import com.contractorscheduling.scheduling.client.PaymentGateway;
import com.contractorscheduling.scheduling.client.dto.DepositIntentRequest;
import com.contractorscheduling.scheduling.client.dto.DepositIntentResponse;
import com.contractorscheduling.scheduling.events.AppointmentBookedEvent;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Component;
import org.springframework.transaction.event.TransactionPhase;
import org.springframework.transaction.event.TransactionalEventListener;

/**
 * Requests a deposit intent from the payment service once a booking that needs one has committed.
 *
 * Runs on the scheduling executor so the booking response never waits on the payment service.
 * A failed request leaves the appointment in DEPOSIT_PENDING; the slot stays held.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class DepositCoordinator {

    private final PaymentGateway paymentGateway;
    private final AppointmentLedger appointmentLedger;

    @Async("schedulingExecutor")
    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT)
    public void onAppointmentBooked(AppointmentBookedEvent event) {
        if (!event.isDepositRequired()) {
            return;
        }
        try {
            DepositIntentResponse response = paymentGateway.requestDepositIntent(new DepositIntentRequest(
                    event.getAppointmentId(),
                    event.getContractorId(),
                    event.getClientId(),
                    event.getClientEmail(),
                    event.getDepositAmount(),
                    "appointment-deposit-" + event.getAppointmentId()));
            appointmentLedger.attachPaymentReference(event.getAppointmentId(), response.paymentReference());
            log.info("Deposit intent {} created for appointment {}", response.paymentReference(), event.getAppointmentId());
        } catch (RuntimeException e) {
            log.warn("Deposit intent for appointment {} failed, leaving it DEPOSIT_PENDING: {}",
                    event.getAppointmentId(), e.getMessage());
        }
    }
}
