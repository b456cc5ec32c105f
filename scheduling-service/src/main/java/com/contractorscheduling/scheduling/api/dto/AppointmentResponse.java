package com.contractorscheduling.scheduling.api.dto;

import com.contractorscheduling.scheduling.domain.model.Appointment;
import com.contractorscheduling.scheduling.domain.model.AppointmentStatus;
import com.contractorscheduling.scheduling.domain.model.PaymentStatus;

import java.math.BigDecimal;
import java.time.Instant;

public record AppointmentResponse(
        Long id,
        Long contractorId,
        Long serviceId,
        String serviceName,
        Long clientId,
        String clientName,
        String clientEmail,
        String clientPhone,
        String notes,
        Instant start,
        Instant end,
        AppointmentStatus status,
        BigDecimal totalPrice,
        boolean depositRequired,
        BigDecimal depositAmount,
        boolean depositPaid,
        PaymentStatus paymentStatus,
        String paymentReference,
        BigDecimal refundAmount,
        String refundReason,
        String cancellationReason,
        String cancelledBy,
        Instant cancelledAt,
        Instant confirmedAt,
        Instant completedAt,
        Instant createdAt
) {
    public static AppointmentResponse from(Appointment appointment) {
        return new AppointmentResponse(
                appointment.getId(),
                appointment.getContractorId(),
                appointment.getServiceId(),
                appointment.getServiceName(),
                appointment.getClientId(),
                appointment.getClientName(),
                appointment.getClientEmail(),
                appointment.getClientPhone(),
                appointment.getNotes(),
                appointment.getScheduledStart(),
                appointment.getScheduledEnd(),
                appointment.getStatus(),
                appointment.getTotalPrice(),
                appointment.isDepositRequired(),
                appointment.getDepositAmount(),
                appointment.isDepositPaid(),
                appointment.getPaymentStatus(),
                appointment.getPaymentReference(),
                appointment.getRefundAmount(),
                appointment.getRefundReason(),
                appointment.getCancellationReason(),
                appointment.getCancelledBy(),
                appointment.getCancelledAt(),
                appointment.getConfirmedAt(),
                appointment.getCompletedAt(),
                appointment.getCreatedAt()
        );
    }
}
