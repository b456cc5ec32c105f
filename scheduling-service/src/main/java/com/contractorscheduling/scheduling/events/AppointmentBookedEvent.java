package com.contractorscheduling.scheduling.events;

import com.contractorscheduling.scheduling.domain.model.Appointment;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Raised inside the booking transaction; relayed to Kafka and the deposit flow once it commits.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AppointmentBookedEvent {
    private Long appointmentId;
    private Long contractorId;
    private Long serviceId;
    private String serviceName;
    private Long clientId;
    private String clientName;
    private String clientEmail;
    private Instant scheduledStart;
    private Instant scheduledEnd;
    private String status;
    private BigDecimal totalPrice;
    private boolean depositRequired;
    private BigDecimal depositAmount;
    private String idempotencyKey;
    private Instant timestamp;

    public static AppointmentBookedEvent from(Appointment appointment, Instant timestamp) {
        return AppointmentBookedEvent.builder()
                .appointmentId(appointment.getId())
                .contractorId(appointment.getContractorId())
                .serviceId(appointment.getServiceId())
                .serviceName(appointment.getServiceName())
                .clientId(appointment.getClientId())
                .clientName(appointment.getClientName())
                .clientEmail(appointment.getClientEmail())
                .scheduledStart(appointment.getScheduledStart())
                .scheduledEnd(appointment.getScheduledEnd())
                .status(appointment.getStatus().name())
                .totalPrice(appointment.getTotalPrice())
                .depositRequired(appointment.isDepositRequired())
                .depositAmount(appointment.getDepositAmount())
                .idempotencyKey(appointment.getIdempotencyKey())
                .timestamp(timestamp)
                .build();
    }
}
