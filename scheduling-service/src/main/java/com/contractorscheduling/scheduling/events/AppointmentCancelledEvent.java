package com.contractorscheduling.scheduling.events;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Published when an appointment is cancelled. Consumers handle client notification and refund execution.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AppointmentCancelledEvent {
    private Long appointmentId;
    private Long contractorId;
    private Instant scheduledStart;
    private String cancelledBy;
    private String reason;
    private BigDecimal refundAmount;
    private String refundReason;
    private boolean lateCancellation;
    private String paymentReference;
    private Instant timestamp;
}
