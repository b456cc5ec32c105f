package com.contractorscheduling.scheduling.events;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AppointmentStatusChangedEvent {
    private Long appointmentId;
    private Long contractorId;
    private String fromStatus;
    private String toStatus;
    private String changedBy;
    private String reason;
    private Instant timestamp;
}
