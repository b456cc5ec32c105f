package com.contractorscheduling.scheduling.api.dto;

import com.contractorscheduling.scheduling.domain.model.AppointmentStatus;
import com.contractorscheduling.scheduling.domain.model.AppointmentStatusChange;

import java.time.Instant;

public record StatusChangeResponse(
        AppointmentStatus fromStatus,
        AppointmentStatus toStatus,
        String changedBy,
        String reason,
        Instant changedAt
) {
    public static StatusChangeResponse from(AppointmentStatusChange change) {
        return new StatusChangeResponse(
                change.getFromStatus(),
                change.getToStatus(),
                change.getChangedBy(),
                change.getReason(),
                change.getChangedAt()
        );
    }
}
