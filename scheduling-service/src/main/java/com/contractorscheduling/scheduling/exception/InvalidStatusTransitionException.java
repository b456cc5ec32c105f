package com.contractorscheduling.scheduling.exception;

import com.contractorscheduling.common.exception.BusinessException;
import com.contractorscheduling.scheduling.domain.model.AppointmentStatus;

public class InvalidStatusTransitionException extends BusinessException {
    public static final String CODE = "INVALID_STATUS_TRANSITION";

    public InvalidStatusTransitionException(Long appointmentId, AppointmentStatus from, AppointmentStatus to) {
        super(String.format("Appointment %d cannot move from %s to %s", appointmentId, from, to), CODE);
    }
}
