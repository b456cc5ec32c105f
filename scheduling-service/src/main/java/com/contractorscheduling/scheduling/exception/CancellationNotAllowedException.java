package com.contractorscheduling.scheduling.exception;

import com.contractorscheduling.common.exception.BusinessException;

public class CancellationNotAllowedException extends BusinessException {
    public static final String CODE = "CANCELLATION_NOT_ALLOWED";

    public CancellationNotAllowedException(Long appointmentId, String reason) {
        super(String.format("Appointment %d cannot be cancelled: %s", appointmentId, reason), CODE);
    }
}
