package com.contractorscheduling.scheduling.api.dto;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

public record AppointmentActionRequest(
        @NotNull(message = "Action cannot be null")
        AppointmentAction action,

        @Size(max = 100, message = "Requester is too long")
        String requestedBy,

        @Size(max = 500, message = "Reason is too long")
        String reason
) {
}
