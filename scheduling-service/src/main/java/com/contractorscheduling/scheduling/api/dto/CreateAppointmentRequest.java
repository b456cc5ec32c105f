package com.contractorscheduling.scheduling.api.dto;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

import java.time.Instant;

public record CreateAppointmentRequest(
        @NotNull(message = "Contractor ID cannot be null")
        Long contractorId,

        @NotNull(message = "Service ID cannot be null")
        Long serviceId,

        @NotNull(message = "Start time cannot be null")
        Instant start,

        @Valid
        @NotNull(message = "Client info cannot be null")
        ClientInfoRequest clientInfo,

        @Size(max = 100, message = "Idempotency key is too long")
        String idempotencyKey,

        String requestedBy
) {
}
