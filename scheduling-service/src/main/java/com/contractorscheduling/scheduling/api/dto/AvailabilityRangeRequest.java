package com.contractorscheduling.scheduling.api.dto;

import jakarta.validation.constraints.NotNull;

import java.time.LocalDate;

public record AvailabilityRangeRequest(
        @NotNull(message = "Contractor ID cannot be null")
        Long contractorId,

        @NotNull(message = "Start date cannot be null")
        LocalDate startDate,

        @NotNull(message = "End date cannot be null")
        LocalDate endDate,

        Long serviceId
) {
}
