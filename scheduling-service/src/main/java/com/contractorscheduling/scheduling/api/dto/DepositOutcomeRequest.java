package com.contractorscheduling.scheduling.api.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

public record DepositOutcomeRequest(
        @NotBlank(message = "Payment reference cannot be blank")
        String paymentReference,

        @NotNull(message = "Captured flag cannot be null")
        Boolean captured
) {
}
