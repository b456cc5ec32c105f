package com.contractorscheduling.scheduling.api.dto;

import com.contractorscheduling.scheduling.domain.model.ServiceDefinition;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import jakarta.validation.constraints.Size;

import java.math.BigDecimal;

public record ServiceDefinitionRequest(
        @NotBlank(message = "Name cannot be blank")
        @Size(max = 200, message = "Name is too long")
        String name,

        @Size(max = 2000, message = "Description is too long")
        String description,

        @NotNull(message = "Duration cannot be null")
        @Positive(message = "Duration must be positive")
        Integer durationMinutes,

        @NotNull(message = "Price cannot be null")
        @PositiveOrZero(message = "Price cannot be negative")
        BigDecimal price,

        @PositiveOrZero(message = "Preparation time cannot be negative")
        Integer preparationMinutes,

        @PositiveOrZero(message = "Cleanup time cannot be negative")
        Integer cleanupMinutes,

        Boolean requiresDeposit,
        BigDecimal depositPercentage,
        Boolean active
) {
    public ServiceDefinition toEntity() {
        return ServiceDefinition.builder()
                .name(name)
                .description(description)
                .durationMinutes(durationMinutes)
                .price(price)
                .preparationMinutes(preparationMinutes == null ? 0 : preparationMinutes)
                .cleanupMinutes(cleanupMinutes == null ? 0 : cleanupMinutes)
                .requiresDeposit(requiresDeposit)
                .depositPercentage(depositPercentage)
                .active(active == null || active)
                .build();
    }
}
