package com.contractorscheduling.scheduling.api.dto;

import com.contractorscheduling.scheduling.domain.service.ServiceUpdate;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import jakarta.validation.constraints.Size;

import java.math.BigDecimal;

public record ServiceUpdateRequest(
        @Size(max = 200, message = "Name is too long")
        String name,
        @Size(max = 2000, message = "Description is too long")
        String description,
        @Positive(message = "Duration must be positive")
        Integer durationMinutes,
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
    public ServiceUpdate toUpdate() {
        return new ServiceUpdate(name, description, durationMinutes, price, preparationMinutes,
                cleanupMinutes, requiresDeposit, depositPercentage, active);
    }
}
