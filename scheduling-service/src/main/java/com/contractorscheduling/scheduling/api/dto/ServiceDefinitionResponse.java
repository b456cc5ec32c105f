package com.contractorscheduling.scheduling.api.dto;

import com.contractorscheduling.scheduling.domain.model.ServiceDefinition;

import java.math.BigDecimal;

public record ServiceDefinitionResponse(
        Long id,
        Long contractorId,
        String name,
        String description,
        Integer durationMinutes,
        BigDecimal price,
        Integer preparationMinutes,
        Integer cleanupMinutes,
        Boolean requiresDeposit,
        BigDecimal depositPercentage,
        boolean active
) {
    public static ServiceDefinitionResponse from(ServiceDefinition service) {
        return new ServiceDefinitionResponse(
                service.getId(),
                service.getContractorId(),
                service.getName(),
                service.getDescription(),
                service.getDurationMinutes(),
                service.getPrice(),
                service.getPreparationMinutes(),
                service.getCleanupMinutes(),
                service.getRequiresDeposit(),
                service.getDepositPercentage(),
                service.isActive()
        );
    }
}
