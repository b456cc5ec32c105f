package com.contractorscheduling.scheduling.domain.service;

import java.math.BigDecimal;

/**
 * Partial edit of a service definition. Null fields are left unchanged.
 */
public record ServiceUpdate(String name,
                            String description,
                            Integer durationMinutes,
                            BigDecimal price,
                            Integer preparationMinutes,
                            Integer cleanupMinutes,
                            Boolean requiresDeposit,
                            BigDecimal depositPercentage,
                            Boolean active) {

    boolean changesTiming() {
        return durationMinutes != null || preparationMinutes != null || cleanupMinutes != null;
    }
}
