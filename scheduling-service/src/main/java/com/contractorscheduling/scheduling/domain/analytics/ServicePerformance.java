package com.contractorscheduling.scheduling.domain.analytics;

import java.math.BigDecimal;

public record ServicePerformance(Long serviceId,
                                 String serviceName,
                                 long bookings,
                                 long completed,
                                 long cancelled,
                                 BigDecimal revenue) {
}
