package com.contractorscheduling.scheduling.domain.analytics;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;

/**
 * Read-only statistics for one contractor over an inclusive date range.
 * Ratios are fractions in [0, 1] with four decimals.
 */
public record SchedulingSummary(Long contractorId,
                                LocalDate startDate,
                                LocalDate endDate,
                                long totalAppointments,
                                long requestedCount,
                                long confirmedCount,
                                long completedCount,
                                long cancelledCount,
                                long noShowCount,
                                long bookedMinutes,
                                long workingMinutes,
                                BigDecimal utilizationRatio,
                                BigDecimal completedRevenue,
                                BigDecimal projectedRevenue,
                                BigDecimal completionRate,
                                List<ServicePerformance> servicePerformance) {
}
