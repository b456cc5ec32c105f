package com.contractorscheduling.scheduling.api.dto;

import java.time.LocalDate;
import java.util.List;

public record AvailabilityRangeResponse(
        Long contractorId,
        LocalDate startDate,
        LocalDate endDate,
        List<AvailabilityDayResponse> days
) {
}
