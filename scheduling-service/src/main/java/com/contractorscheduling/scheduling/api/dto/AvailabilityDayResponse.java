package com.contractorscheduling.scheduling.api.dto;

import com.contractorscheduling.scheduling.domain.availability.UnavailabilityReason;
import com.contractorscheduling.scheduling.domain.service.AvailabilityDay;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;
import java.time.LocalDate;
import java.util.List;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record AvailabilityDayResponse(
        LocalDate date,
        boolean open,
        UnavailabilityReason reason,
        List<Window> windows,
        Integer availableSlots
) {
    public record Window(Instant start, Instant end) {
    }

    public static AvailabilityDayResponse from(AvailabilityDay day) {
        return new AvailabilityDayResponse(
                day.date(),
                day.open(),
                day.reason(),
                day.windows().stream().map(w -> new Window(w.start(), w.end())).toList(),
                day.availableSlots()
        );
    }
}
