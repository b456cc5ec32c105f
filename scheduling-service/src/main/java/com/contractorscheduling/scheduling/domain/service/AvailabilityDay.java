package com.contractorscheduling.scheduling.domain.service;

import com.contractorscheduling.scheduling.domain.availability.TimeWindow;
import com.contractorscheduling.scheduling.domain.availability.UnavailabilityReason;

import java.time.LocalDate;
import java.util.List;

/**
 * One day of a range summary. {@code availableSlots} is null when no service was given.
 */
public record AvailabilityDay(LocalDate date,
                              boolean open,
                              UnavailabilityReason reason,
                              List<TimeWindow> windows,
                              Integer availableSlots) {
}
