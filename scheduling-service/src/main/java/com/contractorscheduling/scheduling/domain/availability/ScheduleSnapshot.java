package com.contractorscheduling.scheduling.domain.availability;

import com.contractorscheduling.scheduling.domain.model.BufferMode;
import lombok.Builder;

import java.math.BigDecimal;
import java.time.DayOfWeek;
import java.time.Duration;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Immutable copy of a contractor's schedule configuration, taken once per request.
 */
@Builder(toBuilder = true)
public record ScheduleSnapshot(Long contractorId,
                               long configVersion,
                               ZoneId zone,
                               Map<DayOfWeek, DailyWindow> workingHours,
                               Set<LocalDate> blackoutDates,
                               List<RecurringWindow> recurringWindows,
                               Duration buffer,
                               BufferMode bufferMode,
                               int advanceBookingDays,
                               Duration minimumNotice,
                               int slotStepMinutes,
                               boolean acceptingBookings,
                               boolean autoConfirmBookings,
                               boolean requiresDeposit,
                               BigDecimal depositPercentage,
                               CancellationTerms cancellationTerms) {

    public ScheduleSnapshot {
        workingHours = workingHours == null ? Map.of() : Map.copyOf(workingHours);
        blackoutDates = blackoutDates == null ? Set.of() : Set.copyOf(blackoutDates);
        recurringWindows = recurringWindows == null ? List.of() : List.copyOf(recurringWindows);
        buffer = buffer == null ? Duration.ZERO : buffer;
        bufferMode = bufferMode == null ? BufferMode.SYMMETRIC : bufferMode;
        minimumNotice = minimumNotice == null ? Duration.ZERO : minimumNotice;
    }

    public DailyWindow hoursFor(DayOfWeek day) {
        return workingHours.getOrDefault(day, DailyWindow.closed(day));
    }

    public List<RecurringWindow> recurringWindowsFor(DayOfWeek day) {
        return recurringWindows.stream().filter(w -> w.day() == day).toList();
    }

    public boolean isBlackout(LocalDate date) {
        return blackoutDates.contains(date);
    }
}
