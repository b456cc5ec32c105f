package com.contractorscheduling.scheduling.domain.availability;

import java.time.DayOfWeek;
import java.time.LocalTime;

/**
 * Working hours for one weekday, in the contractor's local time.
 */
public record DailyWindow(DayOfWeek day, LocalTime start, LocalTime end, boolean enabled) {

    public static DailyWindow closed(DayOfWeek day) {
        return new DailyWindow(day, null, null, false);
    }

    public boolean isOpen() {
        return enabled && start != null && end != null && start.isBefore(end);
    }
}
