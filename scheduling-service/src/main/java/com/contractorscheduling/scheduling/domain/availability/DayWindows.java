package com.contractorscheduling.scheduling.domain.availability;

import java.time.LocalDate;
import java.util.List;

/**
 * Bookable sub-windows of one calendar day, or the reason the whole day is rejected.
 */
public record DayWindows(LocalDate date, List<TimeWindow> windows, UnavailabilityReason rejection) {

    public DayWindows {
        windows = List.copyOf(windows);
    }

    static DayWindows open(LocalDate date, List<TimeWindow> windows) {
        return new DayWindows(date, windows, null);
    }

    static DayWindows rejected(LocalDate date, UnavailabilityReason reason) {
        return new DayWindows(date, List.of(), reason);
    }

    public boolean isOpen() {
        return rejection == null;
    }
}
