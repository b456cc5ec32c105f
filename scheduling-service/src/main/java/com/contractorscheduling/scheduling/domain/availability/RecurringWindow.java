package com.contractorscheduling.scheduling.domain.availability;

import java.time.DayOfWeek;
import java.time.LocalTime;

public record RecurringWindow(DayOfWeek day, LocalTime start, LocalTime end) {
}
