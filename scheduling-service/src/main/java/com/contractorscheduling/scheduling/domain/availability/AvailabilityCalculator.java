package com.contractorscheduling.scheduling.domain.availability;

import com.contractorscheduling.scheduling.domain.model.Appointment;
import com.contractorscheduling.scheduling.domain.model.ServiceDefinition;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Computes bookable slots from a schedule snapshot, a service and the contractor's existing appointments.
 *
 * Stateless and free of I/O: every input, including the current instant, is passed in,
 * so the same inputs always produce the same slots. Local dates and times are resolved
 * in the contractor's zone once per day; everything after that works on instants, which
 * keeps DST transition days correct.
 *
 * The ledger uses {@link #checkRequestedSlot} for both its pre-check and its commit re-check,
 * so a booking is accepted exactly when the calculator would report the slot as available
 * (grid alignment aside: any start inside the open windows is accepted).
 */
@Component
public class AvailabilityCalculator {

    public List<Slot> computeAvailability(ScheduleSnapshot schedule,
                                          ServiceDefinition service,
                                          List<Appointment> existingAppointments,
                                          LocalDate rangeStart,
                                          LocalDate rangeEnd,
                                          Instant now) {
        List<Slot> slots = new ArrayList<>();
        if (rangeEnd.isBefore(rangeStart)) {
            return slots;
        }

        Duration blockLength = service.blockLength();
        Duration step = Duration.ofMinutes(schedule.slotStepMinutes());
        List<TimeWindow> busy = busyIntervals(schedule, existingAppointments);
        Instant earliestStart = now.plus(schedule.minimumNotice());

        for (LocalDate date = rangeStart; !date.isAfter(rangeEnd); date = date.plusDays(1)) {
            DayWindows day = openWindows(schedule, date, now);
            if (!day.isOpen()) {
                continue;
            }
            for (TimeWindow window : day.windows()) {
                Instant start = window.start();
                while (!start.plus(blockLength).isAfter(window.end())) {
                    TimeWindow block = TimeWindow.of(start, blockLength);
                    if (conflicts(schedule, block, busy)) {
                        slots.add(Slot.unavailable(block, UnavailabilityReason.CONFLICT));
                    } else if (start.isBefore(earliestStart)) {
                        slots.add(Slot.unavailable(block, UnavailabilityReason.MINIMUM_NOTICE));
                    } else {
                        slots.add(Slot.available(block));
                    }
                    start = start.plus(step);
                }
            }
        }
        slots.sort(Comparator.comparing(Slot::start));
        return slots;
    }

    /**
     * Working sub-windows of {@code date} after recurring unavailability has been removed,
     * or the day-level reason nothing can be booked on it.
     */
    public DayWindows openWindows(ScheduleSnapshot schedule, LocalDate date, Instant now) {
        ZoneId zone = schedule.zone();
        LocalDate today = LocalDate.ofInstant(now, zone);

        if (!schedule.acceptingBookings()) {
            return DayWindows.rejected(date, UnavailabilityReason.NOT_ACCEPTING_BOOKINGS);
        }
        if (schedule.isBlackout(date)) {
            return DayWindows.rejected(date, UnavailabilityReason.BLACKOUT);
        }
        DailyWindow hours = schedule.hoursFor(date.getDayOfWeek());
        if (!hours.isOpen()) {
            return DayWindows.rejected(date, UnavailabilityReason.CLOSED);
        }
        if (date.isAfter(today.plusDays(schedule.advanceBookingDays()))) {
            return DayWindows.rejected(date, UnavailabilityReason.BEYOND_HORIZON);
        }
        if (date.isBefore(today)) {
            return DayWindows.rejected(date, UnavailabilityReason.BEFORE_TODAY);
        }

        List<TimeWindow> windows = new ArrayList<>();
        windows.add(dayBounds(hours, date, zone));
        for (RecurringWindow recurring : schedule.recurringWindowsFor(date.getDayOfWeek())) {
            TimeWindow cut = resolve(date, recurring.start(), recurring.end(), zone);
            List<TimeWindow> remaining = new ArrayList<>();
            for (TimeWindow window : windows) {
                remaining.addAll(window.minus(cut));
            }
            windows = remaining;
        }
        windows.removeIf(TimeWindow::isEmpty);
        windows.sort(Comparator.comparing(TimeWindow::start));
        return DayWindows.open(date, windows);
    }

    /**
     * First rule a single requested start fails, or empty when it could be booked right now.
     */
    public Optional<UnavailabilityReason> checkRequestedSlot(ScheduleSnapshot schedule,
                                                             ServiceDefinition service,
                                                             List<Appointment> existingAppointments,
                                                             Instant requestedStart,
                                                             Instant now) {
        LocalDate date = LocalDate.ofInstant(requestedStart, schedule.zone());
        DayWindows day = openWindows(schedule, date, now);
        if (!day.isOpen()) {
            return Optional.of(day.rejection());
        }

        TimeWindow block = TimeWindow.of(requestedStart, service.blockLength());
        boolean insideWindow = day.windows().stream().anyMatch(w -> w.contains(block));
        if (!insideWindow) {
            DailyWindow hours = schedule.hoursFor(date.getDayOfWeek());
            return Optional.of(dayBounds(hours, date, schedule.zone()).contains(block)
                    ? UnavailabilityReason.RECURRING_UNAVAILABLE
                    : UnavailabilityReason.OUTSIDE_WORKING_HOURS);
        }
        if (requestedStart.isBefore(now.plus(schedule.minimumNotice()))) {
            return Optional.of(UnavailabilityReason.MINIMUM_NOTICE);
        }
        if (conflicts(schedule, block, busyIntervals(schedule, existingAppointments))) {
            return Optional.of(UnavailabilityReason.CONFLICT);
        }
        return Optional.empty();
    }

    /**
     * Local working hours of {@code date} as instants.
     */
    public TimeWindow dayBounds(DailyWindow hours, LocalDate date, ZoneId zone) {
        return resolve(date, hours.start(), hours.end(), zone);
    }

    private boolean conflicts(ScheduleSnapshot schedule, TimeWindow block, List<TimeWindow> busy) {
        TimeWindow candidate = schedule.bufferMode().candidateBusyInterval(block, schedule.buffer());
        for (TimeWindow taken : busy) {
            if (candidate.overlaps(taken)) {
                return true;
            }
        }
        return false;
    }

    private List<TimeWindow> busyIntervals(ScheduleSnapshot schedule, List<Appointment> appointments) {
        List<TimeWindow> busy = new ArrayList<>();
        for (Appointment appointment : appointments) {
            if (appointment.getStatus() == null || !appointment.getStatus().holdsCalendarTime()) {
                continue;
            }
            TimeWindow block = new TimeWindow(appointment.getScheduledStart(), appointment.getScheduledEnd());
            busy.add(schedule.bufferMode().existingBusyInterval(block, schedule.buffer()));
        }
        return busy;
    }

    private TimeWindow resolve(LocalDate date, LocalTime start, LocalTime end, ZoneId zone) {
        Instant from = ZonedDateTime.of(date, start, zone).toInstant();
        Instant to = ZonedDateTime.of(date, end, zone).toInstant();
        if (to.isBefore(from)) {
            // A DST jump can fold a short local window onto itself.
            to = from;
        }
        return new TimeWindow(from, to);
    }
}
