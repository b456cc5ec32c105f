package com.contractorscheduling.scheduling.domain.service;

import com.contractorscheduling.scheduling.domain.availability.AvailabilityCalculator;
import com.contractorscheduling.scheduling.domain.availability.DayWindows;
import com.contractorscheduling.scheduling.domain.availability.ScheduleSnapshot;
import com.contractorscheduling.scheduling.domain.availability.Slot;
import com.contractorscheduling.scheduling.domain.model.Appointment;
import com.contractorscheduling.scheduling.domain.model.AppointmentStatus;
import com.contractorscheduling.scheduling.domain.model.ServiceDefinition;
import com.contractorscheduling.scheduling.domain.repository.AppointmentRepository;
import com.contractorscheduling.scheduling.exception.SchedulingValidationException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;

/**
 * Loads the inputs the calculator needs (schedule snapshot, service, nearby appointments)
 * and runs it. Never writes.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AvailabilityService {

    private final ScheduleConfigService scheduleConfigService;
    private final AppointmentRepository appointmentRepository;
    private final AvailabilityCalculator availabilityCalculator;
    private final Clock clock;

    @Value("${scheduling.availability.max-range-days:62}")
    private int maxRangeDays;

    @Transactional(readOnly = true)
    public List<Slot> getSlots(Long contractorId, Long serviceId, LocalDate date, boolean includeUnavailable) {
        ScheduleSnapshot schedule = scheduleConfigService.snapshot(contractorId);
        ServiceDefinition service = scheduleConfigService.getActiveService(contractorId, serviceId);

        List<Slot> slots = availabilityCalculator.computeAvailability(
                schedule, service, appointmentsAround(schedule, date, date), date, date, clock.instant());
        log.debug("Computed {} slots for contractor {} service {} on {}", slots.size(), contractorId, serviceId, date);

        return includeUnavailable ? slots : slots.stream().filter(Slot::available).toList();
    }

    @Transactional(readOnly = true)
    public List<AvailabilityDay> summarize(Long contractorId, LocalDate startDate, LocalDate endDate, Long serviceId) {
        if (endDate.isBefore(startDate)) {
            throw new SchedulingValidationException("endDate", "End date must not be before start date");
        }
        if (ChronoUnit.DAYS.between(startDate, endDate) >= maxRangeDays) {
            throw new SchedulingValidationException("endDate", "Range may span at most " + maxRangeDays + " days");
        }

        ScheduleSnapshot schedule = scheduleConfigService.snapshot(contractorId);
        ServiceDefinition service = serviceId == null ? null : scheduleConfigService.getActiveService(contractorId, serviceId);
        Instant now = clock.instant();
        List<Appointment> appointments = service == null ? List.of() : appointmentsAround(schedule, startDate, endDate);

        List<AvailabilityDay> days = new ArrayList<>();
        for (LocalDate date = startDate; !date.isAfter(endDate); date = date.plusDays(1)) {
            DayWindows windows = availabilityCalculator.openWindows(schedule, date, now);
            Integer available = null;
            if (service != null) {
                available = windows.isOpen()
                        ? (int) availabilityCalculator.computeAvailability(schedule, service, appointments, date, date, now)
                                .stream().filter(Slot::available).count()
                        : 0;
            }
            days.add(new AvailabilityDay(date, windows.isOpen(), windows.rejection(), windows.windows(), available));
        }
        return days;
    }

    /**
     * Active appointments that can touch the given days, including ones that cross midnight at either edge.
     */
    private List<Appointment> appointmentsAround(ScheduleSnapshot schedule, LocalDate from, LocalDate to) {
        ZoneId zone = schedule.zone();
        Instant rangeStart = from.minusDays(1).atStartOfDay(zone).toInstant();
        Instant rangeEnd = to.plusDays(2).atStartOfDay(zone).toInstant();
        return appointmentRepository.findIntersecting(schedule.contractorId(), AppointmentStatus.ACTIVE, rangeStart, rangeEnd);
    }
}
