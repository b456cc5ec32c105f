package com.contractorscheduling.scheduling.domain.service;

import com.contractorscheduling.scheduling.domain.analytics.SchedulingAnalyticsAggregator;
import com.contractorscheduling.scheduling.domain.analytics.SchedulingSummary;
import com.contractorscheduling.scheduling.domain.availability.ScheduleSnapshot;
import com.contractorscheduling.scheduling.domain.model.Appointment;
import com.contractorscheduling.scheduling.domain.repository.AppointmentRepository;
import com.contractorscheduling.scheduling.exception.SchedulingValidationException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.List;

@Slf4j
@Service
@RequiredArgsConstructor
public class SchedulingAnalyticsService {

    private final ScheduleConfigService scheduleConfigService;
    private final AppointmentRepository appointmentRepository;
    private final SchedulingAnalyticsAggregator aggregator;

    @Value("${scheduling.availability.max-range-days:62}")
    private int maxRangeDays;

    @Transactional(readOnly = true)
    public SchedulingSummary summarize(Long contractorId, LocalDate startDate, LocalDate endDate) {
        if (endDate.isBefore(startDate)) {
            throw new SchedulingValidationException("endDate", "End date must not be before start date");
        }
        if (ChronoUnit.DAYS.between(startDate, endDate) >= maxRangeDays) {
            throw new SchedulingValidationException("endDate", "Range may span at most " + maxRangeDays + " days");
        }
        ScheduleSnapshot schedule = scheduleConfigService.snapshot(contractorId);
        Instant from = startDate.atStartOfDay(schedule.zone()).toInstant();
        Instant to = endDate.plusDays(1).atStartOfDay(schedule.zone()).toInstant();

        List<Appointment> appointments = appointmentRepository
                .findByContractorIdAndScheduledStartGreaterThanEqualAndScheduledStartLessThanOrderByScheduledStartAsc(
                        contractorId, from, to);
        log.debug("Summarizing {} appointments for contractor {} between {} and {}",
                appointments.size(), contractorId, startDate, endDate);
        return aggregator.summarize(schedule, appointments, startDate, endDate);
    }
}
