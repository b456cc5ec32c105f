package com.contractorscheduling.scheduling.domain.analytics;

import com.contractorscheduling.common.util.Constants;
import com.contractorscheduling.scheduling.domain.availability.AvailabilityCalculator;
import com.contractorscheduling.scheduling.domain.availability.DailyWindow;
import com.contractorscheduling.scheduling.domain.availability.ScheduleSnapshot;
import com.contractorscheduling.scheduling.domain.model.Appointment;
import com.contractorscheduling.scheduling.domain.model.AppointmentStatus;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Duration;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Folds a contractor's appointments for a date range into a {@link SchedulingSummary}.
 * Callers pass only appointments whose start falls inside the range.
 */
@Component
@RequiredArgsConstructor
public class SchedulingAnalyticsAggregator {

    private static final int RATIO_SCALE = 4;

    private final AvailabilityCalculator availabilityCalculator;

    public SchedulingSummary summarize(ScheduleSnapshot schedule,
                                       List<Appointment> appointments,
                                       LocalDate startDate,
                                       LocalDate endDate) {
        Map<AppointmentStatus, Long> counts = new EnumMap<>(AppointmentStatus.class);
        for (AppointmentStatus status : AppointmentStatus.values()) {
            counts.put(status, 0L);
        }

        long bookedMinutes = 0;
        BigDecimal completedRevenue = BigDecimal.ZERO;
        BigDecimal pendingRevenue = BigDecimal.ZERO;
        Map<Long, PerformanceTally> perService = new LinkedHashMap<>();

        for (Appointment appointment : appointments) {
            AppointmentStatus status = appointment.getStatus();
            counts.merge(status, 1L, Long::sum);
            BigDecimal price = appointment.getTotalPrice() == null ? BigDecimal.ZERO : appointment.getTotalPrice();

            if (status == AppointmentStatus.CONFIRMED || status == AppointmentStatus.COMPLETED) {
                bookedMinutes += Duration.between(appointment.getScheduledStart(), appointment.getScheduledEnd()).toMinutes();
            }
            if (status == AppointmentStatus.COMPLETED) {
                completedRevenue = completedRevenue.add(price);
            } else if (status.holdsCalendarTime()) {
                pendingRevenue = pendingRevenue.add(price);
            }

            PerformanceTally tally = perService.computeIfAbsent(appointment.getServiceId(),
                    id -> new PerformanceTally(id, appointment.getServiceName()));
            tally.add(status, price);
        }

        long workingMinutes = workingMinutes(schedule, startDate, endDate);
        long total = appointments.size();
        long completed = counts.get(AppointmentStatus.COMPLETED);

        List<ServicePerformance> performance = new ArrayList<>();
        perService.values().forEach(t -> performance.add(t.toPerformance()));
        performance.sort(Comparator.comparingLong(ServicePerformance::bookings).reversed()
                .thenComparing(ServicePerformance::serviceName, Comparator.nullsLast(Comparator.naturalOrder())));

        return new SchedulingSummary(
                schedule.contractorId(),
                startDate,
                endDate,
                total,
                counts.get(AppointmentStatus.REQUESTED),
                counts.get(AppointmentStatus.CONFIRMED),
                completed,
                counts.get(AppointmentStatus.CANCELLED),
                counts.get(AppointmentStatus.NO_SHOW),
                bookedMinutes,
                workingMinutes,
                ratio(bookedMinutes, workingMinutes),
                money(completedRevenue),
                money(completedRevenue.add(pendingRevenue)),
                ratio(completed, total),
                performance);
    }

    /**
     * Enabled working minutes over the non-blackout days of the range, resolved in the contractor's zone.
     */
    long workingMinutes(ScheduleSnapshot schedule, LocalDate startDate, LocalDate endDate) {
        long minutes = 0;
        for (LocalDate date = startDate; !date.isAfter(endDate); date = date.plusDays(1)) {
            DailyWindow hours = schedule.hoursFor(date.getDayOfWeek());
            if (!hours.isOpen() || schedule.isBlackout(date)) {
                continue;
            }
            minutes += availabilityCalculator.dayBounds(hours, date, schedule.zone()).length().toMinutes();
        }
        return minutes;
    }

    private BigDecimal ratio(long numerator, long denominator) {
        if (denominator <= 0) {
            return BigDecimal.ZERO.setScale(RATIO_SCALE, RoundingMode.HALF_UP);
        }
        return BigDecimal.valueOf(numerator).divide(BigDecimal.valueOf(denominator), RATIO_SCALE, RoundingMode.HALF_UP);
    }

    private BigDecimal money(BigDecimal amount) {
        return amount.setScale(Constants.MONEY_SCALE, RoundingMode.HALF_UP);
    }

    private static final class PerformanceTally {
        private final Long serviceId;
        private final String serviceName;
        private long bookings;
        private long completed;
        private long cancelled;
        private BigDecimal revenue = BigDecimal.ZERO;

        private PerformanceTally(Long serviceId, String serviceName) {
            this.serviceId = serviceId;
            this.serviceName = serviceName;
        }

        void add(AppointmentStatus status, BigDecimal price) {
            bookings++;
            if (status == AppointmentStatus.COMPLETED) {
                completed++;
                revenue = revenue.add(price);
            } else if (status == AppointmentStatus.CANCELLED) {
                cancelled++;
            }
        }

        ServicePerformance toPerformance() {
            return new ServicePerformance(serviceId, serviceName, bookings, completed, cancelled,
                    revenue.setScale(Constants.MONEY_SCALE, RoundingMode.HALF_UP));
        }
    }
}
