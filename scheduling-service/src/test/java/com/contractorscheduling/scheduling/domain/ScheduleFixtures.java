package com.contractorscheduling.scheduling.domain;

import com.contractorscheduling.scheduling.domain.availability.CancellationTerms;
import com.contractorscheduling.scheduling.domain.availability.DailyWindow;
import com.contractorscheduling.scheduling.domain.availability.ScheduleSnapshot;
import com.contractorscheduling.scheduling.domain.model.Appointment;
import com.contractorscheduling.scheduling.domain.model.AppointmentStatus;
import com.contractorscheduling.scheduling.domain.model.BufferMode;
import com.contractorscheduling.scheduling.domain.model.PaymentStatus;
import com.contractorscheduling.scheduling.domain.model.RefundMode;
import com.contractorscheduling.scheduling.domain.model.ServiceDefinition;

import java.math.BigDecimal;
import java.time.DayOfWeek;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.ZoneOffset;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Shared test data: a UTC contractor working Monday to Friday, 09:00 to 17:00.
 */
public final class ScheduleFixtures {

    public static final Long CONTRACTOR_ID = 1L;
    public static final Long SERVICE_ID = 10L;

    /** Sunday. */
    public static final LocalDate SUNDAY = LocalDate.of(2026, 11, 1);
    public static final LocalDate MONDAY = LocalDate.of(2026, 11, 2);
    public static final Instant NOW = Instant.parse("2026-11-01T08:00:00Z");

    private ScheduleFixtures() {
    }

    public static ScheduleSnapshot.ScheduleSnapshotBuilder weekdaySchedule() {
        Map<DayOfWeek, DailyWindow> hours = new EnumMap<>(DayOfWeek.class);
        for (DayOfWeek day : DayOfWeek.values()) {
            boolean weekday = day != DayOfWeek.SATURDAY && day != DayOfWeek.SUNDAY;
            hours.put(day, new DailyWindow(day, LocalTime.of(9, 0), LocalTime.of(17, 0), weekday));
        }
        return ScheduleSnapshot.builder()
                .contractorId(CONTRACTOR_ID)
                .configVersion(1L)
                .zone(ZoneOffset.UTC)
                .workingHours(hours)
                .blackoutDates(Set.of())
                .recurringWindows(List.of())
                .buffer(Duration.ZERO)
                .bufferMode(BufferMode.SYMMETRIC)
                .advanceBookingDays(30)
                .minimumNotice(Duration.ZERO)
                .slotStepMinutes(15)
                .acceptingBookings(true)
                .autoConfirmBookings(false)
                .requiresDeposit(false)
                .depositPercentage(BigDecimal.ZERO)
                .cancellationTerms(new CancellationTerms(true, Duration.ofHours(24), RefundMode.PARTIAL, BigDecimal.valueOf(50)));
    }

    public static ServiceDefinition service(int durationMinutes) {
        return ServiceDefinition.builder()
                .id(SERVICE_ID)
                .contractorId(CONTRACTOR_ID)
                .name("Inspection")
                .durationMinutes(durationMinutes)
                .price(new BigDecimal("200.00"))
                .preparationMinutes(0)
                .cleanupMinutes(0)
                .active(true)
                .build();
    }

    public static Instant at(LocalDate date, int hour, int minute) {
        return date.atTime(hour, minute).toInstant(ZoneOffset.UTC);
    }

    public static Appointment appointment(Instant start, Instant end, AppointmentStatus status) {
        return Appointment.builder()
                .contractorId(CONTRACTOR_ID)
                .serviceId(SERVICE_ID)
                .serviceName("Inspection")
                .clientId(7L)
                .scheduledStart(start)
                .scheduledEnd(end)
                .status(status)
                .totalPrice(new BigDecimal("200.00"))
                .depositRequired(false)
                .depositAmount(BigDecimal.ZERO)
                .paymentStatus(PaymentStatus.NOT_REQUIRED)
                .build();
    }
}
