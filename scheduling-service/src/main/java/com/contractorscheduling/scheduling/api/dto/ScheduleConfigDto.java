package com.contractorscheduling.scheduling.api.dto;

import com.contractorscheduling.common.util.Constants;
import com.contractorscheduling.scheduling.domain.model.BufferMode;
import com.contractorscheduling.scheduling.domain.model.CancellationPolicy;
import com.contractorscheduling.scheduling.domain.model.ContractorSchedule;
import com.contractorscheduling.scheduling.domain.model.RefundMode;
import com.contractorscheduling.scheduling.domain.model.UnavailableWindowEntry;
import com.contractorscheduling.scheduling.domain.model.WorkingHoursEntry;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

import java.math.BigDecimal;
import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.LocalTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;

/**
 * Wire form of a contractor's schedule. {@code contractorId} and {@code configVersion} are
 * read-only and ignored on input.
 */
public record ScheduleConfigDto(
        Long contractorId,
        Long configVersion,

        @NotBlank(message = "Timezone cannot be blank")
        String timezone,

        @Valid
        @NotNull(message = "Working hours cannot be null")
        List<WorkingHours> workingHours,

        List<LocalDate> blackoutDates,

        @Valid
        List<UnavailableWindow> unavailableWindows,

        @NotNull(message = "Buffer minutes cannot be null")
        Integer bufferMinutes,

        BufferMode bufferMode,

        @NotNull(message = "Advance booking days cannot be null")
        Integer advanceBookingDays,

        @NotNull(message = "Minimum notice minutes cannot be null")
        Integer minimumNoticeMinutes,

        Integer slotStepMinutes,

        boolean acceptingBookings,
        boolean autoConfirmBookings,
        boolean requiresDeposit,
        BigDecimal depositPercentage,

        @Valid
        @NotNull(message = "Cancellation policy cannot be null")
        Cancellation cancellationPolicy
) {

    public record WorkingHours(
            @NotNull(message = "Day cannot be null") DayOfWeek day,
            LocalTime start,
            LocalTime end,
            boolean enabled
    ) {
    }

    public record UnavailableWindow(
            @NotNull(message = "Day cannot be null") DayOfWeek day,
            @NotNull(message = "Start cannot be null") LocalTime start,
            @NotNull(message = "End cannot be null") LocalTime end
    ) {
    }

    public record Cancellation(
            boolean allowCancellation,
            @NotNull(message = "Cancellation deadline cannot be null") Integer cancellationDeadlineHours,
            @NotNull(message = "Refund mode cannot be null") RefundMode refundMode,
            BigDecimal partialRefundPercentage
    ) {
    }

    public ContractorSchedule toEntity() {
        return ContractorSchedule.builder()
                .timezone(timezone)
                .workingHours(new ArrayList<>(workingHours.stream()
                        .map(h -> WorkingHoursEntry.builder()
                                .dayOfWeek(h.day().getValue())
                                .startTime(h.start())
                                .endTime(h.end())
                                .enabled(h.enabled())
                                .build())
                        .toList()))
                .blackoutDates(blackoutDates == null ? new HashSet<>() : new HashSet<>(blackoutDates))
                .unavailableWindows(unavailableWindows == null ? new ArrayList<>() : new ArrayList<>(unavailableWindows.stream()
                        .map(w -> UnavailableWindowEntry.builder()
                                .dayOfWeek(w.day().getValue())
                                .startTime(w.start())
                                .endTime(w.end())
                                .build())
                        .toList()))
                .bufferMinutes(bufferMinutes)
                .bufferMode(bufferMode == null ? BufferMode.SYMMETRIC : bufferMode)
                .advanceBookingDays(advanceBookingDays)
                .minimumNoticeMinutes(minimumNoticeMinutes)
                .slotStepMinutes(slotStepMinutes == null ? Constants.DEFAULT_SLOT_STEP_MINUTES : slotStepMinutes)
                .acceptingBookings(acceptingBookings)
                .autoConfirmBookings(autoConfirmBookings)
                .requiresDeposit(requiresDeposit)
                .depositPercentage(depositPercentage)
                .cancellationPolicy(CancellationPolicy.builder()
                        .allowCancellation(cancellationPolicy.allowCancellation())
                        .cancellationDeadlineHours(cancellationPolicy.cancellationDeadlineHours())
                        .refundMode(cancellationPolicy.refundMode())
                        .partialRefundPercentage(cancellationPolicy.partialRefundPercentage())
                        .build())
                .build();
    }

    public static ScheduleConfigDto from(ContractorSchedule schedule) {
        CancellationPolicy policy = schedule.getCancellationPolicy();
        return new ScheduleConfigDto(
                schedule.getContractorId(),
                schedule.getConfigVersion(),
                schedule.getTimezone(),
                schedule.getWorkingHours().stream()
                        .map(h -> new WorkingHours(DayOfWeek.of(h.getDayOfWeek()), h.getStartTime(), h.getEndTime(), h.isEnabled()))
                        .toList(),
                schedule.getBlackoutDates().stream().sorted().toList(),
                schedule.getUnavailableWindows().stream()
                        .map(w -> new UnavailableWindow(DayOfWeek.of(w.getDayOfWeek()), w.getStartTime(), w.getEndTime()))
                        .sorted(Comparator.comparing(UnavailableWindow::day).thenComparing(UnavailableWindow::start))
                        .toList(),
                schedule.getBufferMinutes(),
                schedule.getBufferMode(),
                schedule.getAdvanceBookingDays(),
                schedule.getMinimumNoticeMinutes(),
                schedule.getSlotStepMinutes(),
                schedule.isAcceptingBookings(),
                schedule.isAutoConfirmBookings(),
                schedule.isRequiresDeposit(),
                schedule.getDepositPercentage(),
                policy == null ? null : new Cancellation(
                        policy.isAllowCancellation(),
                        policy.getCancellationDeadlineHours(),
                        policy.getRefundMode(),
                        policy.getPartialRefundPercentage())
        );
    }
}
