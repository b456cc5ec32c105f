package com.contractorscheduling.scheduling.domain.model;

import com.contractorscheduling.scheduling.domain.availability.CancellationTerms;
import com.contractorscheduling.scheduling.domain.availability.DailyWindow;
import com.contractorscheduling.scheduling.domain.availability.RecurringWindow;
import com.contractorscheduling.scheduling.domain.availability.ScheduleSnapshot;
import jakarta.persistence.*;
import org.hibernate.annotations.Fetch;
import org.hibernate.annotations.FetchMode;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.math.BigDecimal;
import java.time.DayOfWeek;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * A contractor's scheduling rules. One row per contractor; every save bumps {@code configVersion}.
 */
@Entity
@Table(name = "contractor_schedules")
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ContractorSchedule {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "contractor_id", nullable = false, unique = true)
    private Long contractorId;

    @Column(name = "timezone", nullable = false, length = 64)
    private String timezone;

    @Builder.Default
    @ElementCollection(fetch = FetchType.EAGER)
    @Fetch(FetchMode.SELECT)
    @CollectionTable(name = "schedule_working_hours", joinColumns = @JoinColumn(name = "schedule_id"))
    @OrderBy("dayOfWeek ASC")
    private List<WorkingHoursEntry> workingHours = new ArrayList<>();

    @Builder.Default
    @ElementCollection(fetch = FetchType.EAGER)
    @Fetch(FetchMode.SELECT)
    @CollectionTable(name = "schedule_blackout_dates", joinColumns = @JoinColumn(name = "schedule_id"))
    @Column(name = "blackout_date", nullable = false)
    private Set<LocalDate> blackoutDates = new HashSet<>();

    @Builder.Default
    @ElementCollection(fetch = FetchType.EAGER)
    @Fetch(FetchMode.SELECT)
    @CollectionTable(name = "schedule_unavailable_windows", joinColumns = @JoinColumn(name = "schedule_id"))
    private List<UnavailableWindowEntry> unavailableWindows = new ArrayList<>();

    @Column(name = "buffer_minutes", nullable = false)
    private Integer bufferMinutes;

    @Enumerated(EnumType.STRING)
    @Column(name = "buffer_mode", nullable = false, length = 20)
    private BufferMode bufferMode;

    @Column(name = "advance_booking_days", nullable = false)
    private Integer advanceBookingDays;

    @Column(name = "minimum_notice_minutes", nullable = false)
    private Integer minimumNoticeMinutes;

    @Column(name = "slot_step_minutes", nullable = false)
    private Integer slotStepMinutes;

    @Column(name = "accepting_bookings", nullable = false)
    private boolean acceptingBookings;

    @Column(name = "auto_confirm_bookings", nullable = false)
    private boolean autoConfirmBookings;

    @Column(name = "requires_deposit", nullable = false)
    private boolean requiresDeposit;

    @Column(name = "deposit_percentage", precision = 5, scale = 2)
    private BigDecimal depositPercentage;

    @Embedded
    private CancellationPolicy cancellationPolicy;

    @Column(name = "config_version", nullable = false)
    private Long configVersion;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    @Column(name = "updated_at")
    private Instant updatedAt;

    @PrePersist
    protected void onCreate() {
        createdAt = Instant.now();
        updatedAt = createdAt;
        if (configVersion == null) {
            configVersion = 1L;
        }
    }

    @PreUpdate
    protected void onUpdate() {
        updatedAt = Instant.now();
    }

    /**
     * Copies the persistent state into an immutable value that can be handed to the calculator,
     * the ledger and the policy engine without further database access.
     */
    public ScheduleSnapshot toSnapshot() {
        Map<DayOfWeek, DailyWindow> hours = new EnumMap<>(DayOfWeek.class);
        for (WorkingHoursEntry entry : workingHours) {
            DayOfWeek day = DayOfWeek.of(entry.getDayOfWeek());
            hours.put(day, new DailyWindow(day, entry.getStartTime(), entry.getEndTime(), entry.isEnabled()));
        }
        List<RecurringWindow> recurring = unavailableWindows.stream()
                .map(w -> new RecurringWindow(DayOfWeek.of(w.getDayOfWeek()), w.getStartTime(), w.getEndTime()))
                .toList();
        CancellationPolicy policy = cancellationPolicy != null ? cancellationPolicy : CancellationPolicy.defaults();

        return ScheduleSnapshot.builder()
                .contractorId(contractorId)
                .configVersion(configVersion == null ? 0L : configVersion)
                .zone(ZoneId.of(timezone))
                .workingHours(hours)
                .blackoutDates(Set.copyOf(blackoutDates))
                .recurringWindows(recurring)
                .buffer(Duration.ofMinutes(bufferMinutes))
                .bufferMode(bufferMode)
                .advanceBookingDays(advanceBookingDays)
                .minimumNotice(Duration.ofMinutes(minimumNoticeMinutes))
                .slotStepMinutes(slotStepMinutes)
                .acceptingBookings(acceptingBookings)
                .autoConfirmBookings(autoConfirmBookings)
                .requiresDeposit(requiresDeposit)
                .depositPercentage(depositPercentage == null ? BigDecimal.ZERO : depositPercentage)
                .cancellationTerms(new CancellationTerms(
                        policy.isAllowCancellation(),
                        Duration.ofHours(policy.getCancellationDeadlineHours()),
                        policy.getRefundMode(),
                        policy.getPartialRefundPercentage()))
                .build();
    }
}
