package com.contractorscheduling.scheduling.domain.service;

import com.contractorscheduling.scheduling.domain.availability.AvailabilityCalculator;
import com.contractorscheduling.scheduling.domain.availability.Slot;
import com.contractorscheduling.scheduling.domain.availability.UnavailabilityReason;
import com.contractorscheduling.scheduling.domain.model.AppointmentStatus;
import com.contractorscheduling.scheduling.domain.repository.AppointmentRepository;
import com.contractorscheduling.scheduling.exception.SchedulingValidationException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.test.util.ReflectionTestUtils;

import java.time.Clock;
import java.time.ZoneOffset;
import java.util.List;

import static com.contractorscheduling.scheduling.domain.ScheduleFixtures.CONTRACTOR_ID;
import static com.contractorscheduling.scheduling.domain.ScheduleFixtures.MONDAY;
import static com.contractorscheduling.scheduling.domain.ScheduleFixtures.NOW;
import static com.contractorscheduling.scheduling.domain.ScheduleFixtures.SERVICE_ID;
import static com.contractorscheduling.scheduling.domain.ScheduleFixtures.SUNDAY;
import static com.contractorscheduling.scheduling.domain.ScheduleFixtures.appointment;
import static com.contractorscheduling.scheduling.domain.ScheduleFixtures.at;
import static com.contractorscheduling.scheduling.domain.ScheduleFixtures.service;
import static com.contractorscheduling.scheduling.domain.ScheduleFixtures.weekdaySchedule;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.BDDMockito.given;
import static org.mockito.Mockito.verifyNoInteractions;

@ExtendWith(MockitoExtension.class)
class AvailabilityServiceTest {

    @Mock
    private ScheduleConfigService scheduleConfigService;

    @Mock
    private AppointmentRepository appointmentRepository;

    private AvailabilityService availabilityService;

    @BeforeEach
    void setUp() {
        availabilityService = new AvailabilityService(scheduleConfigService, appointmentRepository,
                new AvailabilityCalculator(), Clock.fixed(NOW, ZoneOffset.UTC));
        ReflectionTestUtils.setField(availabilityService, "maxRangeDays", 62);
    }

    @Test
    @DisplayName("Slots hide unavailable starts unless asked for them")
    void getSlots_filtersUnavailable() {
        // given
        given(scheduleConfigService.snapshot(CONTRACTOR_ID)).willReturn(weekdaySchedule().build());
        given(scheduleConfigService.getActiveService(CONTRACTOR_ID, SERVICE_ID)).willReturn(service(60));
        given(appointmentRepository.findIntersecting(eq(CONTRACTOR_ID), eq(AppointmentStatus.ACTIVE),
                eq(at(SUNDAY, 0, 0)), eq(at(MONDAY.plusDays(2), 0, 0))))
                .willReturn(List.of(appointment(at(MONDAY, 9, 0), at(MONDAY, 10, 0), AppointmentStatus.CONFIRMED)));

        // when
        List<Slot> open = availabilityService.getSlots(CONTRACTOR_ID, SERVICE_ID, MONDAY, false);
        List<Slot> all = availabilityService.getSlots(CONTRACTOR_ID, SERVICE_ID, MONDAY, true);

        // then
        assertThat(open).allMatch(Slot::available);
        assertThat(open.get(0).start()).isEqualTo(at(MONDAY, 10, 0));
        assertThat(all).hasSize(29);
    }

    @Test
    @DisplayName("Range summary reports each day's windows and, given a service, its free slots")
    void summarize_week() {
        // given
        given(scheduleConfigService.snapshot(CONTRACTOR_ID)).willReturn(weekdaySchedule().build());
        given(scheduleConfigService.getActiveService(CONTRACTOR_ID, SERVICE_ID)).willReturn(service(60));
        given(appointmentRepository.findIntersecting(eq(CONTRACTOR_ID), eq(AppointmentStatus.ACTIVE),
                eq(at(SUNDAY, 0, 0)), eq(at(MONDAY.plusDays(7), 0, 0))))
                .willReturn(List.of());

        // when
        List<AvailabilityDay> days = availabilityService.summarize(CONTRACTOR_ID, MONDAY, MONDAY.plusDays(5), SERVICE_ID);

        // then
        assertThat(days).hasSize(6);
        assertThat(days.get(0).open()).isTrue();
        assertThat(days.get(0).availableSlots()).isEqualTo(29);
        assertThat(days.get(5).open()).isFalse();
        assertThat(days.get(5).reason()).isEqualTo(UnavailabilityReason.CLOSED);
        assertThat(days.get(5).availableSlots()).isZero();
    }

    @Test
    @DisplayName("Range summary without a service skips slot counting")
    void summarize_withoutService() {
        given(scheduleConfigService.snapshot(CONTRACTOR_ID)).willReturn(weekdaySchedule().build());

        List<AvailabilityDay> days = availabilityService.summarize(CONTRACTOR_ID, MONDAY, MONDAY, null);

        assertThat(days.get(0).availableSlots()).isNull();
        assertThat(days.get(0).windows()).hasSize(1);
        verifyNoInteractions(appointmentRepository);
    }

    @Test
    @DisplayName("Reversed or oversized ranges are rejected")
    void summarize_invalidRange() {
        assertThatThrownBy(() -> availabilityService.summarize(CONTRACTOR_ID, MONDAY, MONDAY.minusDays(1), null))
                .isInstanceOf(SchedulingValidationException.class);
        assertThatThrownBy(() -> availabilityService.summarize(CONTRACTOR_ID, MONDAY, MONDAY.plusDays(62), null))
                .isInstanceOf(SchedulingValidationException.class);
        verifyNoInteractions(scheduleConfigService);
    }
}
