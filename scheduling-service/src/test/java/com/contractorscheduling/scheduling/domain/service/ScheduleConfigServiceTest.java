package com.contractorscheduling.scheduling.domain.service;

import com.contractorscheduling.common.exception.ResourceNotFoundException;
import com.contractorscheduling.scheduling.domain.model.BufferMode;
import com.contractorscheduling.scheduling.domain.model.CancellationPolicy;
import com.contractorscheduling.scheduling.domain.model.ContractorLedger;
import com.contractorscheduling.scheduling.domain.model.ContractorSchedule;
import com.contractorscheduling.scheduling.domain.model.RefundMode;
import com.contractorscheduling.scheduling.domain.model.ServiceDefinition;
import com.contractorscheduling.scheduling.domain.model.WorkingHoursEntry;
import com.contractorscheduling.scheduling.domain.repository.AppointmentRepository;
import com.contractorscheduling.scheduling.domain.repository.ContractorLedgerRepository;
import com.contractorscheduling.scheduling.domain.repository.ContractorScheduleRepository;
import com.contractorscheduling.scheduling.domain.repository.ServiceDefinitionRepository;
import com.contractorscheduling.scheduling.exception.SchedulingValidationException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.time.LocalTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static com.contractorscheduling.scheduling.domain.ScheduleFixtures.CONTRACTOR_ID;
import static com.contractorscheduling.scheduling.domain.ScheduleFixtures.SERVICE_ID;
import static com.contractorscheduling.scheduling.domain.ScheduleFixtures.service;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.BDDMockito.given;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

@ExtendWith(MockitoExtension.class)
class ScheduleConfigServiceTest {

    @Mock
    private ContractorScheduleRepository scheduleRepository;

    @Mock
    private ServiceDefinitionRepository serviceRepository;

    @Mock
    private ContractorLedgerRepository ledgerRepository;

    @Mock
    private AppointmentRepository appointmentRepository;

    @InjectMocks
    private ScheduleConfigService scheduleConfigService;

    @Test
    @DisplayName("First save creates version 1 and the contractor's ledger row")
    void saveSchedule_create() {
        // given
        given(scheduleRepository.findByContractorId(CONTRACTOR_ID)).willReturn(Optional.empty());
        given(scheduleRepository.save(any(ContractorSchedule.class))).willAnswer(inv -> inv.getArgument(0));
        given(ledgerRepository.existsById(CONTRACTOR_ID)).willReturn(false);

        // when
        ContractorSchedule saved = scheduleConfigService.saveSchedule(CONTRACTOR_ID, validSchedule());

        // then
        assertThat(saved.getConfigVersion()).isEqualTo(1L);
        assertThat(saved.getContractorId()).isEqualTo(CONTRACTOR_ID);
        ArgumentCaptor<ContractorLedger> ledger = ArgumentCaptor.forClass(ContractorLedger.class);
        verify(ledgerRepository).save(ledger.capture());
        assertThat(ledger.getValue().getContractorId()).isEqualTo(CONTRACTOR_ID);
        assertThat(ledger.getValue().getBookingSequence()).isZero();
    }

    @Test
    @DisplayName("Saving again replaces the configuration and bumps the version")
    void saveSchedule_update() {
        // given
        ContractorSchedule existing = validSchedule();
        existing.setContractorId(CONTRACTOR_ID);
        existing.setConfigVersion(3L);
        given(scheduleRepository.findByContractorId(CONTRACTOR_ID)).willReturn(Optional.of(existing));
        given(scheduleRepository.save(existing)).willReturn(existing);

        ContractorSchedule incoming = validSchedule();
        incoming.setTimezone("Europe/Berlin");
        incoming.setBufferMinutes(20);

        // when
        ContractorSchedule saved = scheduleConfigService.saveSchedule(CONTRACTOR_ID, incoming);

        // then
        assertThat(saved.getConfigVersion()).isEqualTo(4L);
        assertThat(saved.getTimezone()).isEqualTo("Europe/Berlin");
        assertThat(saved.getBufferMinutes()).isEqualTo(20);
        verify(ledgerRepository, never()).save(any());
    }

    @Test
    @DisplayName("Invalid configuration is rejected with per-field errors")
    void saveSchedule_invalid() {
        ContractorSchedule incoming = validSchedule();
        incoming.setTimezone("Mars/Olympus_Mons");
        incoming.setSlotStepMinutes(3);
        incoming.setBufferMinutes(-5);
        incoming.getCancellationPolicy().setPartialRefundPercentage(null);

        assertThatThrownBy(() -> scheduleConfigService.saveSchedule(CONTRACTOR_ID, incoming))
                .isInstanceOf(SchedulingValidationException.class)
                .satisfies(e -> assertThat(((SchedulingValidationException) e).getFieldErrors()).containsKeys(
                        "timezone", "slotStepMinutes", "bufferMinutes", "cancellationPolicy.partialRefundPercentage"));
        verify(scheduleRepository, never()).save(any());
    }

    @Test
    @DisplayName("Working hours must cover every weekday once")
    void saveSchedule_missingWeekday() {
        ContractorSchedule incoming = validSchedule();
        incoming.getWorkingHours().remove(6);

        assertThatThrownBy(() -> scheduleConfigService.saveSchedule(CONTRACTOR_ID, incoming))
                .isInstanceOf(SchedulingValidationException.class)
                .satisfies(e -> assertThat(((SchedulingValidationException) e).getFieldErrors()).containsKey("workingHours"));
    }

    @Test
    @DisplayName("Services can only be added to a contractor with a schedule")
    void addService_withoutSchedule() {
        given(scheduleRepository.findByContractorId(CONTRACTOR_ID)).willReturn(Optional.empty());

        assertThatThrownBy(() -> scheduleConfigService.addService(CONTRACTOR_ID, service(60)))
                .isInstanceOf(ResourceNotFoundException.class);
        verify(serviceRepository, never()).save(any());
    }

    @Test
    @DisplayName("Timing of a booked service is frozen")
    void updateService_timingFrozenOnceBooked() {
        // given
        given(serviceRepository.findByIdAndContractorId(SERVICE_ID, CONTRACTOR_ID)).willReturn(Optional.of(service(60)));
        given(appointmentRepository.existsByServiceId(SERVICE_ID)).willReturn(true);
        ServiceUpdate longer = new ServiceUpdate(null, null, 90, null, null, null, null, null, null);

        // when / then
        assertThatThrownBy(() -> scheduleConfigService.updateService(CONTRACTOR_ID, SERVICE_ID, longer))
                .isInstanceOf(SchedulingValidationException.class);
        verify(serviceRepository, never()).save(any());
    }

    @Test
    @DisplayName("Price of a booked service can still change")
    void updateService_priceOfBookedService() {
        // given
        ServiceDefinition existing = service(60);
        given(serviceRepository.findByIdAndContractorId(SERVICE_ID, CONTRACTOR_ID)).willReturn(Optional.of(existing));
        given(serviceRepository.save(existing)).willReturn(existing);
        ServiceUpdate cheaper = new ServiceUpdate(null, null, 60, new BigDecimal("150.00"), null, null, null, null, null);

        // when
        ServiceDefinition updated = scheduleConfigService.updateService(CONTRACTOR_ID, SERVICE_ID, cheaper);

        // then
        assertThat(updated.getPrice()).isEqualByComparingTo("150.00");
        verify(appointmentRepository, never()).existsByServiceId(any());
    }

    @Test
    @DisplayName("Inactive services cannot be booked")
    void getActiveService_inactive() {
        ServiceDefinition retired = service(60);
        retired.setActive(false);
        given(serviceRepository.findByIdAndContractorId(SERVICE_ID, CONTRACTOR_ID)).willReturn(Optional.of(retired));

        assertThatThrownBy(() -> scheduleConfigService.getActiveService(CONTRACTOR_ID, SERVICE_ID))
                .isInstanceOf(ResourceNotFoundException.class);
    }

    private static ContractorSchedule validSchedule() {
        List<WorkingHoursEntry> hours = new ArrayList<>();
        for (int day = 1; day <= 7; day++) {
            hours.add(WorkingHoursEntry.builder()
                    .dayOfWeek(day)
                    .startTime(LocalTime.of(9, 0))
                    .endTime(LocalTime.of(17, 0))
                    .enabled(day <= 5)
                    .build());
        }
        return ContractorSchedule.builder()
                .timezone("America/New_York")
                .workingHours(hours)
                .bufferMinutes(15)
                .bufferMode(BufferMode.SYMMETRIC)
                .advanceBookingDays(60)
                .minimumNoticeMinutes(120)
                .slotStepMinutes(15)
                .acceptingBookings(true)
                .depositPercentage(BigDecimal.ZERO)
                .cancellationPolicy(CancellationPolicy.builder()
                        .allowCancellation(true)
                        .cancellationDeadlineHours(24)
                        .refundMode(RefundMode.PARTIAL)
                        .partialRefundPercentage(new BigDecimal("50"))
                        .build())
                .build();
    }
}
