package com.contractorscheduling.scheduling.domain.service;

import com.contractorscheduling.common.exception.ResourceNotFoundException;
import com.contractorscheduling.scheduling.domain.availability.ScheduleSnapshot;
import com.contractorscheduling.scheduling.domain.model.CancellationPolicy;
import com.contractorscheduling.scheduling.domain.model.ContractorLedger;
import com.contractorscheduling.scheduling.domain.model.ContractorSchedule;
import com.contractorscheduling.scheduling.domain.model.RefundMode;
import com.contractorscheduling.scheduling.domain.model.ServiceDefinition;
import com.contractorscheduling.scheduling.domain.model.UnavailableWindowEntry;
import com.contractorscheduling.scheduling.domain.model.WorkingHoursEntry;
import com.contractorscheduling.scheduling.domain.repository.AppointmentRepository;
import com.contractorscheduling.scheduling.domain.repository.ContractorLedgerRepository;
import com.contractorscheduling.scheduling.domain.repository.ContractorScheduleRepository;
import com.contractorscheduling.scheduling.domain.repository.ServiceDefinitionRepository;
import com.contractorscheduling.scheduling.exception.SchedulingValidationException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.DateTimeException;
import java.time.DayOfWeek;
import java.time.ZoneId;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Stores contractor schedules and service definitions.
 *
 * Saving a schedule replaces it wholesale and bumps its {@code configVersion}. The first save
 * also creates the contractor's ledger row, which every booking strategy locks or version-checks.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ScheduleConfigService {

    private static final int MIN_STEP_MINUTES = 5;
    private static final int MAX_STEP_MINUTES = 240;
    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    private final ContractorScheduleRepository scheduleRepository;
    private final ServiceDefinitionRepository serviceRepository;
    private final ContractorLedgerRepository ledgerRepository;
    private final AppointmentRepository appointmentRepository;

    @Transactional(readOnly = true)
    public ContractorSchedule getSchedule(Long contractorId) {
        return scheduleRepository.findByContractorId(contractorId)
                .orElseThrow(() -> new ResourceNotFoundException("Schedule for contractor", contractorId));
    }

    @Transactional(readOnly = true)
    public ScheduleSnapshot snapshot(Long contractorId) {
        return getSchedule(contractorId).toSnapshot();
    }

    @Transactional
    public ContractorSchedule saveSchedule(Long contractorId, ContractorSchedule incoming) {
        validateSchedule(incoming);

        ContractorSchedule schedule = scheduleRepository.findByContractorId(contractorId).orElse(null);
        if (schedule == null) {
            incoming.setId(null);
            incoming.setContractorId(contractorId);
            incoming.setConfigVersion(1L);
            schedule = scheduleRepository.save(incoming);
            if (!ledgerRepository.existsById(contractorId)) {
                ledgerRepository.save(ContractorLedger.builder()
                        .contractorId(contractorId)
                        .bookingSequence(0L)
                        .build());
            }
            log.info("Created schedule for contractor {}", contractorId);
            return schedule;
        }

        schedule.setTimezone(incoming.getTimezone());
        schedule.getWorkingHours().clear();
        schedule.getWorkingHours().addAll(incoming.getWorkingHours());
        schedule.getBlackoutDates().clear();
        schedule.getBlackoutDates().addAll(incoming.getBlackoutDates());
        schedule.getUnavailableWindows().clear();
        schedule.getUnavailableWindows().addAll(incoming.getUnavailableWindows());
        schedule.setBufferMinutes(incoming.getBufferMinutes());
        schedule.setBufferMode(incoming.getBufferMode());
        schedule.setAdvanceBookingDays(incoming.getAdvanceBookingDays());
        schedule.setMinimumNoticeMinutes(incoming.getMinimumNoticeMinutes());
        schedule.setSlotStepMinutes(incoming.getSlotStepMinutes());
        schedule.setAcceptingBookings(incoming.isAcceptingBookings());
        schedule.setAutoConfirmBookings(incoming.isAutoConfirmBookings());
        schedule.setRequiresDeposit(incoming.isRequiresDeposit());
        schedule.setDepositPercentage(incoming.getDepositPercentage());
        schedule.setCancellationPolicy(incoming.getCancellationPolicy());
        schedule.setConfigVersion(schedule.getConfigVersion() + 1);

        log.info("Updated schedule for contractor {} to version {}", contractorId, schedule.getConfigVersion());
        return scheduleRepository.save(schedule);
    }

    @Transactional(readOnly = true)
    public List<ServiceDefinition> listServices(Long contractorId, boolean activeOnly) {
        return activeOnly
                ? serviceRepository.findByContractorIdAndActiveTrueOrderByNameAsc(contractorId)
                : serviceRepository.findByContractorIdOrderByNameAsc(contractorId);
    }

    @Transactional(readOnly = true)
    public ServiceDefinition getActiveService(Long contractorId, Long serviceId) {
        return serviceRepository.findByIdAndContractorId(serviceId, contractorId)
                .filter(ServiceDefinition::isActive)
                .orElseThrow(() -> new ResourceNotFoundException("Active service", serviceId));
    }

    @Transactional
    public ServiceDefinition addService(Long contractorId, ServiceDefinition definition) {
        getSchedule(contractorId);
        validateService(definition);
        definition.setId(null);
        definition.setContractorId(contractorId);
        ServiceDefinition saved = serviceRepository.save(definition);
        log.info("Added service {} ({}) for contractor {}", saved.getId(), saved.getName(), contractorId);
        return saved;
    }

    /**
     * Applies a partial edit. Timing fields are frozen once any appointment references the service,
     * because booked appointments keep the block length they were booked with.
     */
    @Transactional
    public ServiceDefinition updateService(Long contractorId, Long serviceId, ServiceUpdate update) {
        ServiceDefinition service = serviceRepository.findByIdAndContractorId(serviceId, contractorId)
                .orElseThrow(() -> new ResourceNotFoundException("Service", serviceId));

        if (update.changesTiming() && timingDiffers(service, update) && appointmentRepository.existsByServiceId(serviceId)) {
            throw new SchedulingValidationException("durationMinutes",
                    "Duration, preparation and cleanup cannot change once the service has been booked");
        }

        if (update.name() != null) {
            service.setName(update.name());
        }
        if (update.description() != null) {
            service.setDescription(update.description());
        }
        if (update.price() != null) {
            service.setPrice(update.price());
        }
        if (update.durationMinutes() != null) {
            service.setDurationMinutes(update.durationMinutes());
        }
        if (update.preparationMinutes() != null) {
            service.setPreparationMinutes(update.preparationMinutes());
        }
        if (update.cleanupMinutes() != null) {
            service.setCleanupMinutes(update.cleanupMinutes());
        }
        if (update.requiresDeposit() != null) {
            service.setRequiresDeposit(update.requiresDeposit());
        }
        if (update.depositPercentage() != null) {
            service.setDepositPercentage(update.depositPercentage());
        }
        if (update.active() != null) {
            service.setActive(update.active());
        }
        validateService(service);

        log.info("Updated service {} for contractor {}", serviceId, contractorId);
        return serviceRepository.save(service);
    }

    private boolean timingDiffers(ServiceDefinition service, ServiceUpdate update) {
        return (update.durationMinutes() != null && !update.durationMinutes().equals(service.getDurationMinutes()))
                || (update.preparationMinutes() != null && !update.preparationMinutes().equals(service.getPreparationMinutes()))
                || (update.cleanupMinutes() != null && !update.cleanupMinutes().equals(service.getCleanupMinutes()));
    }

    void validateSchedule(ContractorSchedule schedule) {
        Map<String, String> errors = new LinkedHashMap<>();

        if (schedule.getTimezone() == null) {
            errors.put("timezone", "Timezone is required");
        } else {
            try {
                ZoneId.of(schedule.getTimezone());
            } catch (DateTimeException e) {
                errors.put("timezone", "Unknown timezone: " + schedule.getTimezone());
            }
        }

        validateWorkingHours(schedule.getWorkingHours(), errors);

        List<UnavailableWindowEntry> windows = schedule.getUnavailableWindows() == null
                ? List.of() : schedule.getUnavailableWindows();
        for (int i = 0; i < windows.size(); i++) {
            UnavailableWindowEntry window = windows.get(i);
            if (window.getDayOfWeek() == null || window.getDayOfWeek() < 1 || window.getDayOfWeek() > 7) {
                errors.put("unavailableWindows[" + i + "].dayOfWeek", "Day of week must be between 1 and 7");
            }
            if (window.getStartTime() == null || window.getEndTime() == null
                    || !window.getStartTime().isBefore(window.getEndTime())) {
                errors.put("unavailableWindows[" + i + "]", "Start must be before end");
            }
        }

        requireNonNegative(schedule.getBufferMinutes(), "bufferMinutes", errors);
        requireNonNegative(schedule.getMinimumNoticeMinutes(), "minimumNoticeMinutes", errors);
        requireNonNegative(schedule.getAdvanceBookingDays(), "advanceBookingDays", errors);
        if (schedule.getBufferMode() == null) {
            errors.put("bufferMode", "Buffer mode is required");
        }

        Integer step = schedule.getSlotStepMinutes();
        if (step == null || step < MIN_STEP_MINUTES || step > MAX_STEP_MINUTES) {
            errors.put("slotStepMinutes", "Slot step must be between " + MIN_STEP_MINUTES + " and " + MAX_STEP_MINUTES + " minutes");
        }

        if (schedule.isRequiresDeposit() && schedule.getDepositPercentage() == null) {
            errors.put("depositPercentage", "Deposit percentage is required when deposits are required");
        }
        requirePercentage(schedule.getDepositPercentage(), "depositPercentage", errors);

        CancellationPolicy policy = schedule.getCancellationPolicy();
        if (policy == null) {
            errors.put("cancellationPolicy", "Cancellation policy is required");
        } else {
            requireNonNegative(policy.getCancellationDeadlineHours(), "cancellationPolicy.cancellationDeadlineHours", errors);
            if (policy.getRefundMode() == null) {
                errors.put("cancellationPolicy.refundMode", "Refund mode is required");
            } else if (policy.getRefundMode() == RefundMode.PARTIAL && policy.getPartialRefundPercentage() == null) {
                errors.put("cancellationPolicy.partialRefundPercentage", "Partial refunds need a percentage");
            }
            requirePercentage(policy.getPartialRefundPercentage(), "cancellationPolicy.partialRefundPercentage", errors);
        }

        if (!errors.isEmpty()) {
            throw new SchedulingValidationException("Invalid schedule configuration", errors);
        }
    }

    private void validateWorkingHours(List<WorkingHoursEntry> hours, Map<String, String> errors) {
        if (hours == null || hours.size() != 7) {
            errors.put("workingHours", "Exactly 7 weekday entries are required");
            return;
        }
        Set<Integer> seen = new HashSet<>();
        for (WorkingHoursEntry entry : hours) {
            Integer day = entry.getDayOfWeek();
            if (day == null || day < 1 || day > 7 || !seen.add(day)) {
                errors.put("workingHours", "Weekday entries must cover Monday to Sunday exactly once");
                continue;
            }
            if (entry.isEnabled() && (entry.getStartTime() == null || entry.getEndTime() == null
                    || !entry.getStartTime().isBefore(entry.getEndTime()))) {
                errors.put("workingHours." + DayOfWeek.of(day), "Enabled days need a start before the end");
            }
        }
    }

    void validateService(ServiceDefinition service) {
        Map<String, String> errors = new LinkedHashMap<>();
        if (service.getName() == null || service.getName().isBlank()) {
            errors.put("name", "Name is required");
        }
        if (service.getDurationMinutes() == null || service.getDurationMinutes() <= 0) {
            errors.put("durationMinutes", "Duration must be positive");
        }
        requireNonNegative(service.getPreparationMinutes(), "preparationMinutes", errors);
        requireNonNegative(service.getCleanupMinutes(), "cleanupMinutes", errors);
        if (service.getPrice() == null || service.getPrice().signum() < 0) {
            errors.put("price", "Price must be zero or more");
        }
        requirePercentage(service.getDepositPercentage(), "depositPercentage", errors);
        if (!errors.isEmpty()) {
            throw new SchedulingValidationException("Invalid service definition", errors);
        }
    }

    private void requireNonNegative(Integer value, String field, Map<String, String> errors) {
        if (value == null || value < 0) {
            errors.put(field, "Must be zero or more");
        }
    }

    private void requirePercentage(BigDecimal value, String field, Map<String, String> errors) {
        if (value != null && (value.signum() < 0 || value.compareTo(HUNDRED) > 0)) {
            errors.put(field, "Percentage must be between 0 and 100");
        }
    }
}
