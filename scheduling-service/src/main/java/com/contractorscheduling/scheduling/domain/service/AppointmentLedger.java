package com.contractorscheduling.scheduling.domain.service;

import com.contractorscheduling.common.exception.ResourceNotFoundException;
import com.contractorscheduling.common.exception.ServiceUnavailableException;
import com.contractorscheduling.common.util.Constants;
import com.contractorscheduling.scheduling.domain.availability.AvailabilityCalculator;
import com.contractorscheduling.scheduling.domain.availability.ScheduleSnapshot;
import com.contractorscheduling.scheduling.domain.availability.UnavailabilityReason;
import com.contractorscheduling.scheduling.domain.model.Appointment;
import com.contractorscheduling.scheduling.domain.model.AppointmentStatus;
import com.contractorscheduling.scheduling.domain.model.AppointmentStatusChange;
import com.contractorscheduling.scheduling.domain.model.PaymentStatus;
import com.contractorscheduling.scheduling.domain.model.ServiceDefinition;
import com.contractorscheduling.scheduling.domain.policy.CancellationDecision;
import com.contractorscheduling.scheduling.domain.policy.CancellationPolicyEngine;
import com.contractorscheduling.scheduling.domain.repository.AppointmentRepository;
import com.contractorscheduling.scheduling.domain.repository.AppointmentSpecifications;
import com.contractorscheduling.scheduling.domain.repository.AppointmentStatusChangeRepository;
import com.contractorscheduling.scheduling.domain.repository.ContractorScheduleRepository;
import com.contractorscheduling.scheduling.domain.strategy.BookingDraft;
import com.contractorscheduling.scheduling.domain.strategy.BookingStrategy;
import com.contractorscheduling.scheduling.events.AppointmentCancelledEvent;
import com.contractorscheduling.scheduling.events.AppointmentStatusChangedEvent;
import com.contractorscheduling.scheduling.exception.BookingHorizonViolationException;
import com.contractorscheduling.scheduling.exception.CancellationNotAllowedException;
import com.contractorscheduling.scheduling.exception.InvalidStatusTransitionException;
import com.contractorscheduling.scheduling.exception.MinimumNoticeViolationException;
import com.contractorscheduling.scheduling.exception.SchedulingValidationException;
import com.contractorscheduling.scheduling.exception.SlotUnavailableException;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.dao.TransientDataAccessException;
import org.springframework.data.domain.Sort;
import org.springframework.retry.support.RetryTemplate;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * The appointment ledger: the only component that writes appointments.
 *
 * Booking runs in two phases. A pre-check against a plain read of the ledger rejects
 * requests that obviously cannot be booked with a precise reason. The commit then goes
 * through the configured {@link BookingStrategy}, which serializes writes per contractor
 * and re-runs the same checks against the current state.
 *
 * Uses Spring's Map injection to pick the strategy (bean names):
 * - pessimistic (default): SELECT FOR UPDATE on the contractor ledger row
 * - optimistic: version-checked ledger row with retry
 * - distributed: Redisson lock per contractor
 *
 * Configuration:
 * scheduling.ledger.strategy: pessimistic | optimistic | distributed
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AppointmentLedger {

    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    private final Map<String, BookingStrategy> bookingStrategies;
    private final ScheduleConfigService scheduleConfigService;
    private final ContractorScheduleRepository scheduleRepository;
    private final AppointmentRepository appointmentRepository;
    private final AppointmentStatusChangeRepository statusChangeRepository;
    private final AvailabilityCalculator availabilityCalculator;
    private final CancellationPolicyEngine cancellationPolicyEngine;
    private final ApplicationEventPublisher eventPublisher;
    private final RetryTemplate ledgerRetryTemplate;
    private final Clock clock;

    @Value("${scheduling.ledger.strategy:pessimistic}")
    private String strategyType;

    @PostConstruct
    public void init() {
        BookingStrategy strategy = getBookingStrategy();
        log.info("Initialized AppointmentLedger with strategy: {}", strategy.getStrategyType());
    }

    /**
     * Books a slot. Replaying a request with a known idempotency key returns the appointment
     * created by the first request, whatever its current status, as long as the replay asks for
     * the same contractor, service and start.
     */
    public Appointment book(BookingCommand command) {
        validate(command);

        String key = command.idempotencyKey();
        if (hasText(key)) {
            Optional<Appointment> existing = appointmentRepository.findByIdempotencyKey(key);
            if (existing.isPresent()) {
                log.info("Idempotent replay for key {} returns appointment {}", key, existing.get().getId());
                return requireSameRequest(existing.get(), command);
            }
        }

        ScheduleSnapshot schedule = scheduleConfigService.snapshot(command.contractorId());
        ServiceDefinition service = scheduleConfigService.getActiveService(command.contractorId(), command.serviceId());
        precheck(schedule, service, command);

        BookingDraft draft = buildDraft(command, schedule, service);
        BookingStrategy strategy = getBookingStrategy();
        log.debug("Committing booking using strategy: {}", strategy.getStrategyType());

        try {
            Appointment saved = ledgerRetryTemplate.execute(context -> {
                if (context.getRetryCount() > 0) {
                    log.warn("Retrying booking commit for contractor {} (attempt {})",
                            command.contractorId(), context.getRetryCount() + 1);
                }
                return strategy.commit(draft);
            });
            if (hasText(key)) {
                // The strategy hands back the stored appointment when a concurrent replay committed first.
                requireSameRequest(saved, command);
            }
            log.info("Booked appointment {} for contractor {} at {} ({})",
                    saved.getId(), saved.getContractorId(), saved.getScheduledStart(), saved.getStatus());
            return saved;
        } catch (DataIntegrityViolationException e) {
            if (hasText(key)) {
                // A concurrent request with the same key won the unique constraint.
                Appointment winner = appointmentRepository.findByIdempotencyKey(key).orElseThrow(() -> e);
                return requireSameRequest(winner, command);
            }
            throw e;
        } catch (TransientDataAccessException e) {
            log.warn("Booking for contractor {} failed after retries: {}", command.contractorId(), e.getMessage());
            throw new ServiceUnavailableException("Booking storage is temporarily unavailable. Please retry.", e);
        }
    }

    /**
     * Cancels an appointment if the contractor's policy allows it. A denied cancellation leaves
     * the appointment untouched.
     */
    @Transactional
    public CancellationResult cancel(Long appointmentId, String requestedBy, String reason) {
        Appointment appointment = lockAppointment(appointmentId);
        requireTransition(appointment, AppointmentStatus.CANCELLED);

        ScheduleSnapshot schedule = scheduleConfigService.snapshot(appointment.getContractorId());
        Instant now = clock.instant();
        CancellationDecision decision = cancellationPolicyEngine.resolve(appointment, schedule.cancellationTerms(), now);
        if (!decision.allowed()) {
            log.warn("Cancellation of appointment {} denied: {}", appointmentId, decision.refundReason());
            throw new CancellationNotAllowedException(appointmentId, decision.refundReason());
        }

        AppointmentStatus from = appointment.getStatus();
        appointment.setStatus(AppointmentStatus.CANCELLED);
        appointment.setCancelledAt(now);
        appointment.setCancelledBy(requestedBy);
        appointment.setCancellationReason(reason);
        appointment.setRefundAmount(decision.refundAmount());
        appointment.setRefundReason(decision.refundReason());
        if (decision.refundAmount().signum() > 0) {
            appointment.setPaymentStatus(PaymentStatus.REFUND_PENDING);
        }
        recordChange(appointment, from, requestedBy, reason, now);

        eventPublisher.publishEvent(AppointmentCancelledEvent.builder()
                .appointmentId(appointment.getId())
                .contractorId(appointment.getContractorId())
                .scheduledStart(appointment.getScheduledStart())
                .cancelledBy(requestedBy)
                .reason(reason)
                .refundAmount(decision.refundAmount())
                .refundReason(decision.refundReason())
                .lateCancellation(decision.lateCancellation())
                .paymentReference(appointment.getPaymentReference())
                .timestamp(now)
                .build());
        log.info("Cancelled appointment {} (late={}, refund={})",
                appointmentId, decision.lateCancellation(), decision.refundAmount());
        return new CancellationResult(appointment, decision);
    }

    @Transactional
    public Appointment confirm(Long appointmentId, String actor, String reason) {
        return transition(appointmentId, AppointmentStatus.CONFIRMED, actor, reason);
    }

    @Transactional
    public Appointment complete(Long appointmentId, String actor, String reason) {
        return transition(appointmentId, AppointmentStatus.COMPLETED, actor, reason);
    }

    @Transactional
    public Appointment markNoShow(Long appointmentId, String actor, String reason) {
        return transition(appointmentId, AppointmentStatus.NO_SHOW, actor, reason);
    }

    /**
     * Payment service callback: the deposit was captured or it failed.
     *
     * Once a deposit is settled, later callbacks do not change it. A deposit captured after the
     * appointment was cancelled is put through the cancellation policy as of the cancellation time.
     */
    @Transactional
    public Appointment recordDepositOutcome(Long appointmentId, String paymentReference, boolean captured) {
        Appointment appointment = lockAppointment(appointmentId);
        if (!appointment.isDepositRequired()) {
            throw new SchedulingValidationException("paymentReference",
                    "Appointment " + appointmentId + " does not require a deposit");
        }
        if (appointment.getPaymentReference() != null && paymentReference != null
                && !appointment.getPaymentReference().equals(paymentReference)) {
            throw new SchedulingValidationException("paymentReference",
                    "Payment reference does not match the deposit intent of appointment " + appointmentId);
        }
        if (appointment.getPaymentReference() == null) {
            appointment.setPaymentReference(paymentReference);
        }

        PaymentStatus current = appointment.getPaymentStatus();
        if (current != PaymentStatus.DEPOSIT_PENDING && current != PaymentStatus.DEPOSIT_FAILED) {
            log.warn("Ignoring deposit outcome (captured={}) for appointment {}: payment already {}",
                    captured, appointmentId, current);
            return appointment;
        }

        appointment.setDepositPaid(captured);
        if (!captured) {
            appointment.setPaymentStatus(PaymentStatus.DEPOSIT_FAILED);
            log.info("Deposit for appointment {} failed", appointmentId);
            return appointment;
        }

        appointment.setPaymentStatus(PaymentStatus.DEPOSIT_PAID);
        if (appointment.getStatus() == AppointmentStatus.CANCELLED) {
            settleLateDeposit(appointment);
        }
        log.info("Deposit for appointment {} captured", appointmentId);
        return appointment;
    }

    @Transactional
    public Appointment attachPaymentReference(Long appointmentId, String paymentReference) {
        Appointment appointment = lockAppointment(appointmentId);
        if (appointment.getPaymentReference() == null) {
            appointment.setPaymentReference(paymentReference);
        }
        return appointment;
    }

    @Transactional(readOnly = true)
    public Appointment getAppointment(Long appointmentId) {
        return appointmentRepository.findById(appointmentId)
                .orElseThrow(() -> new ResourceNotFoundException("Appointment", appointmentId));
    }

    /**
     * Lists a contractor's appointments. Dates are interpreted in the contractor's timezone and are inclusive.
     */
    @Transactional(readOnly = true)
    public List<Appointment> listAppointments(Long contractorId, AppointmentStatus status, LocalDate startDate, LocalDate endDate) {
        if (startDate != null && endDate != null && endDate.isBefore(startDate)) {
            throw new SchedulingValidationException("endDate", "End date must not be before start date");
        }
        ZoneId zone = scheduleRepository.findByContractorId(contractorId)
                .map(s -> ZoneId.of(s.getTimezone()))
                .orElse(ZoneOffset.UTC);
        Instant from = startDate == null ? null : startDate.atStartOfDay(zone).toInstant();
        Instant to = endDate == null ? null : endDate.plusDays(1).atStartOfDay(zone).toInstant();

        return appointmentRepository.findAll(
                AppointmentSpecifications.forContractor(contractorId)
                        .and(AppointmentSpecifications.hasStatus(status))
                        .and(AppointmentSpecifications.startsAtOrAfter(from))
                        .and(AppointmentSpecifications.startsBefore(to)),
                Sort.by(Sort.Direction.ASC, "scheduledStart"));
    }

    @Transactional(readOnly = true)
    public List<AppointmentStatusChange> history(Long appointmentId) {
        getAppointment(appointmentId);
        return statusChangeRepository.findByAppointmentIdOrderByChangedAtAscIdAsc(appointmentId);
    }

    /**
     * What cancelling right now would do, without changing anything.
     */
    @Transactional(readOnly = true)
    public CancellationDecision quoteCancellation(Long appointmentId) {
        Appointment appointment = getAppointment(appointmentId);
        if (!appointment.getStatus().canTransitionTo(AppointmentStatus.CANCELLED)) {
            return new CancellationDecision(false, BigDecimal.ZERO.setScale(Constants.MONEY_SCALE),
                    "Appointment is already " + appointment.getStatus(), false, appointment.amountPaid());
        }
        ScheduleSnapshot schedule = scheduleConfigService.snapshot(appointment.getContractorId());
        return cancellationPolicyEngine.resolve(appointment, schedule.cancellationTerms(), clock.instant());
    }

    private Appointment transition(Long appointmentId, AppointmentStatus target, String actor, String reason) {
        Appointment appointment = lockAppointment(appointmentId);
        requireTransition(appointment, target);

        AppointmentStatus from = appointment.getStatus();
        Instant now = clock.instant();
        appointment.setStatus(target);
        if (target == AppointmentStatus.CONFIRMED) {
            appointment.setConfirmedAt(now);
        } else if (target == AppointmentStatus.COMPLETED) {
            appointment.setCompletedAt(now);
        }
        recordChange(appointment, from, actor, reason, now);

        eventPublisher.publishEvent(AppointmentStatusChangedEvent.builder()
                .appointmentId(appointment.getId())
                .contractorId(appointment.getContractorId())
                .fromStatus(from.name())
                .toStatus(target.name())
                .changedBy(actor)
                .reason(reason)
                .timestamp(now)
                .build());
        log.info("Appointment {} moved from {} to {}", appointmentId, from, target);
        return appointment;
    }

    private void settleLateDeposit(Appointment appointment) {
        ScheduleSnapshot schedule = scheduleConfigService.snapshot(appointment.getContractorId());
        Instant cancelledAt = appointment.getCancelledAt() != null ? appointment.getCancelledAt() : clock.instant();
        CancellationDecision decision = cancellationPolicyEngine.resolve(appointment, schedule.cancellationTerms(), cancelledAt);

        BigDecimal refund = decision.allowed() ? decision.refundAmount() : decision.amountPaid();
        String refundReason = decision.allowed()
                ? "Deposit captured after cancellation. " + decision.refundReason()
                : "Deposit captured after cancellation: full refund";
        appointment.setRefundAmount(refund);
        appointment.setRefundReason(refundReason);
        if (refund.signum() > 0) {
            appointment.setPaymentStatus(PaymentStatus.REFUND_PENDING);
        }
        log.warn("Deposit for cancelled appointment {} captured late, refund {}", appointment.getId(), refund);
    }

    private Appointment requireSameRequest(Appointment existing, BookingCommand command) {
        boolean same = Objects.equals(existing.getContractorId(), command.contractorId())
                && Objects.equals(existing.getServiceId(), command.serviceId())
                && Objects.equals(existing.getScheduledStart(), command.requestedStart());
        if (!same) {
            log.warn("Idempotency key {} reused for a different request (appointment {})",
                    command.idempotencyKey(), existing.getId());
            throw new SchedulingValidationException("idempotencyKey",
                    "Idempotency key was already used for a different booking request");
        }
        return existing;
    }

    private void requireTransition(Appointment appointment, AppointmentStatus target) {
        if (!appointment.getStatus().canTransitionTo(target)) {
            log.warn("Rejected transition of appointment {} from {} to {}",
                    appointment.getId(), appointment.getStatus(), target);
            throw new InvalidStatusTransitionException(appointment.getId(), appointment.getStatus(), target);
        }
    }

    private void recordChange(Appointment appointment, AppointmentStatus from, String actor, String reason, Instant now) {
        statusChangeRepository.save(AppointmentStatusChange.builder()
                .appointmentId(appointment.getId())
                .fromStatus(from)
                .toStatus(appointment.getStatus())
                .changedBy(actor)
                .reason(reason)
                .changedAt(now)
                .build());
    }

    private Appointment lockAppointment(Long appointmentId) {
        return appointmentRepository.findByIdWithLock(appointmentId)
                .orElseThrow(() -> new ResourceNotFoundException("Appointment", appointmentId));
    }

    private void precheck(ScheduleSnapshot schedule, ServiceDefinition service, BookingCommand command) {
        Instant start = command.requestedStart();
        Instant end = start.plus(service.blockLength());
        Duration reach = schedule.buffer().multipliedBy(2);
        List<Appointment> nearby = appointmentRepository.findIntersecting(
                command.contractorId(), AppointmentStatus.ACTIVE, start.minus(reach), end.plus(reach));

        Optional<UnavailabilityReason> failure = availabilityCalculator.checkRequestedSlot(
                schedule, service, nearby, start, clock.instant());
        if (failure.isEmpty()) {
            return;
        }
        UnavailabilityReason reason = failure.get();
        log.warn("Booking pre-check rejected contractor {} start {}: {}", command.contractorId(), start, reason);
        switch (reason) {
            case MINIMUM_NOTICE, BEFORE_TODAY -> throw new MinimumNoticeViolationException(start, schedule.minimumNotice());
            case BEYOND_HORIZON -> throw new BookingHorizonViolationException(start, schedule.advanceBookingDays());
            default -> throw new SlotUnavailableException(start, reason);
        }
    }

    private BookingDraft buildDraft(BookingCommand command, ScheduleSnapshot schedule, ServiceDefinition service) {
        boolean requiresDeposit = service.getRequiresDeposit() != null
                ? service.getRequiresDeposit()
                : schedule.requiresDeposit();
        BigDecimal percentage = service.getDepositPercentage() != null
                ? service.getDepositPercentage()
                : schedule.depositPercentage();

        BigDecimal depositAmount = BigDecimal.ZERO.setScale(Constants.MONEY_SCALE);
        if (requiresDeposit && percentage != null) {
            depositAmount = service.getPrice().multiply(percentage)
                    .divide(HUNDRED, Constants.MONEY_SCALE, RoundingMode.HALF_UP);
        }
        boolean depositRequired = requiresDeposit && depositAmount.signum() > 0;
        return new BookingDraft(command, schedule, service, depositRequired, depositAmount);
    }

    private void validate(BookingCommand command) {
        Map<String, String> errors = new LinkedHashMap<>();
        if (command.contractorId() == null) {
            errors.put("contractorId", "Contractor ID is required");
        }
        if (command.serviceId() == null) {
            errors.put("serviceId", "Service ID is required");
        }
        if (command.requestedStart() == null) {
            errors.put("start", "Start time is required");
        }
        if (command.client() == null || !command.client().identifiesClient()) {
            errors.put("clientInfo", "Either a client ID or a client name and email is required");
        }
        if (!errors.isEmpty()) {
            throw new SchedulingValidationException("Invalid booking request", errors);
        }
    }

    private BookingStrategy getBookingStrategy() {
        BookingStrategy strategy = bookingStrategies.get(strategyType);
        if (strategy == null) {
            throw new IllegalStateException("Unknown booking strategy: " + strategyType
                    + ". Available: " + bookingStrategies.keySet());
        }
        return strategy;
    }

    private static boolean hasText(String value) {
        return value != null && !value.isBlank();
    }
}
