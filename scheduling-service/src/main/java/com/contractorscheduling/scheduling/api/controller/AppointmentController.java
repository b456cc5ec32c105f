package com.contractorscheduling.scheduling.api.controller;

import com.contractorscheduling.common.dto.BaseResponse;
import com.contractorscheduling.scheduling.api.dto.AppointmentActionRequest;
import com.contractorscheduling.scheduling.api.dto.AppointmentResponse;
import com.contractorscheduling.scheduling.api.dto.AppointmentTransitionResponse;
import com.contractorscheduling.scheduling.api.dto.CancellationQuoteResponse;
import com.contractorscheduling.scheduling.api.dto.CreateAppointmentRequest;
import com.contractorscheduling.scheduling.api.dto.DepositOutcomeRequest;
import com.contractorscheduling.scheduling.api.dto.StatusChangeResponse;
import com.contractorscheduling.scheduling.domain.model.Appointment;
import com.contractorscheduling.scheduling.domain.model.AppointmentStatus;
import com.contractorscheduling.scheduling.domain.service.AppointmentLedger;
import com.contractorscheduling.scheduling.domain.service.BookingCommand;
import com.contractorscheduling.scheduling.domain.service.CancellationResult;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.LocalDate;
import java.util.List;

/**
 * REST controller for the appointment ledger: booking, status transitions, deposit callbacks and reads.
 */
@RestController
@RequestMapping("/api/v1/appointments")
@RequiredArgsConstructor
public class AppointmentController {

    private final AppointmentLedger appointmentLedger;

    @PostMapping
    public ResponseEntity<BaseResponse<AppointmentResponse>> bookAppointment(
            @Valid @RequestBody CreateAppointmentRequest request) {
        Appointment appointment = appointmentLedger.book(new BookingCommand(
                request.contractorId(),
                request.serviceId(),
                request.start(),
                request.clientInfo().toDetails(),
                request.idempotencyKey(),
                request.requestedBy()));
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(BaseResponse.success("Appointment booked successfully", AppointmentResponse.from(appointment)));
    }

    @GetMapping("/{id}")
    public ResponseEntity<BaseResponse<AppointmentResponse>> getAppointment(@PathVariable Long id) {
        return ResponseEntity.ok(BaseResponse.success(AppointmentResponse.from(appointmentLedger.getAppointment(id))));
    }

    @GetMapping
    public ResponseEntity<BaseResponse<List<AppointmentResponse>>> listAppointments(
            @RequestParam Long contractorId,
            @RequestParam(required = false) AppointmentStatus status,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate startDate,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate endDate) {
        List<AppointmentResponse> response = appointmentLedger.listAppointments(contractorId, status, startDate, endDate)
                .stream()
                .map(AppointmentResponse::from)
                .toList();
        return ResponseEntity.ok(BaseResponse.success(response));
    }

    @PatchMapping("/{id}")
    public ResponseEntity<BaseResponse<AppointmentTransitionResponse>> updateStatus(
            @PathVariable Long id,
            @Valid @RequestBody AppointmentActionRequest request) {
        AppointmentTransitionResponse response = switch (request.action()) {
            case CANCEL -> {
                CancellationResult result = appointmentLedger.cancel(id, request.requestedBy(), request.reason());
                yield new AppointmentTransitionResponse(
                        AppointmentResponse.from(result.appointment()),
                        CancellationQuoteResponse.from(result.decision()));
            }
            case CONFIRM -> transitioned(appointmentLedger.confirm(id, request.requestedBy(), request.reason()));
            case COMPLETE -> transitioned(appointmentLedger.complete(id, request.requestedBy(), request.reason()));
            case NO_SHOW -> transitioned(appointmentLedger.markNoShow(id, request.requestedBy(), request.reason()));
        };
        return ResponseEntity.ok(BaseResponse.success("Appointment updated", response));
    }

    @GetMapping("/{id}/cancellation-quote")
    public ResponseEntity<BaseResponse<CancellationQuoteResponse>> quoteCancellation(@PathVariable Long id) {
        return ResponseEntity.ok(BaseResponse.success(
                CancellationQuoteResponse.from(appointmentLedger.quoteCancellation(id))));
    }

    @GetMapping("/{id}/history")
    public ResponseEntity<BaseResponse<List<StatusChangeResponse>>> getHistory(@PathVariable Long id) {
        List<StatusChangeResponse> response = appointmentLedger.history(id).stream()
                .map(StatusChangeResponse::from)
                .toList();
        return ResponseEntity.ok(BaseResponse.success(response));
    }

    @PostMapping("/{id}/deposit")
    public ResponseEntity<BaseResponse<AppointmentResponse>> recordDepositOutcome(
            @PathVariable Long id,
            @Valid @RequestBody DepositOutcomeRequest request) {
        Appointment appointment = appointmentLedger.recordDepositOutcome(id, request.paymentReference(), request.captured());
        return ResponseEntity.ok(BaseResponse.success("Deposit outcome recorded", AppointmentResponse.from(appointment)));
    }

    private AppointmentTransitionResponse transitioned(Appointment appointment) {
        return new AppointmentTransitionResponse(AppointmentResponse.from(appointment), null);
    }
}
