package com.contractorscheduling.scheduling.api.exception;

import com.contractorscheduling.common.dto.BaseResponse;
import com.contractorscheduling.common.exception.BusinessException;
import com.contractorscheduling.common.exception.ServiceUnavailableException;
import com.contractorscheduling.scheduling.exception.BookingConflictException;
import com.contractorscheduling.scheduling.exception.BookingHorizonViolationException;
import com.contractorscheduling.scheduling.exception.CancellationNotAllowedException;
import com.contractorscheduling.scheduling.exception.InvalidStatusTransitionException;
import com.contractorscheduling.scheduling.exception.MinimumNoticeViolationException;
import com.contractorscheduling.scheduling.exception.SchedulingValidationException;
import com.contractorscheduling.scheduling.exception.SlotUnavailableException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.dao.TransientDataAccessException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.Map;

/**
 * Status codes for scheduling rule violations. Anything not handled here falls through
 * to the common GlobalExceptionHandler.
 */
@Slf4j
@RestControllerAdvice
@Order(Ordered.HIGHEST_PRECEDENCE)
public class SchedulingExceptionHandler {

    @ExceptionHandler(SchedulingValidationException.class)
    public ResponseEntity<BaseResponse<Map<String, String>>> handleValidation(SchedulingValidationException ex) {
        log.warn("Validation failed: {} {}", ex.getMessage(), ex.getFieldErrors());
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(BaseResponse.error(ex.getMessage(), ex.getErrorCode(), ex.getFieldErrors()));
    }

    @ExceptionHandler(SlotUnavailableException.class)
    public ResponseEntity<BaseResponse<Map<String, String>>> handleSlotUnavailable(SlotUnavailableException ex) {
        log.warn("Slot unavailable: {}", ex.getMessage());
        return ResponseEntity.status(HttpStatus.CONFLICT)
                .body(BaseResponse.error(ex.getMessage(), ex.getErrorCode(), Map.of("reason", ex.getReason().name())));
    }

    @ExceptionHandler({BookingConflictException.class, InvalidStatusTransitionException.class})
    public ResponseEntity<BaseResponse<Void>> handleConflict(BusinessException ex) {
        log.warn("Conflict [{}]: {}", ex.getErrorCode(), ex.getMessage());
        return ResponseEntity.status(HttpStatus.CONFLICT)
                .body(BaseResponse.error(ex.getMessage(), ex.getErrorCode()));
    }

    @ExceptionHandler({
            MinimumNoticeViolationException.class,
            BookingHorizonViolationException.class,
            CancellationNotAllowedException.class
    })
    public ResponseEntity<BaseResponse<Void>> handlePolicyViolation(BusinessException ex) {
        log.warn("Policy violation [{}]: {}", ex.getErrorCode(), ex.getMessage());
        return ResponseEntity.status(HttpStatus.UNPROCESSABLE_ENTITY)
                .body(BaseResponse.error(ex.getMessage(), ex.getErrorCode()));
    }

    @ExceptionHandler(TransientDataAccessException.class)
    public ResponseEntity<BaseResponse<Void>> handleTransientStorageFailure(TransientDataAccessException ex) {
        log.warn("Transient storage failure: {}", ex.getMessage());
        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
                .body(BaseResponse.error("Storage is temporarily unavailable. Please retry.", ServiceUnavailableException.CODE));
    }
}
