package com.contractorscheduling.scheduling.exception;

import com.contractorscheduling.common.exception.BusinessException;
import com.contractorscheduling.common.exception.GlobalExceptionHandler;
import lombok.Getter;

import java.util.Map;

/**
 * A request or configuration failed validation. Carries per-field messages.
 */
@Getter
public class SchedulingValidationException extends BusinessException {

    private final Map<String, String> fieldErrors;

    public SchedulingValidationException(String message, Map<String, String> fieldErrors) {
        super(message, GlobalExceptionHandler.VALIDATION_ERROR);
        this.fieldErrors = Map.copyOf(fieldErrors);
    }

    public SchedulingValidationException(String field, String message) {
        this(message, Map.of(field, message));
    }
}
