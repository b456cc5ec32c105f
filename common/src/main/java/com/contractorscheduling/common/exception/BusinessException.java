package com.contractorscheduling.common.exception;

import lombok.Getter;

/**
 * Base type for rule violations that are reported to the caller as-is.
 * The error code is stable and machine-readable; the message explains which rule failed.
 * Business exceptions are never retried automatically.
 */
@Getter
public class BusinessException extends RuntimeException {
    public static final String DEFAULT_CODE = "BUSINESS_ERROR";

    private final String errorCode;

    public BusinessException(String message) {
        this(message, DEFAULT_CODE);
    }

    public BusinessException(String message, String errorCode) {
        super(message);
        this.errorCode = errorCode;
    }

    public BusinessException(String message, Throwable cause, String errorCode) {
        super(message, cause);
        this.errorCode = errorCode;
    }
}
