package com.contractorscheduling.common.exception;

/**
 * Storage or an infrastructure dependency failed after the bounded retries were spent.
 * The request may be repeated as-is. Mapped to HTTP 503.
 */
public class ServiceUnavailableException extends RuntimeException {
    public static final String CODE = "SERVICE_UNAVAILABLE";

    public ServiceUnavailableException(String message) {
        super(message);
    }

    public ServiceUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
