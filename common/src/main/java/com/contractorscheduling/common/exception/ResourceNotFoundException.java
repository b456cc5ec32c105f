package com.contractorscheduling.common.exception;

/**
 * Unknown contractor, service or appointment id.
 */
public class ResourceNotFoundException extends BusinessException {
    public static final String CODE = "RESOURCE_NOT_FOUND";

    public ResourceNotFoundException(String message) {
        super(message, CODE);
    }

    public ResourceNotFoundException(String resourceType, Object identifier) {
        super(String.format("%s %s not found", resourceType, identifier), CODE);
    }
}
