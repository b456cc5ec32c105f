package com.contractorscheduling.scheduling.exception;

import com.contractorscheduling.common.exception.BusinessException;
import com.contractorscheduling.scheduling.domain.availability.UnavailabilityReason;
import lombok.Getter;

import java.time.Instant;

/**
 * The slot passed the pre-check but was taken (or otherwise invalidated) by the time the booking committed.
 */
@Getter
public class BookingConflictException extends BusinessException {
    public static final String CODE = "BOOKING_CONFLICT";

    private final UnavailabilityReason reason;

    public BookingConflictException(Long contractorId, Instant start, UnavailabilityReason reason) {
        super(String.format("Slot %s for contractor %d is no longer available: %s", start, contractorId, reason), CODE);
        this.reason = reason;
    }
}
