package com.contractorscheduling.scheduling.exception;

import com.contractorscheduling.common.exception.BusinessException;

import java.time.Instant;

public class BookingHorizonViolationException extends BusinessException {
    public static final String CODE = "BOOKING_HORIZON_VIOLATION";

    public BookingHorizonViolationException(Instant start, int advanceBookingDays) {
        super(String.format("Requested start %s is more than %d days ahead", start, advanceBookingDays), CODE);
    }
}
