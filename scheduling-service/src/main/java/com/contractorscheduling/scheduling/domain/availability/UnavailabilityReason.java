package com.contractorscheduling.scheduling.domain.availability;

/**
 * Why a day or a slot cannot be booked. The first five apply to whole days.
 */
public enum UnavailabilityReason {
    NOT_ACCEPTING_BOOKINGS,
    BLACKOUT,
    CLOSED,
    BEYOND_HORIZON,
    BEFORE_TODAY,
    OUTSIDE_WORKING_HOURS,
    RECURRING_UNAVAILABLE,
    CONFLICT,
    MINIMUM_NOTICE
}
