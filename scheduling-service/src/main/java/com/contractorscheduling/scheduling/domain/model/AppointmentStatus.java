package com.contractorscheduling.scheduling.domain.model;

import java.util.EnumSet;
import java.util.Set;

/**
 * Appointment lifecycle.
 * REQUESTED and CONFIRMED hold calendar time; the other three are terminal.
 */
public enum AppointmentStatus {
    REQUESTED,
    CONFIRMED,
    CANCELLED,
    COMPLETED,
    NO_SHOW;

    public static final Set<AppointmentStatus> ACTIVE = EnumSet.of(REQUESTED, CONFIRMED);

    public boolean holdsCalendarTime() {
        return ACTIVE.contains(this);
    }

    public boolean isTerminal() {
        return !holdsCalendarTime();
    }

    public boolean canTransitionTo(AppointmentStatus target) {
        return switch (this) {
            case REQUESTED -> target == CONFIRMED || target == CANCELLED || target == COMPLETED;
            case CONFIRMED -> target == CANCELLED || target == COMPLETED || target == NO_SHOW;
            case CANCELLED, COMPLETED, NO_SHOW -> false;
        };
    }
}
