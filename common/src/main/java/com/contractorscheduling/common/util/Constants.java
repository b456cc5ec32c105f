package com.contractorscheduling.common.util;

/**
 * Constants shared between the scheduling modules.
 */
public final class Constants {
    private Constants() {
    }

    public static final String LEDGER_LOCK_PREFIX = "lock:contractor-ledger:";

    public static final String TOPIC_APPOINTMENT_BOOKED = "appointment-booked";
    public static final String TOPIC_APPOINTMENT_CANCELLED = "appointment-cancelled";
    public static final String TOPIC_APPOINTMENT_STATUS_CHANGED = "appointment-status-changed";

    public static final int DEFAULT_SLOT_STEP_MINUTES = 15;
    public static final int MONEY_SCALE = 2;
}
