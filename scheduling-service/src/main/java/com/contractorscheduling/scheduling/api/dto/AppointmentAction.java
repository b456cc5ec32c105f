package com.contractorscheduling.scheduling.api.dto;

public enum AppointmentAction {
    CANCEL,
    CONFIRM,
    COMPLETE,
    NO_SHOW
}
