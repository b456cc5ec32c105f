package com.contractorscheduling.scheduling.api.dto;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Result of a PATCH on an appointment. {@code cancellation} is only present for CANCEL.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record AppointmentTransitionResponse(
        AppointmentResponse appointment,
        CancellationQuoteResponse cancellation
) {
}
