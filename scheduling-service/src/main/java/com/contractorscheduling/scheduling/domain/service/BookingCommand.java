package com.contractorscheduling.scheduling.domain.service;

import java.time.Instant;

public record BookingCommand(Long contractorId,
                             Long serviceId,
                             Instant requestedStart,
                             ClientDetails client,
                             String idempotencyKey,
                             String requestedBy) {
}
