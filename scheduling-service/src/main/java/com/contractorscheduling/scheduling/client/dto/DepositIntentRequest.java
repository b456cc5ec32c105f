package com.contractorscheduling.scheduling.client.dto;

import java.math.BigDecimal;

public record DepositIntentRequest(
        Long appointmentId,
        Long contractorId,
        Long clientId,
        String clientEmail,
        BigDecimal amount,
        String idempotencyKey
) {
}
