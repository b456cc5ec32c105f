package com.contractorscheduling.scheduling.client.dto;

public record DepositIntentResponse(
        String paymentReference,
        String status,
        String message
) {
}
