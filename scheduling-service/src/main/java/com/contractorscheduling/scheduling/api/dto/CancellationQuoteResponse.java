package com.contractorscheduling.scheduling.api.dto;

import com.contractorscheduling.scheduling.domain.policy.CancellationDecision;

import java.math.BigDecimal;

public record CancellationQuoteResponse(
        boolean allowed,
        BigDecimal refundAmount,
        String refundReason,
        boolean lateCancellation,
        BigDecimal amountPaid
) {
    public static CancellationQuoteResponse from(CancellationDecision decision) {
        return new CancellationQuoteResponse(
                decision.allowed(),
                decision.refundAmount(),
                decision.refundReason(),
                decision.lateCancellation(),
                decision.amountPaid()
        );
    }
}
