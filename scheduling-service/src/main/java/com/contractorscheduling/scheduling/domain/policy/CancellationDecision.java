package com.contractorscheduling.scheduling.domain.policy;

import java.math.BigDecimal;

/**
 * Outcome of applying a cancellation policy to one appointment at one instant.
 */
public record CancellationDecision(boolean allowed,
                                   BigDecimal refundAmount,
                                   String refundReason,
                                   boolean lateCancellation,
                                   BigDecimal amountPaid) {
}
