package com.contractorscheduling.scheduling.domain.availability;

import com.contractorscheduling.scheduling.domain.model.RefundMode;

import java.math.BigDecimal;
import java.time.Duration;

/**
 * Cancellation policy as seen by the policy engine.
 * {@code partialPercentage} is only read when {@code refundMode} is PARTIAL.
 */
public record CancellationTerms(boolean allowCancellation,
                                Duration deadline,
                                RefundMode refundMode,
                                BigDecimal partialPercentage) {
}
