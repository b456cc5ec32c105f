package com.contractorscheduling.scheduling.domain.model;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.math.BigDecimal;

@Embeddable
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CancellationPolicy {

    @Column(name = "allow_cancellation", nullable = false)
    private boolean allowCancellation;

    @Column(name = "cancellation_deadline_hours", nullable = false)
    private Integer cancellationDeadlineHours;

    @Enumerated(EnumType.STRING)
    @Column(name = "refund_mode", nullable = false, length = 20)
    private RefundMode refundMode;

    /**
     * Only meaningful for {@link RefundMode#PARTIAL}.
     */
    @Column(name = "partial_refund_percentage", precision = 5, scale = 2)
    private BigDecimal partialRefundPercentage;

    public static CancellationPolicy defaults() {
        return CancellationPolicy.builder()
                .allowCancellation(true)
                .cancellationDeadlineHours(24)
                .refundMode(RefundMode.PARTIAL)
                .partialRefundPercentage(BigDecimal.valueOf(50))
                .build();
    }
}
