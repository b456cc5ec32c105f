package com.contractorscheduling.scheduling.domain.policy;

import com.contractorscheduling.common.util.Constants;
import com.contractorscheduling.scheduling.domain.availability.CancellationTerms;
import com.contractorscheduling.scheduling.domain.model.Appointment;
import com.contractorscheduling.scheduling.domain.model.RefundMode;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Duration;
import java.time.Instant;

/**
 * Decides whether an appointment may be cancelled and how much of the paid amount goes back.
 *
 * Cancelling at least {@code deadline} before the start refunds everything that was paid.
 * Later cancellations follow the refund mode. Refunds never exceed the amount paid.
 */
@Component
public class CancellationPolicyEngine {

    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    public CancellationDecision resolve(Appointment appointment, CancellationTerms terms, Instant now) {
        BigDecimal paid = money(appointment.amountPaid());

        if (!terms.allowCancellation()) {
            return new CancellationDecision(false, money(BigDecimal.ZERO),
                    "Cancellations are not accepted for this contractor", false, paid);
        }

        Duration leadTime = Duration.between(now, appointment.getScheduledStart());
        if (leadTime.compareTo(terms.deadline()) >= 0) {
            return new CancellationDecision(true, paid,
                    String.format("Cancelled at least %d hours ahead: full refund", terms.deadline().toHours()),
                    false, paid);
        }

        BigDecimal refund;
        String reason;
        RefundMode mode = terms.refundMode() == null ? RefundMode.NONE : terms.refundMode();
        switch (mode) {
            case FULL -> {
                refund = paid;
                reason = "Late cancellation: full refund";
            }
            case PARTIAL -> {
                BigDecimal percentage = terms.partialPercentage() == null ? BigDecimal.ZERO : terms.partialPercentage();
                refund = paid.multiply(percentage).divide(HUNDRED, Constants.MONEY_SCALE, RoundingMode.HALF_UP);
                reason = String.format("Late cancellation: %s%% refund", percentage.stripTrailingZeros().toPlainString());
            }
            default -> {
                refund = BigDecimal.ZERO;
                reason = "Late cancellation: no refund";
            }
        }
        return new CancellationDecision(true, clamp(refund, paid), reason, true, paid);
    }

    private BigDecimal clamp(BigDecimal refund, BigDecimal paid) {
        BigDecimal bounded = refund.max(BigDecimal.ZERO).min(paid);
        return money(bounded);
    }

    private BigDecimal money(BigDecimal amount) {
        return (amount == null ? BigDecimal.ZERO : amount).setScale(Constants.MONEY_SCALE, RoundingMode.HALF_UP);
    }
}
