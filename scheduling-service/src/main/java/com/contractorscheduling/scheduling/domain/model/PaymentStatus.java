package com.contractorscheduling.scheduling.domain.model;

/**
 * Payment state as reported by the payment collaborator. The ledger never moves money.
 */
public enum PaymentStatus {
    NOT_REQUIRED,
    DEPOSIT_PENDING,
    DEPOSIT_PAID,
    DEPOSIT_FAILED,
    PAID,
    REFUND_PENDING
}
