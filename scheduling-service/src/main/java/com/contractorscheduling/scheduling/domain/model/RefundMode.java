package com.contractorscheduling.scheduling.domain.model;

/**
 * Refund applied to a late cancellation. PARTIAL carries its percentage on the policy.
 */
public enum RefundMode {
    FULL,
    PARTIAL,
    NONE
}
