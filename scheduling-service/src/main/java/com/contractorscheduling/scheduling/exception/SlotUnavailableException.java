package com.contractorscheduling.scheduling.exception;

import com.contractorscheduling.common.exception.BusinessException;
import com.contractorscheduling.scheduling.domain.availability.UnavailabilityReason;
import lombok.Getter;

import java.time.Instant;

@Getter
public class SlotUnavailableException extends BusinessException {
    public static final String CODE = "SLOT_UNAVAILABLE";

    private final UnavailabilityReason reason;

    public SlotUnavailableException(Instant start, UnavailabilityReason reason) {
        super(String.format("Requested start %s is not bookable: %s", start, reason), CODE);
        this.reason = reason;
    }
}
