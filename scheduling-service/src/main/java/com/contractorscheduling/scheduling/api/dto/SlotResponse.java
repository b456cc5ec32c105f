package com.contractorscheduling.scheduling.api.dto;

import com.contractorscheduling.scheduling.domain.availability.Slot;
import com.contractorscheduling.scheduling.domain.availability.UnavailabilityReason;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record SlotResponse(Instant start, Instant end, boolean available, UnavailabilityReason reason) {

    public static SlotResponse from(Slot slot) {
        return new SlotResponse(slot.start(), slot.end(), slot.available(), slot.reason());
    }
}
