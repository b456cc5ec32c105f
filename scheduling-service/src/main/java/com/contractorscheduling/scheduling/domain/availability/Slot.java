package com.contractorscheduling.scheduling.domain.availability;

import java.time.Instant;

/**
 * A candidate booking. {@code reason} is null when the slot is available.
 */
public record Slot(Instant start, Instant end, boolean available, UnavailabilityReason reason) {

    public static Slot available(TimeWindow block) {
        return new Slot(block.start(), block.end(), true, null);
    }

    public static Slot unavailable(TimeWindow block, UnavailabilityReason reason) {
        return new Slot(block.start(), block.end(), false, reason);
    }
}
