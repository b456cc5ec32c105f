package com.contractorscheduling.scheduling.domain.model;

import com.contractorscheduling.scheduling.domain.availability.TimeWindow;

import java.time.Duration;

/**
 * How the configured buffer separates two appointments.
 */
public enum BufferMode {
    /**
     * Every appointment is padded by the buffer on both sides and padded intervals may not overlap,
     * so neighbours end up at least twice the buffer apart.
     */
    SYMMETRIC,
    /**
     * Existing appointments are padded on both sides and a candidate block must stay clear of that padding,
     * so neighbours end up exactly one buffer apart.
     */
    SHARED;

    public TimeWindow candidateBusyInterval(TimeWindow block, Duration buffer) {
        return this == SYMMETRIC ? block.expand(buffer) : block;
    }

    public TimeWindow existingBusyInterval(TimeWindow block, Duration buffer) {
        return block.expand(buffer);
    }
}
