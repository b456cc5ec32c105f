package com.contractorscheduling.scheduling.exception;

import com.contractorscheduling.common.exception.BusinessException;

import java.time.Duration;
import java.time.Instant;

public class MinimumNoticeViolationException extends BusinessException {
    public static final String CODE = "MINIMUM_NOTICE_VIOLATION";

    public MinimumNoticeViolationException(Instant start, Duration minimumNotice) {
        super(String.format("Requested start %s does not leave the required notice of %d minutes",
                start, minimumNotice.toMinutes()), CODE);
    }
}
