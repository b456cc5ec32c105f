package com.contractorscheduling.scheduling.domain.service;

import com.contractorscheduling.scheduling.domain.model.Appointment;
import com.contractorscheduling.scheduling.domain.policy.CancellationDecision;

public record CancellationResult(Appointment appointment, CancellationDecision decision) {
}
