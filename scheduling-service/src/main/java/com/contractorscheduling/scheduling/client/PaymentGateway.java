package com.contractorscheduling.scheduling.client;

import com.contractorscheduling.common.exception.ServiceUnavailableException;
import com.contractorscheduling.scheduling.client.dto.DepositIntentRequest;
import com.contractorscheduling.scheduling.client.dto.DepositIntentResponse;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import io.github.resilience4j.retry.annotation.Retry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Resilience wrapper around {@link PaymentClient}: retries transient failures and opens a
 * circuit when the payment service keeps failing.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class PaymentGateway {

    private final PaymentClient paymentClient;

    @Retry(name = "payment-service")
    @CircuitBreaker(name = "payment-service", fallbackMethod = "depositIntentFallback")
    public DepositIntentResponse requestDepositIntent(DepositIntentRequest request) {
        log.debug("Requesting deposit intent for appointment {} amount {}", request.appointmentId(), request.amount());
        return paymentClient.createDepositIntent(request);
    }

    @SuppressWarnings("unused")
    private DepositIntentResponse depositIntentFallback(DepositIntentRequest request, Throwable t) {
        log.warn("Payment service unavailable for appointment {}: {}", request.appointmentId(), t.getMessage());
        throw new ServiceUnavailableException("Payment service is temporarily unavailable", t);
    }
}
