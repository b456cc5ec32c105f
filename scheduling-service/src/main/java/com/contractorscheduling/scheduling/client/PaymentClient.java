package com.contractorscheduling.scheduling.client;

import com.contractorscheduling.scheduling.client.dto.DepositIntentRequest;
import com.contractorscheduling.scheduling.client.dto.DepositIntentResponse;
import org.springframework.cloud.openfeign.FeignClient;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;

/**
 * Feign client for the payment service. Scheduling only asks for deposit intents;
 * capture results come back through the deposit callback endpoint.
 */
@FeignClient(name = "payment-service", url = "${scheduling.payment.url:http://localhost:8084}", path = "/api/v1/payments")
public interface PaymentClient {

    @PostMapping("/deposit-intents")
    DepositIntentResponse createDepositIntent(@RequestBody DepositIntentRequest request);
}
