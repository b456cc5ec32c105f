package com.contractorscheduling.scheduling.config;

import org.springframework.cloud.openfeign.EnableFeignClients;
import org.springframework.context.annotation.Configuration;

@Configuration
@EnableFeignClients(basePackages = "com.contractorscheduling.scheduling.client")
public class FeignConfig {
}
