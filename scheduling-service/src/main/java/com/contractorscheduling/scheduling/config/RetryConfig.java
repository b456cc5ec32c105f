package com.contractorscheduling.scheduling.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.dao.PessimisticLockingFailureException;
import org.springframework.dao.QueryTimeoutException;
import org.springframework.dao.TransientDataAccessResourceException;
import org.springframework.retry.annotation.EnableRetry;
import org.springframework.retry.support.RetryTemplate;

/**
 * Enables {@code @Retryable} and defines the retry policy for booking commits.
 *
 * Only storage-level transient failures are retried here. Optimistic-lock conflicts are retried
 * by the optimistic strategy itself; business rejections are never retried.
 */
@Configuration
@EnableRetry
public class RetryConfig {

    @Bean
    public RetryTemplate ledgerRetryTemplate(
            @Value("${scheduling.ledger.retry.max-attempts:3}") int maxAttempts,
            @Value("${scheduling.ledger.retry.initial-backoff-ms:100}") long initialBackoffMs) {
        return RetryTemplate.builder()
                .maxAttempts(maxAttempts)
                .exponentialBackoff(initialBackoffMs, 2.0, initialBackoffMs * 8)
                .retryOn(TransientDataAccessResourceException.class)
                .retryOn(PessimisticLockingFailureException.class)
                .retryOn(QueryTimeoutException.class)
                .traversingCauses()
                .build();
    }
}
