package com.contractorscheduling.scheduling.domain.strategy;

import com.contractorscheduling.common.exception.ResourceNotFoundException;
import com.contractorscheduling.common.exception.ServiceUnavailableException;
import com.contractorscheduling.common.util.Constants;
import com.contractorscheduling.scheduling.domain.model.Appointment;
import com.contractorscheduling.scheduling.domain.model.ContractorLedger;
import com.contractorscheduling.scheduling.domain.repository.ContractorLedgerRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.redisson.api.RLock;
import org.redisson.api.RedissonClient;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.CannotAcquireLockException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.concurrent.TimeUnit;

/**
 * Booking strategy using a Redis (Redisson) lock per contractor.
 *
 * The transaction is opened and committed inside the locked section, so the next holder
 * always sees the previous booking. A lock that cannot be acquired in time is reported as
 * {@link CannotAcquireLockException}, which the ledger treats as transient.
 */
@Slf4j
@Component("distributed")
@RequiredArgsConstructor
public class DistributedLockBookingStrategy implements BookingStrategy {

    private final RedissonClient redissonClient;
    private final TransactionTemplate transactionTemplate;
    private final ContractorLedgerRepository ledgerRepository;
    private final LedgerCommitSupport commitSupport;

    @Value("${scheduling.ledger.lock-wait-seconds:5}")
    private long lockWaitSeconds;

    @Value("${scheduling.ledger.lock-lease-seconds:30}")
    private long lockLeaseSeconds;

    @Override
    public Appointment commit(BookingDraft draft) {
        String lockKey = buildLockKey(draft.contractorId());
        RLock lock = redissonClient.getLock(lockKey);

        try {
            boolean acquired = lock.tryLock(lockWaitSeconds, lockLeaseSeconds, TimeUnit.SECONDS);
            if (!acquired) {
                throw new CannotAcquireLockException("Timed out waiting for booking lock " + lockKey);
            }

            log.debug("Acquired distributed lock: {}", lockKey);
            return transactionTemplate.execute(status -> {
                ContractorLedger ledger = ledgerRepository.findById(draft.contractorId())
                        .orElseThrow(() -> new ResourceNotFoundException("Contractor ledger", draft.contractorId()));
                Appointment saved = commitSupport.recheckAndInsert(draft);
                ledger.recordBooking();
                return saved;
            });

        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ServiceUnavailableException("Interrupted while waiting for booking lock " + lockKey, e);
        } finally {
            if (lock.isHeldByCurrentThread()) {
                lock.unlock();
                log.debug("Released distributed lock: {}", lockKey);
            }
        }
    }

    @Override
    public String getStrategyType() {
        return "DISTRIBUTED_LOCK";
    }

    private String buildLockKey(Long contractorId) {
        return Constants.LEDGER_LOCK_PREFIX + contractorId;
    }
}
