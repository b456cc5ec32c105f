package com.contractorscheduling.scheduling.domain.strategy;

import com.contractorscheduling.common.exception.ResourceNotFoundException;
import com.contractorscheduling.common.util.Constants;
import com.contractorscheduling.scheduling.domain.model.Appointment;
import com.contractorscheduling.scheduling.domain.model.AppointmentStatus;
import com.contractorscheduling.scheduling.domain.model.ContractorLedger;
import com.contractorscheduling.scheduling.domain.repository.ContractorLedgerRepository;
import com.contractorscheduling.scheduling.domain.service.BookingCommand;
import com.contractorscheduling.scheduling.domain.service.ClientDetails;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.redisson.api.RLock;
import org.redisson.api.RedissonClient;
import org.springframework.dao.CannotAcquireLockException;
import org.springframework.transaction.support.TransactionCallback;
import org.springframework.transaction.support.TransactionTemplate;

import java.math.BigDecimal;
import java.util.Optional;

import static com.contractorscheduling.scheduling.domain.ScheduleFixtures.CONTRACTOR_ID;
import static com.contractorscheduling.scheduling.domain.ScheduleFixtures.MONDAY;
import static com.contractorscheduling.scheduling.domain.ScheduleFixtures.SERVICE_ID;
import static com.contractorscheduling.scheduling.domain.ScheduleFixtures.appointment;
import static com.contractorscheduling.scheduling.domain.ScheduleFixtures.at;
import static com.contractorscheduling.scheduling.domain.ScheduleFixtures.service;
import static com.contractorscheduling.scheduling.domain.ScheduleFixtures.weekdaySchedule;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.BDDMockito.given;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;

/**
 * Unit tests for {@link DistributedLockBookingStrategy}: the Redisson lock wraps the whole
 * transaction and is always released.
 */
@ExtendWith(MockitoExtension.class)
class DistributedLockBookingStrategyTest {

    @Mock
    private RedissonClient redissonClient;

    @Mock
    private RLock lock;

    @Mock
    private TransactionTemplate transactionTemplate;

    @Mock
    private ContractorLedgerRepository ledgerRepository;

    @Mock
    private LedgerCommitSupport commitSupport;

    @InjectMocks
    private DistributedLockBookingStrategy strategy;

    @Test
    @DisplayName("commit() inserts inside a transaction while holding the contractor lock")
    void commit_success_whenLockAcquired() throws Exception {
        // given
        BookingDraft draft = draft();
        Appointment saved = appointment(at(MONDAY, 10, 0), at(MONDAY, 11, 0), AppointmentStatus.REQUESTED);
        ContractorLedger ledger = ContractorLedger.builder().contractorId(CONTRACTOR_ID).bookingSequence(4L).build();

        given(redissonClient.getLock(Constants.LEDGER_LOCK_PREFIX + CONTRACTOR_ID)).willReturn(lock);
        given(lock.tryLock(anyLong(), anyLong(), any())).willReturn(true);
        given(lock.isHeldByCurrentThread()).willReturn(true);
        given(transactionTemplate.execute(any())).willAnswer(inv -> {
            TransactionCallback<?> callback = inv.getArgument(0);
            return callback.doInTransaction(null);
        });
        given(ledgerRepository.findById(CONTRACTOR_ID)).willReturn(Optional.of(ledger));
        given(commitSupport.recheckAndInsert(draft)).willReturn(saved);

        // when
        Appointment result = strategy.commit(draft);

        // then
        assertThat(result).isSameAs(saved);
        assertThat(ledger.getBookingSequence()).isEqualTo(5L);
        verify(lock).unlock();
    }

    @Test
    @DisplayName("commit() reports a lock timeout as a lock acquisition failure")
    void commit_fail_whenLockNotAcquired() throws Exception {
        // given
        given(redissonClient.getLock(eq(Constants.LEDGER_LOCK_PREFIX + CONTRACTOR_ID))).willReturn(lock);
        given(lock.tryLock(anyLong(), anyLong(), any())).willReturn(false);
        given(lock.isHeldByCurrentThread()).willReturn(false);

        // when / then
        assertThatThrownBy(() -> strategy.commit(draft()))
                .isInstanceOf(CannotAcquireLockException.class);
        verifyNoInteractions(transactionTemplate, commitSupport);
        verify(lock, never()).unlock();
    }

    @Test
    @DisplayName("commit() releases the lock when the contractor has no ledger")
    void commit_releasesLock_whenLedgerMissing() throws Exception {
        // given
        given(redissonClient.getLock(eq(Constants.LEDGER_LOCK_PREFIX + CONTRACTOR_ID))).willReturn(lock);
        given(lock.tryLock(anyLong(), anyLong(), any())).willReturn(true);
        given(lock.isHeldByCurrentThread()).willReturn(true);
        given(transactionTemplate.execute(any())).willAnswer(inv -> {
            TransactionCallback<?> callback = inv.getArgument(0);
            return callback.doInTransaction(null);
        });
        given(ledgerRepository.findById(CONTRACTOR_ID)).willReturn(Optional.empty());

        // when / then
        assertThatThrownBy(() -> strategy.commit(draft()))
                .isInstanceOf(ResourceNotFoundException.class);
        verify(lock).unlock();
        verifyNoInteractions(commitSupport);
    }

    static BookingDraft draft() {
        BookingCommand command = new BookingCommand(CONTRACTOR_ID, SERVICE_ID, at(MONDAY, 10, 0),
                new ClientDetails(7L, null, null, null, null), null, "client");
        return new BookingDraft(command, weekdaySchedule().build(), service(60), false, BigDecimal.ZERO);
    }
}
