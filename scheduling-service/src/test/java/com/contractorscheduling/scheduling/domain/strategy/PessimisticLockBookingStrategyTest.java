package com.contractorscheduling.scheduling.domain.strategy;

import com.contractorscheduling.common.exception.ResourceNotFoundException;
import com.contractorscheduling.scheduling.domain.availability.UnavailabilityReason;
import com.contractorscheduling.scheduling.domain.model.Appointment;
import com.contractorscheduling.scheduling.domain.model.AppointmentStatus;
import com.contractorscheduling.scheduling.domain.model.ContractorLedger;
import com.contractorscheduling.scheduling.domain.repository.ContractorLedgerRepository;
import com.contractorscheduling.scheduling.exception.BookingConflictException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.Optional;

import static com.contractorscheduling.scheduling.domain.ScheduleFixtures.CONTRACTOR_ID;
import static com.contractorscheduling.scheduling.domain.ScheduleFixtures.MONDAY;
import static com.contractorscheduling.scheduling.domain.ScheduleFixtures.appointment;
import static com.contractorscheduling.scheduling.domain.ScheduleFixtures.at;
import static com.contractorscheduling.scheduling.domain.strategy.DistributedLockBookingStrategyTest.draft;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.BDDMockito.given;
import static org.mockito.Mockito.verifyNoInteractions;

@ExtendWith(MockitoExtension.class)
class PessimisticLockBookingStrategyTest {

    @Mock
    private ContractorLedgerRepository ledgerRepository;

    @Mock
    private LedgerCommitSupport commitSupport;

    @InjectMocks
    private PessimisticLockBookingStrategy strategy;

    @Test
    @DisplayName("commit() locks the ledger row, inserts and advances the booking sequence")
    void commit_success() {
        // given
        BookingDraft draft = draft();
        ContractorLedger ledger = ContractorLedger.builder().contractorId(CONTRACTOR_ID).bookingSequence(0L).build();
        Appointment saved = appointment(at(MONDAY, 10, 0), at(MONDAY, 11, 0), AppointmentStatus.REQUESTED);
        given(ledgerRepository.findByContractorIdWithLock(CONTRACTOR_ID)).willReturn(Optional.of(ledger));
        given(commitSupport.recheckAndInsert(draft)).willReturn(saved);

        // when
        Appointment result = strategy.commit(draft);

        // then
        assertThat(result).isSameAs(saved);
        assertThat(ledger.getBookingSequence()).isEqualTo(1L);
        assertThat(strategy.getStrategyType()).isEqualTo("PESSIMISTIC_LOCK");
    }

    @Test
    @DisplayName("commit() leaves the sequence alone when the re-check fails")
    void commit_conflict() {
        // given
        BookingDraft draft = draft();
        ContractorLedger ledger = ContractorLedger.builder().contractorId(CONTRACTOR_ID).bookingSequence(2L).build();
        given(ledgerRepository.findByContractorIdWithLock(CONTRACTOR_ID)).willReturn(Optional.of(ledger));
        given(commitSupport.recheckAndInsert(draft)).willThrow(
                new BookingConflictException(CONTRACTOR_ID, draft.requestedStart(), UnavailabilityReason.CONFLICT));

        // when / then
        assertThatThrownBy(() -> strategy.commit(draft)).isInstanceOf(BookingConflictException.class);
        assertThat(ledger.getBookingSequence()).isEqualTo(2L);
    }

    @Test
    @DisplayName("commit() fails for a contractor without a ledger row")
    void commit_missingLedger() {
        given(ledgerRepository.findByContractorIdWithLock(CONTRACTOR_ID)).willReturn(Optional.empty());

        assertThatThrownBy(() -> strategy.commit(draft())).isInstanceOf(ResourceNotFoundException.class);
        verifyNoInteractions(commitSupport);
    }
}
