package com.contractorscheduling.scheduling.domain.model;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import jakarta.persistence.Version;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * Per-contractor row that booking writes serialize on, either by row lock or by version check.
 */
@Entity
@Table(name = "contractor_ledgers")
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ContractorLedger {
    @Id
    @Column(name = "contractor_id")
    private Long contractorId;

    @Column(name = "booking_sequence", nullable = false)
    private Long bookingSequence;

    @Version
    @Column(name = "version", nullable = false)
    private Long version;

    public void recordBooking() {
        bookingSequence = bookingSequence == null ? 1L : bookingSequence + 1;
    }
}
