package com.contractorscheduling.scheduling.domain.repository;

import com.contractorscheduling.scheduling.domain.model.Appointment;
import com.contractorscheduling.scheduling.domain.model.AppointmentStatus;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.JpaSpecificationExecutor;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

public interface AppointmentRepository extends JpaRepository<Appointment, Long>, JpaSpecificationExecutor<Appointment> {

    Optional<Appointment> findByIdempotencyKey(String idempotencyKey);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT a FROM Appointment a WHERE a.id = :id")
    Optional<Appointment> findByIdWithLock(@Param("id") Long id);

    /**
     * Appointments in the given statuses whose [start, end) intersects [from, to).
     * Catches appointments that start before {@code from} and run into the range.
     */
    @Query("""
           SELECT a FROM Appointment a
           WHERE a.contractorId = :contractorId
             AND a.status IN :statuses
             AND a.scheduledStart < :to
             AND a.scheduledEnd > :from
           ORDER BY a.scheduledStart
           """)
    List<Appointment> findIntersecting(@Param("contractorId") Long contractorId,
                                       @Param("statuses") Collection<AppointmentStatus> statuses,
                                       @Param("from") Instant from,
                                       @Param("to") Instant to);

    List<Appointment> findByContractorIdAndScheduledStartGreaterThanEqualAndScheduledStartLessThanOrderByScheduledStartAsc(
            Long contractorId, Instant from, Instant to);

    boolean existsByServiceId(Long serviceId);
}
