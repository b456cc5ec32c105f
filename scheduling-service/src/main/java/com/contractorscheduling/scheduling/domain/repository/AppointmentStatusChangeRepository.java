package com.contractorscheduling.scheduling.domain.repository;

import com.contractorscheduling.scheduling.domain.model.AppointmentStatusChange;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface AppointmentStatusChangeRepository extends JpaRepository<AppointmentStatusChange, Long> {

    List<AppointmentStatusChange> findByAppointmentIdOrderByChangedAtAscIdAsc(Long appointmentId);
}
