package com.contractorscheduling.scheduling.domain.repository;

import com.contractorscheduling.scheduling.domain.model.ContractorSchedule;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.Optional;

public interface ContractorScheduleRepository extends JpaRepository<ContractorSchedule, Long> {

    Optional<ContractorSchedule> findByContractorId(Long contractorId);
}
