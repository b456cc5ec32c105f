package com.contractorscheduling.scheduling.domain.repository;

import com.contractorscheduling.scheduling.domain.model.ServiceDefinition;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.Optional;

public interface ServiceDefinitionRepository extends JpaRepository<ServiceDefinition, Long> {

    List<ServiceDefinition> findByContractorIdOrderByNameAsc(Long contractorId);

    List<ServiceDefinition> findByContractorIdAndActiveTrueOrderByNameAsc(Long contractorId);

    Optional<ServiceDefinition> findByIdAndContractorId(Long id, Long contractorId);
}
