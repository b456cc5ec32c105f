package com.contractorscheduling.scheduling.api.controller;

import com.contractorscheduling.common.dto.BaseResponse;
import com.contractorscheduling.scheduling.api.dto.ScheduleConfigDto;
import com.contractorscheduling.scheduling.api.dto.ServiceDefinitionRequest;
import com.contractorscheduling.scheduling.api.dto.ServiceDefinitionResponse;
import com.contractorscheduling.scheduling.api.dto.ServiceUpdateRequest;
import com.contractorscheduling.scheduling.domain.service.ScheduleConfigService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * Contractor-facing configuration: working schedule and service catalog.
 */
@RestController
@RequestMapping("/api/v1/contractors/{contractorId}")
@RequiredArgsConstructor
public class ContractorScheduleController {

    private final ScheduleConfigService scheduleConfigService;

    @GetMapping("/schedule")
    public ResponseEntity<BaseResponse<ScheduleConfigDto>> getSchedule(@PathVariable Long contractorId) {
        return ResponseEntity.ok(BaseResponse.success(ScheduleConfigDto.from(scheduleConfigService.getSchedule(contractorId))));
    }

    @PutMapping("/schedule")
    public ResponseEntity<BaseResponse<ScheduleConfigDto>> saveSchedule(
            @PathVariable Long contractorId,
            @Valid @RequestBody ScheduleConfigDto request) {
        ScheduleConfigDto saved = ScheduleConfigDto.from(scheduleConfigService.saveSchedule(contractorId, request.toEntity()));
        return ResponseEntity.ok(BaseResponse.success("Schedule saved", saved));
    }

    @GetMapping("/services")
    public ResponseEntity<BaseResponse<List<ServiceDefinitionResponse>>> listServices(
            @PathVariable Long contractorId,
            @RequestParam(defaultValue = "false") boolean activeOnly) {
        List<ServiceDefinitionResponse> services = scheduleConfigService.listServices(contractorId, activeOnly).stream()
                .map(ServiceDefinitionResponse::from)
                .toList();
        return ResponseEntity.ok(BaseResponse.success(services));
    }

    @PostMapping("/services")
    public ResponseEntity<BaseResponse<ServiceDefinitionResponse>> addService(
            @PathVariable Long contractorId,
            @Valid @RequestBody ServiceDefinitionRequest request) {
        ServiceDefinitionResponse created = ServiceDefinitionResponse.from(
                scheduleConfigService.addService(contractorId, request.toEntity()));
        return ResponseEntity.status(HttpStatus.CREATED).body(BaseResponse.success("Service created", created));
    }

    @PatchMapping("/services/{serviceId}")
    public ResponseEntity<BaseResponse<ServiceDefinitionResponse>> updateService(
            @PathVariable Long contractorId,
            @PathVariable Long serviceId,
            @Valid @RequestBody ServiceUpdateRequest request) {
        ServiceDefinitionResponse updated = ServiceDefinitionResponse.from(
                scheduleConfigService.updateService(contractorId, serviceId, request.toUpdate()));
        return ResponseEntity.ok(BaseResponse.success("Service updated", updated));
    }
}
