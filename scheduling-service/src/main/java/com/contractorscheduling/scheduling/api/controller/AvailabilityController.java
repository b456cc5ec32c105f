package com.contractorscheduling.scheduling.api.controller;

import com.contractorscheduling.common.dto.BaseResponse;
import com.contractorscheduling.scheduling.api.dto.AvailabilityDayResponse;
import com.contractorscheduling.scheduling.api.dto.AvailabilityRangeRequest;
import com.contractorscheduling.scheduling.api.dto.AvailabilityRangeResponse;
import com.contractorscheduling.scheduling.api.dto.SlotResponse;
import com.contractorscheduling.scheduling.domain.service.AvailabilityService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.LocalDate;
import java.util.List;

@RestController
@RequestMapping("/api/v1/availability")
@RequiredArgsConstructor
public class AvailabilityController {

    private final AvailabilityService availabilityService;

    @GetMapping
    public ResponseEntity<BaseResponse<List<SlotResponse>>> getSlots(
            @RequestParam Long contractorId,
            @RequestParam Long serviceId,
            @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate date,
            @RequestParam(defaultValue = "false") boolean includeUnavailable) {
        List<SlotResponse> slots = availabilityService.getSlots(contractorId, serviceId, date, includeUnavailable)
                .stream()
                .map(SlotResponse::from)
                .toList();
        return ResponseEntity.ok(BaseResponse.success(slots));
    }

    @PostMapping
    public ResponseEntity<BaseResponse<AvailabilityRangeResponse>> summarizeRange(
            @Valid @RequestBody AvailabilityRangeRequest request) {
        List<AvailabilityDayResponse> days = availabilityService
                .summarize(request.contractorId(), request.startDate(), request.endDate(), request.serviceId())
                .stream()
                .map(AvailabilityDayResponse::from)
                .toList();
        return ResponseEntity.ok(BaseResponse.success(new AvailabilityRangeResponse(
                request.contractorId(), request.startDate(), request.endDate(), days)));
    }
}
