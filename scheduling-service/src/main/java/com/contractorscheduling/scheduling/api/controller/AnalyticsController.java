package com.contractorscheduling.scheduling.api.controller;

import com.contractorscheduling.common.dto.BaseResponse;
import com.contractorscheduling.scheduling.domain.analytics.SchedulingSummary;
import com.contractorscheduling.scheduling.domain.service.SchedulingAnalyticsService;
import lombok.RequiredArgsConstructor;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.LocalDate;

@RestController
@RequestMapping("/api/v1/analytics")
@RequiredArgsConstructor
public class AnalyticsController {

    private final SchedulingAnalyticsService analyticsService;

    @GetMapping
    public ResponseEntity<BaseResponse<SchedulingSummary>> getSummary(
            @RequestParam Long contractorId,
            @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate startDate,
            @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate endDate) {
        return ResponseEntity.ok(BaseResponse.success(analyticsService.summarize(contractorId, startDate, endDate)));
    }
}
