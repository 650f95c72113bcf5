package com.bloodforecast.controller;

import com.bloodforecast.dto.DemandForecast;
import com.bloodforecast.dto.InventoryStatus;
import com.bloodforecast.dto.OpportunitiesResponse;
import com.bloodforecast.dto.RedistributionOpportunity;
import com.bloodforecast.dto.RedistributionRequest;
import com.bloodforecast.dto.RedistributionResult;
import com.bloodforecast.dto.RedistributionSummary;
import com.bloodforecast.dto.RiskLevel;
import com.bloodforecast.service.ForecastHistoryService;
import com.bloodforecast.service.ForecastRedistributionPlanner;
import com.bloodforecast.service.RedistributionService;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.UUID;

@Slf4j
@Validated
@RestController
@RequestMapping("/api/v1/redistribution")
@RequiredArgsConstructor
public class RedistributionController {

    static final String NO_FORECASTS_MESSAGE = "No forecasts available. Generate forecasts first.";

    private final RedistributionService         redistributionService;
    private final ForecastRedistributionPlanner planner;
    private final ForecastHistoryService        historyService;

    @GetMapping("/inventory")
    public ResponseEntity<List<InventoryStatus>> inventory(
            @RequestParam(required = false) String bloodType,
            @RequestParam(required = false) Long hospitalId) {
        return ResponseEntity.ok(redistributionService.inventoryStatus(bloodType, hospitalId));
    }

    @GetMapping("/opportunities")
    public ResponseEntity<OpportunitiesResponse> opportunities(
            @RequestParam(required = false) String bloodType) {
        List<RedistributionOpportunity> opportunities = redistributionService.identifyOpportunities(bloodType);
        return ResponseEntity.ok(OpportunitiesResponse.builder()
            .opportunities(opportunities)
            .totalOpportunities(opportunities.size())
            .build());
    }

    @PostMapping("/forecast-based")
    public ResponseEntity<OpportunitiesResponse> forecastBased(
            @RequestParam(defaultValue = "High") String thresholdRisk) {
        RiskLevel threshold = RiskLevel.fromValue(thresholdRisk);
        List<DemandForecast> forecasts = historyService.upcoming();
        if (forecasts.isEmpty()) {
            return ResponseEntity.ok(OpportunitiesResponse.builder()
                .opportunities(List.of())
                .totalOpportunities(0)
                .thresholdRisk(threshold)
                .message(NO_FORECASTS_MESSAGE)
                .build());
        }
        List<RedistributionOpportunity> plan = planner.applyForecastBasedRedistribution(forecasts, threshold);
        return ResponseEntity.ok(OpportunitiesResponse.builder()
            .opportunities(plan)
            .totalOpportunities(plan.size())
            .thresholdRisk(threshold)
            .build());
    }

    @PostMapping("/execute")
    public ResponseEntity<RedistributionResult> execute(
            @Valid @RequestBody RedistributionRequest request, HttpServletRequest httpRequest) {
        String requestId = resolveRequestId(httpRequest);
        log.info("POST /execute | from={} | to={} | bloodType={} | units={} | requestId={}",
                 request.getFromHospitalId(), request.getToHospitalId(), request.getBloodType(),
                 request.getUnits(), requestId);
        return ResponseEntity.ok()
            .header("X-Request-ID", requestId)
            .body(redistributionService.executeRedistribution(
                request.getFromHospitalId(), request.getToHospitalId(),
                request.getBloodType(), request.getUnits()));
    }

    @GetMapping("/summary")
    public ResponseEntity<RedistributionSummary> summary() {
        return ResponseEntity.ok(redistributionService.summary());
    }

    private String resolveRequestId(HttpServletRequest request) {
        String id = request.getHeader("X-Request-ID");
        return (id != null && !id.isBlank()) ? id : UUID.randomUUID().toString();
    }
}
