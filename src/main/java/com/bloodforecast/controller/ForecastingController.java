package com.bloodforecast.controller;

import com.bloodforecast.dto.AlertRequest;
import com.bloodforecast.dto.AlertResponse;
import com.bloodforecast.dto.AsyncJobResponse;
import com.bloodforecast.dto.DemandForecast;
import com.bloodforecast.dto.ForecastJobType;
import com.bloodforecast.dto.ForecastSummaryResponse;
import com.bloodforecast.dto.GenerateForecastRequest;
import com.bloodforecast.dto.RiskLevel;
import com.bloodforecast.dto.TrainingResult;
import com.bloodforecast.dto.TrainingStatusResponse;
import com.bloodforecast.service.AsyncJobService;
import com.bloodforecast.service.DemandForecastService;
import com.bloodforecast.service.ForecastHistoryService;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.UUID;

@Slf4j
@Validated
@RestController
@RequestMapping("/api/v1/forecasting")
@RequiredArgsConstructor
public class ForecastingController {

    private final DemandForecastService  forecastService;
    private final ForecastHistoryService historyService;
    private final AsyncJobService        asyncJobService;

    @PostMapping("/train")
    public ResponseEntity<TrainingResult> train(
            @RequestParam(defaultValue = "false") boolean forceRetrain, HttpServletRequest httpRequest) {
        String requestId = resolveRequestId(httpRequest);
        log.info("POST /train | forceRetrain={} | requestId={}", forceRetrain, requestId);
        return ResponseEntity.ok()
            .header("X-Request-ID", requestId)
            .body(forecastService.train(forceRetrain));
    }

    @PostMapping("/train/async")
    public ResponseEntity<AsyncJobResponse> trainAsync(
            @RequestParam(defaultValue = "false") boolean forceRetrain, HttpServletRequest httpRequest) {
        String requestId = resolveRequestId(httpRequest);
        UUID jobId = asyncJobService.submit(
            ForecastJobType.TRAINING,
            requestId,
            () -> forecastService.train(forceRetrain)
        );
        return accepted(jobId, requestId);
    }

    @GetMapping("/training-status")
    public ResponseEntity<TrainingStatusResponse> trainingStatus() {
        return ResponseEntity.ok(forecastService.trainingStatus());
    }

    @PostMapping("/generate")
    public ResponseEntity<List<DemandForecast>> generate(
            @Valid @RequestBody(required = false) GenerateForecastRequest request, HttpServletRequest httpRequest) {
        GenerateForecastRequest req = request != null ? request : GenerateForecastRequest.builder().build();
        String requestId = resolveRequestId(httpRequest);
        log.info("POST /generate | hoursAhead={} | regions={} | retrain={} | requestId={}",
                 req.getHoursAhead(), req.getRegions(), req.isRetrain(), requestId);
        return ResponseEntity.status(HttpStatus.CREATED)
            .header("X-Request-ID", requestId)
            .body(historyService.generateAndSave(req.getHoursAhead(), req.getRegions(), req.isRetrain()));
    }

    @PostMapping("/generate/async")
    public ResponseEntity<AsyncJobResponse> generateAsync(
            @Valid @RequestBody(required = false) GenerateForecastRequest request, HttpServletRequest httpRequest) {
        GenerateForecastRequest req = request != null ? request : GenerateForecastRequest.builder().build();
        String requestId = resolveRequestId(httpRequest);
        UUID jobId = asyncJobService.submit(
            ForecastJobType.FORECAST_GENERATION,
            requestId,
            () -> historyService.generateAndSave(req.getHoursAhead(), req.getRegions(), req.isRetrain())
        );
        return accepted(jobId, requestId);
    }

    @GetMapping("/forecasts")
    public ResponseEntity<List<DemandForecast>> forecasts(
            @RequestParam(required = false) String bloodType,
            @RequestParam(required = false) String region,
            @RequestParam(required = false) String minRisk,
            @RequestParam(defaultValue = "100") @Min(1) @Max(1000) int limit) {
        RiskLevel threshold = minRisk != null ? RiskLevel.fromValue(minRisk) : null;
        return ResponseEntity.ok(historyService.find(bloodType, region, threshold, limit));
    }

    @GetMapping("/forecasts/summary")
    public ResponseEntity<ForecastSummaryResponse> summary(
            @RequestParam(defaultValue = "24") @Min(1) @Max(8760) int hoursBack) {
        return ResponseEntity.ok(historyService.summary(hoursBack));
    }

    @PostMapping("/alerts/send")
    public ResponseEntity<AlertResponse> sendAlerts(
            @RequestBody(required = false) AlertRequest request, HttpServletRequest httpRequest) {
        AlertRequest req = request != null ? request : AlertRequest.builder().build();
        RiskLevel threshold = RiskLevel.fromValue(req.getMinRiskLevel());
        String requestId = resolveRequestId(httpRequest);
        log.info("POST /alerts/send | forecastId={} | minRiskLevel={} | requestId={}",
                 req.getForecastId(), threshold, requestId);
        return ResponseEntity.ok()
            .header("X-Request-ID", requestId)
            .body(historyService.sendAlerts(req.getForecastId(), threshold));
    }

    @GetMapping("/jobs/{jobId}")
    public ResponseEntity<AsyncJobResponse> jobStatus(@PathVariable UUID jobId) {
        return ResponseEntity.ok(asyncJobService.getJob(jobId));
    }

    private ResponseEntity<AsyncJobResponse> accepted(UUID jobId, String requestId) {
        return ResponseEntity.accepted()
            .header("X-Request-ID", requestId)
            .header("Location", "/api/v1/forecasting/jobs/" + jobId)
            .body(asyncJobService.getJob(jobId));
    }

    private String resolveRequestId(HttpServletRequest request) {
        String id = request.getHeader("X-Request-ID");
        return (id != null && !id.isBlank()) ? id : UUID.randomUUID().toString();
    }
}
