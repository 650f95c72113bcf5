package com.bloodforecast.service;

import com.bloodforecast.dto.AlertResponse;
import com.bloodforecast.dto.DemandForecast;
import com.bloodforecast.dto.ForecastSummaryResponse;
import com.bloodforecast.dto.RiskLevel;
import com.bloodforecast.dto.ShortageAlert;
import com.bloodforecast.entity.ForecastRecord;
import com.bloodforecast.exception.ForecastNotFoundException;
import com.bloodforecast.repository.ForecastRecordRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

@Slf4j
@Service
@RequiredArgsConstructor
public class ForecastHistoryService {

    static final int MAX_LIMIT = 1000;

    private static final DateTimeFormatter ALERT_DATE = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm");

    private final ForecastRecordRepository repository;
    private final DemandForecastService forecastService;
    private final ShortageAlertNotifier notifier;
    private final Clock clock;

    /**
     * Trains first when asked to or when no model is published yet, then generates
     * forecasts for the horizon and stores them.
     */
    public List<DemandForecast> generateAndSave(int hoursAhead, List<String> regions, boolean retrain) {
        if (retrain || !forecastService.isReady()) {
            forecastService.train(retrain);
        }
        return save(forecastService.generateForecasts(hoursAhead, regions));
    }

    @Transactional
    public List<DemandForecast> save(List<DemandForecast> forecasts) {
        List<ForecastRecord> saved = repository.saveAll(forecasts.stream().map(this::toRecord).toList());
        log.info("Forecasts persisted | count={}", saved.size());
        return saved.stream().map(this::toForecast).toList();
    }

    @Transactional(readOnly = true)
    public List<DemandForecast> find(String bloodType, String region, RiskLevel minRisk, int limit) {
        int pageSize = Math.max(1, Math.min(limit, MAX_LIMIT));
        List<RiskLevel> risks = RiskLevel.atLeast(minRisk != null ? minRisk : RiskLevel.LOW);
        return repository.findRecent(bloodType, region, risks, PageRequest.of(0, pageSize)).stream()
            .map(this::toForecast)
            .toList();
    }

    @Transactional(readOnly = true)
    public ForecastSummaryResponse summary(int hoursBack) {
        Instant cutoff = Instant.now(clock).minus(Duration.ofHours(Math.max(0, hoursBack)));
        List<ForecastRecord> records = repository.findByCreatedAtGreaterThanEqual(cutoff);

        return ForecastSummaryResponse.builder()
            .totalForecasts(records.size())
            .criticalRiskCount(count(records, RiskLevel.CRITICAL))
            .highRiskCount(count(records, RiskLevel.HIGH))
            .mediumRiskCount(count(records, RiskLevel.MEDIUM))
            .lowRiskCount(count(records, RiskLevel.LOW))
            .regionsCovered(records.stream().map(ForecastRecord::getRegion).distinct().sorted().toList())
            .bloodTypesCovered(records.stream().map(ForecastRecord::getBloodType).distinct().sorted().toList())
            .build();
    }

    /** Forecasts whose target time is still in the future, soonest first. */
    @Transactional(readOnly = true)
    public List<DemandForecast> upcoming() {
        return repository.findByForecastDateAfterOrderByForecastDateAsc(LocalDateTime.now(clock)).stream()
            .map(this::toForecast)
            .toList();
    }

    /**
     * Alerts donors about one forecast, or about every future forecast at or above
     * {@code minRisk} that has not been alerted yet, and marks each alerted forecast.
     * A notifier failure rolls the whole batch back.
     */
    @Transactional
    public AlertResponse sendAlerts(UUID forecastId, RiskLevel minRisk) {
        List<ForecastRecord> targets;
        if (forecastId != null) {
            targets = List.of(repository.findById(forecastId)
                .orElseThrow(() -> new ForecastNotFoundException(forecastId)));
        } else {
            RiskLevel threshold = minRisk != null ? minRisk : RiskLevel.HIGH;
            targets = repository.findPendingAlerts(RiskLevel.atLeast(threshold), LocalDateTime.now(clock));
        }

        List<ShortageAlert> alerts = new ArrayList<>(targets.size());
        for (ForecastRecord record : targets) {
            ShortageAlert alert = toAlert(record);
            int reached = notifier.deliver(alert);
            record.setAlertSent(true);
            alerts.add(alert.toBuilder().notifiedDonors(reached).build());
        }
        repository.saveAll(targets);

        log.info("Shortage alerts sent | forecastId={} | minRisk={} | count={}", forecastId, minRisk, alerts.size());
        return AlertResponse.builder()
            .alertsSent(alerts)
            .totalAlerts(alerts.size())
            .build();
    }

    private ShortageAlert toAlert(ForecastRecord r) {
        return ShortageAlert.builder()
            .forecastId(r.getId())
            .alertType(ShortageAlert.ALERT_TYPE)
            .bloodType(r.getBloodType())
            .region(r.getRegion())
            .predictedDemand(r.getPredictedDemand())
            .shortageRisk(r.getShortageRisk())
            .forecastDate(r.getForecastDate())
            .message(String.format("%s risk of %s shortage in %s predicted for %s. Expected demand: %d units.",
                r.getShortageRisk().getLabel(), r.getBloodType(), r.getRegion(),
                r.getForecastDate().format(ALERT_DATE), (int) r.getPredictedDemand()))
            .callToAction(ShortageAlert.CALL_TO_ACTION)
            .build();
    }

    private int count(List<ForecastRecord> records, RiskLevel risk) {
        return (int) records.stream().filter(r -> r.getShortageRisk() == risk).count();
    }

    private ForecastRecord toRecord(DemandForecast f) {
        return ForecastRecord.builder()
            .bloodType(f.getBloodType())
            .region(f.getRegion())
            .forecastDate(f.getForecastDate())
            .predictedDemand(f.getPredictedDemand())
            .confidence(f.getConfidence())
            .shortageRisk(f.getShortageRisk())
            .currentInventory(f.getCurrentInventory())
            .alertSent(f.isAlertSent())
            .build();
    }

    private DemandForecast toForecast(ForecastRecord r) {
        return DemandForecast.builder()
            .id(r.getId())
            .bloodType(r.getBloodType())
            .region(r.getRegion())
            .forecastDate(r.getForecastDate())
            .predictedDemand(r.getPredictedDemand())
            .confidence(r.getConfidence())
            .shortageRisk(r.getShortageRisk())
            .currentInventory(r.getCurrentInventory())
            .alertSent(r.isAlertSent())
            .createdAt(r.getCreatedAt() != null ? r.getCreatedAt() : Instant.now(clock))
            .build();
    }
}
