package com.bloodforecast.service;

import com.bloodforecast.dto.AlertResponse;
import com.bloodforecast.dto.DemandForecast;
import com.bloodforecast.dto.ForecastSummaryResponse;
import com.bloodforecast.dto.RiskLevel;
import com.bloodforecast.dto.ShortageAlert;
import com.bloodforecast.entity.ForecastRecord;
import com.bloodforecast.exception.ForecastNotFoundException;
import com.bloodforecast.repository.ForecastRecordRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.domain.PageRequest;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ForecastHistoryServiceTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2025-10-10T08:00:00Z"), ZoneOffset.UTC);

    @Mock
    ForecastRecordRepository repository;

    @Mock
    DemandForecastService forecastService;

    @Mock
    ShortageAlertNotifier notifier;

    private ForecastHistoryService historyService;

    @BeforeEach
    void setUp() {
        historyService = new ForecastHistoryService(repository, forecastService, notifier, CLOCK);
    }

    private ForecastRecord record(String bloodType, String region, RiskLevel risk) {
        return ForecastRecord.builder()
            .id(UUID.randomUUID())
            .bloodType(bloodType)
            .region(region)
            .forecastDate(LocalDateTime.of(2025, 10, 12, 8, 0))
            .predictedDemand(12.5)
            .confidence(0.8)
            .shortageRisk(risk)
            .currentInventory(20)
            .createdAt(CLOCK.instant())
            .build();
    }

    @Test
    void save_returnsPersistedForecastsWithIds() {
        DemandForecast forecast = DemandForecast.builder()
            .bloodType("O+").region("Noida").forecastDate(LocalDateTime.of(2025, 10, 12, 8, 0))
            .predictedDemand(12.5).confidence(0.8).shortageRisk(RiskLevel.HIGH).currentInventory(20).build();
        ForecastRecord persisted = record("O+", "Noida", RiskLevel.HIGH);
        when(repository.saveAll(anyList())).thenReturn(List.of(persisted));

        List<DemandForecast> saved = historyService.save(List.of(forecast));

        assertThat(saved).singleElement().satisfies(f -> {
            assertThat(f.getId()).isEqualTo(persisted.getId());
            assertThat(f.getShortageRisk()).isEqualTo(RiskLevel.HIGH);
            assertThat(f.getCreatedAt()).isEqualTo(CLOCK.instant());
        });
    }

    @Test
    void find_filtersByMinimumRiskAndCapsLimit() {
        when(repository.findRecent("A+", null, List.of(RiskLevel.HIGH, RiskLevel.CRITICAL),
                                   PageRequest.of(0, ForecastHistoryService.MAX_LIMIT)))
            .thenReturn(List.of(record("A+", "Noida", RiskLevel.CRITICAL)));

        List<DemandForecast> found = historyService.find("A+", null, RiskLevel.HIGH, 50_000);

        assertThat(found).hasSize(1);
    }

    @Test
    void summary_countsRiskLevelsAndCoverage() {
        when(repository.findByCreatedAtGreaterThanEqual(Instant.parse("2025-10-09T08:00:00Z"))).thenReturn(List.of(
            record("O+", "Noida", RiskLevel.CRITICAL),
            record("A+", "Noida", RiskLevel.HIGH),
            record("O+", "Dwarka", RiskLevel.LOW),
            record("B-", "Dwarka", RiskLevel.LOW)));

        ForecastSummaryResponse summary = historyService.summary(24);

        assertThat(summary.getTotalForecasts()).isEqualTo(4);
        assertThat(summary.getCriticalRiskCount()).isEqualTo(1);
        assertThat(summary.getHighRiskCount()).isEqualTo(1);
        assertThat(summary.getMediumRiskCount()).isZero();
        assertThat(summary.getLowRiskCount()).isEqualTo(2);
        assertThat(summary.getRegionsCovered()).containsExactly("Dwarka", "Noida");
        assertThat(summary.getBloodTypesCovered()).containsExactly("A+", "B-", "O+");
    }

    @Test
    void upcoming_readsForecastsAfterNow() {
        when(repository.findByForecastDateAfterOrderByForecastDateAsc(LocalDateTime.of(2025, 10, 10, 8, 0)))
            .thenReturn(List.of(record("O+", "Noida", RiskLevel.HIGH)));

        assertThat(historyService.upcoming()).hasSize(1);
    }

    @Test
    void generateAndSave_trainsWhenModelNotReady() {
        when(forecastService.isReady()).thenReturn(false);
        when(forecastService.generateForecasts(24, null)).thenReturn(List.of());
        when(repository.saveAll(anyList())).thenReturn(List.of());

        historyService.generateAndSave(24, null, false);

        verify(forecastService).train(false);
    }

    @Test
    void generateAndSave_reusesReadyModel() {
        when(forecastService.isReady()).thenReturn(true);
        when(forecastService.generateForecasts(48, List.of("Noida"))).thenReturn(List.of());
        when(repository.saveAll(anyList())).thenReturn(List.of());

        historyService.generateAndSave(48, List.of("Noida"), false);

        verify(forecastService, never()).train(anyBoolean());
    }

    @Test
    void generateAndSave_retrainForcesTraining() {
        when(forecastService.generateForecasts(48, null)).thenReturn(List.of());
        when(repository.saveAll(anyList())).thenReturn(List.of());

        historyService.generateAndSave(48, null, true);

        verify(forecastService).train(true);
    }

    @Test
    void sendAlerts_pendingForecastsAtThreshold_areAlertedAndMarked() {
        ForecastRecord critical = record("O+", "Noida", RiskLevel.CRITICAL);
        ForecastRecord high = record("A+", "Dwarka", RiskLevel.HIGH);
        when(repository.findPendingAlerts(List.of(RiskLevel.HIGH, RiskLevel.CRITICAL), LocalDateTime.of(2025, 10, 10, 8, 0)))
            .thenReturn(List.of(critical, high));
        when(notifier.deliver(any(ShortageAlert.class))).thenReturn(3);

        AlertResponse response = historyService.sendAlerts(null, RiskLevel.HIGH);

        assertThat(response.getTotalAlerts()).isEqualTo(2);
        assertThat(response.getAlertsSent()).first().satisfies(alert -> {
            assertThat(alert.getForecastId()).isEqualTo(critical.getId());
            assertThat(alert.getAlertType()).isEqualTo("blood_shortage_prediction");
            assertThat(alert.getNotifiedDonors()).isEqualTo(3);
            assertThat(alert.getMessage()).isEqualTo(
                "Critical risk of O+ shortage in Noida predicted for 2025-10-12 08:00. Expected demand: 12 units.");
        });
        assertThat(critical.isAlertSent()).isTrue();
        assertThat(high.isAlertSent()).isTrue();
        verify(repository).saveAll(List.of(critical, high));
    }

    @Test
    void sendAlerts_defaultThresholdIsHigh() {
        when(repository.findPendingAlerts(List.of(RiskLevel.HIGH, RiskLevel.CRITICAL), LocalDateTime.of(2025, 10, 10, 8, 0)))
            .thenReturn(List.of());

        assertThat(historyService.sendAlerts(null, null).getTotalAlerts()).isZero();
        verifyNoInteractions(notifier);
    }

    @Test
    void sendAlerts_byId_alertsThatForecastOnly() {
        ForecastRecord low = record("B-", "Noida", RiskLevel.LOW);
        when(repository.findById(low.getId())).thenReturn(Optional.of(low));

        AlertResponse response = historyService.sendAlerts(low.getId(), RiskLevel.CRITICAL);

        assertThat(response.getAlertsSent()).singleElement()
            .satisfies(alert -> assertThat(alert.getShortageRisk()).isEqualTo(RiskLevel.LOW));
        assertThat(low.isAlertSent()).isTrue();
        verify(repository, never()).findPendingAlerts(any(), any());
    }

    @Test
    void sendAlerts_unknownId_throwsNotFound() {
        UUID id = UUID.randomUUID();
        when(repository.findById(id)).thenReturn(Optional.empty());

        assertThatThrownBy(() -> historyService.sendAlerts(id, null))
            .isInstanceOf(ForecastNotFoundException.class)
            .extracting("errorCode").isEqualTo("FORECAST_NOT_FOUND");
    }

    @Test
    void sendAlerts_notifierFailure_leavesForecastUnmarked() {
        ForecastRecord critical = record("O+", "Noida", RiskLevel.CRITICAL);
        when(repository.findPendingAlerts(anyList(), any())).thenReturn(List.of(critical));
        when(notifier.deliver(any(ShortageAlert.class))).thenThrow(new IllegalStateException("gateway down"));

        assertThatThrownBy(() -> historyService.sendAlerts(null, RiskLevel.HIGH))
            .isInstanceOf(IllegalStateException.class);
        assertThat(critical.isAlertSent()).isFalse();
        verify(repository, never()).saveAll(anyList());
    }
}
