package com.bloodforecast.controller;

import com.bloodforecast.dto.AlertRequest;
import com.bloodforecast.dto.GenerateForecastRequest;
import com.bloodforecast.dto.RiskLevel;
import com.bloodforecast.entity.ForecastRecord;
import com.bloodforecast.repository.ForecastRecordRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.web.client.TestRestTemplate;
import org.springframework.http.*;
import org.springframework.test.context.ActiveProfiles;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT)
@ActiveProfiles("test")
class ForecastingControllerIntegrationTest {

    @Autowired TestRestTemplate restTemplate;
    @Autowired ForecastRecordRepository forecastRepository;

    @BeforeEach
    void clearForecasts() {
        forecastRepository.deleteAll();
    }

    private Map<?, ?> awaitJob(String location) throws InterruptedException {
        long deadline = System.currentTimeMillis() + 60_000;
        Map<?, ?> job = restTemplate.getForObject(location, Map.class);
        while (!List.of("COMPLETED", "FAILED").contains(job.get("status")) && System.currentTimeMillis() < deadline) {
            Thread.sleep(50);
            job = restTemplate.getForObject(location, Map.class);
        }
        return job;
    }

    @Test
    @SuppressWarnings("unchecked")
    void generate_trainsIfNeededAndPersistsForecasts() {
        GenerateForecastRequest request = GenerateForecastRequest.builder()
            .hoursAhead(24).regions(List.of("South Delhi")).build();

        ResponseEntity<List> resp = restTemplate.postForEntity("/api/v1/forecasting/generate", request, List.class);

        assertThat(resp.getStatusCode()).isEqualTo(HttpStatus.CREATED);
        assertThat(resp.getBody()).hasSize(8);
        Map<String, Object> forecast = (Map<String, Object>) resp.getBody().get(0);
        assertThat(forecast).containsKeys("id", "predictedDemand", "confidence", "shortageRisk", "currentInventory");
        assertThat(forecast.get("region")).isEqualTo("South Delhi");
        assertThat(forecastRepository.count()).isEqualTo(8);

        ResponseEntity<List> listed = restTemplate.getForEntity(
            "/api/v1/forecasting/forecasts?region=South Delhi&limit=5", List.class);
        assertThat(listed.getBody()).hasSize(5);

        ResponseEntity<Map> summary = restTemplate.getForEntity("/api/v1/forecasting/forecasts/summary", Map.class);
        assertThat(summary.getBody().get("totalForecasts")).isEqualTo(8);
        assertThat(summary.getBody().get("regionsCovered")).isEqualTo(List.of("South Delhi"));

        ResponseEntity<Map> status = restTemplate.getForEntity("/api/v1/forecasting/training-status", Map.class);
        assertThat(status.getBody().get("trained")).isEqualTo(true);
        assertThat(status.getBody().get("state")).isEqualTo("TRAINED");
    }

    @Test
    void generate_horizonBeyondOneWeek_returns422() {
        GenerateForecastRequest request = GenerateForecastRequest.builder().hoursAhead(500).build();

        ResponseEntity<Map> resp = restTemplate.postForEntity("/api/v1/forecasting/generate", request, Map.class);

        assertThat(resp.getStatusCode()).isEqualTo(HttpStatus.UNPROCESSABLE_ENTITY);
        assertThat(resp.getBody()).containsKey("fieldErrors");
    }

    @Test
    void trainAsync_completesJob() throws Exception {
        ResponseEntity<Map> resp = restTemplate.postForEntity("/api/v1/forecasting/train/async", null, Map.class);

        assertThat(resp.getStatusCode()).isEqualTo(HttpStatus.ACCEPTED);
        String location = resp.getHeaders().getLocation().toString();
        assertThat(location).startsWith("/api/v1/forecasting/jobs/");

        Map<?, ?> job = awaitJob(location);
        assertThat(job.get("status")).isEqualTo("COMPLETED");
        assertThat(job.get("jobType")).isEqualTo("TRAINING");
    }

    @Test
    void jobStatus_unknownJob_returns404() {
        ResponseEntity<Map> resp = restTemplate.getForEntity("/api/v1/forecasting/jobs/" + UUID.randomUUID(), Map.class);

        assertThat(resp.getStatusCode()).isEqualTo(HttpStatus.NOT_FOUND);
        assertThat(resp.getBody().get("errorCode")).isEqualTo("JOB_NOT_FOUND");
    }

    @Test
    void forecasts_unknownRiskFilter_returns400() {
        ResponseEntity<Map> resp = restTemplate.getForEntity("/api/v1/forecasting/forecasts?minRisk=Extreme", Map.class);

        assertThat(resp.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
    }

    @Test
    void sendAlerts_marksPendingHighRiskForecastsOnce() {
        forecastRepository.saveAll(List.of(
            ForecastRecord.builder().bloodType("O-").region("Dwarka")
                .forecastDate(LocalDateTime.now().plusDays(2)).predictedDemand(18).confidence(0.8)
                .shortageRisk(RiskLevel.CRITICAL).currentInventory(4).build(),
            ForecastRecord.builder().bloodType("A+").region("Dwarka")
                .forecastDate(LocalDateTime.now().plusDays(2)).predictedDemand(6).confidence(0.8)
                .shortageRisk(RiskLevel.LOW).currentInventory(60).build()));

        ResponseEntity<Map> first = restTemplate.postForEntity("/api/v1/forecasting/alerts/send", null, Map.class);

        assertThat(first.getStatusCode()).isEqualTo(HttpStatus.OK);
        assertThat(first.getBody().get("totalAlerts")).isEqualTo(1);
        Map<?, ?> alert = (Map<?, ?>) ((List<?>) first.getBody().get("alertsSent")).get(0);
        assertThat(alert.get("bloodType")).isEqualTo("O-");
        assertThat(alert.get("shortageRisk")).isEqualTo("Critical");
        assertThat(forecastRepository.findAll()).filteredOn(ForecastRecord::isAlertSent).hasSize(1);

        ResponseEntity<Map> second = restTemplate.postForEntity("/api/v1/forecasting/alerts/send", null, Map.class);
        assertThat(second.getBody().get("totalAlerts")).isEqualTo(0);
    }

    @Test
    void sendAlerts_unknownForecast_returns404() {
        AlertRequest request = AlertRequest.builder().forecastId(UUID.randomUUID()).build();

        ResponseEntity<Map> resp = restTemplate.postForEntity("/api/v1/forecasting/alerts/send", request, Map.class);

        assertThat(resp.getStatusCode()).isEqualTo(HttpStatus.NOT_FOUND);
        assertThat(resp.getBody().get("errorCode")).isEqualTo("FORECAST_NOT_FOUND");
    }
}
