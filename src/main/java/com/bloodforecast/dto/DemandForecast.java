package com.bloodforecast.dto;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.time.LocalDateTime;
import java.util.UUID;

@Value
@Builder(toBuilder = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class DemandForecast {
    UUID id;
    String bloodType;
    String region;
    @JsonFormat(pattern = "yyyy-MM-dd'T'HH:mm:ss")
    LocalDateTime forecastDate;
    double predictedDemand;
    double confidence;
    RiskLevel shortageRisk;
    int currentInventory;
    boolean alertSent;
    @JsonFormat(shape = JsonFormat.Shape.STRING)
    Instant createdAt;
}
