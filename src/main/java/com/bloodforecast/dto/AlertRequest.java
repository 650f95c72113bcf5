package com.bloodforecast.dto;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.UUID;

@Value
@Builder
@Jacksonized
public class AlertRequest {

    /** Alert on this forecast only; otherwise every pending forecast at or above {@code minRiskLevel}. */
    UUID forecastId;

    @Builder.Default
    String minRiskLevel = "High";
}
