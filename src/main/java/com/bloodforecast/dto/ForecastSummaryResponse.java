package com.bloodforecast.dto;

import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class ForecastSummaryResponse {
    int totalForecasts;
    int criticalRiskCount;
    int highRiskCount;
    int mediumRiskCount;
    int lowRiskCount;
    List<String> regionsCovered;
    List<String> bloodTypesCovered;
}
