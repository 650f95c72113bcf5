package com.bloodforecast.service;

import com.bloodforecast.dto.DemandForecast;
import com.bloodforecast.dto.RedistributionOpportunity;
import com.bloodforecast.dto.RiskLevel;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Turns forecasted shortages into redistribution proposals for the affected blood types.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ForecastRedistributionPlanner {

    private final RedistributionService redistributionService;

    public List<RedistributionOpportunity> applyForecastBasedRedistribution(
            List<DemandForecast> forecasts, RiskLevel thresholdRisk) {
        RiskLevel threshold = thresholdRisk != null ? thresholdRisk : RiskLevel.HIGH;

        // blood type -> regions at risk, both in first-seen order
        Map<String, Set<String>> atRisk = new LinkedHashMap<>();
        for (DemandForecast forecast : forecasts) {
            if (forecast.getShortageRisk() != null && forecast.getShortageRisk().isAtLeast(threshold)) {
                atRisk.computeIfAbsent(forecast.getBloodType(), k -> new LinkedHashSet<>())
                      .add(forecast.getRegion());
            }
        }

        List<RedistributionOpportunity> plan = new ArrayList<>();
        atRisk.forEach((bloodType, regions) -> {
            List<String> shortageRegions = List.copyOf(regions);
            for (RedistributionOpportunity opportunity : redistributionService.identifyOpportunities(bloodType)) {
                plan.add(opportunity.toBuilder()
                    .forecastBased(true)
                    .predictedShortageRegions(shortageRegions)
                    .build());
            }
        });

        log.info("Forecast-based plan built | threshold={} | bloodTypesAtRisk={} | opportunities={}",
                 threshold.getLabel(), atRisk.size(), plan.size());
        return plan;
    }
}
