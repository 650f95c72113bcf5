package com.bloodforecast.dto;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class RedistributionSummary {
    int totalHospitals;
    int totalInventoryRecords;
    int criticalCount;
    int lowCount;
    int adequateCount;
    int excessCount;
    long totalShortageUnits;
    double totalSurplusUnits;
    double redistributionPotential;
    int bloodTypesTracked;
}
