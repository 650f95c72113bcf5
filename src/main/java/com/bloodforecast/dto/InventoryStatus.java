package com.bloodforecast.dto;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class InventoryStatus {
    Long hospitalId;
    String hospitalName;
    String region;
    String bloodType;
    int currentUnits;
    int minRequired;
    int maxCapacity;
    int shortage;
    double surplus;
    InventoryStatusLevel status;
}
