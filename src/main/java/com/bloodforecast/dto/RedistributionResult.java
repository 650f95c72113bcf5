package com.bloodforecast.dto;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class RedistributionResult {
    boolean success;
    Long fromHospitalId;
    Long toHospitalId;
    String bloodType;
    int unitsTransferred;
    int sourceRemaining;
    int destNewLevel;
}
