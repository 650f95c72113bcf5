package com.bloodforecast.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder(toBuilder = true)
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public class RedistributionOpportunity {
    Long fromHospitalId;
    String fromHospitalName;
    Long toHospitalId;
    String toHospitalName;
    String bloodType;
    int transferUnits;
    double priority;
    String reason;
    boolean forecastBased;
    List<String> predictedShortageRegions;
}
