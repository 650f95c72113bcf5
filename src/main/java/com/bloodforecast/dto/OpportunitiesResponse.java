package com.bloodforecast.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class OpportunitiesResponse {
    List<RedistributionOpportunity> opportunities;
    int totalOpportunities;
    RiskLevel thresholdRisk;
    String message;
}
