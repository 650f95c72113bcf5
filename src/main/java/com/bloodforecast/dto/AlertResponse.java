package com.bloodforecast.dto;

import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class AlertResponse {
    List<ShortageAlert> alertsSent;
    int totalAlerts;
}
