package com.bloodforecast.dto;

import com.fasterxml.jackson.annotation.JsonFormat;
import lombok.Builder;
import lombok.Value;

import java.time.LocalDateTime;
import java.util.UUID;

/** Notice sent to potential donors about a forecast shortage. */
@Value
@Builder(toBuilder = true)
public class ShortageAlert {

    public static final String ALERT_TYPE = "blood_shortage_prediction";
    public static final String CALL_TO_ACTION = "Please schedule a donation appointment if you are available.";

    UUID forecastId;
    String alertType;
    String bloodType;
    String region;
    double predictedDemand;
    RiskLevel shortageRisk;
    @JsonFormat(pattern = "yyyy-MM-dd'T'HH:mm:ss")
    LocalDateTime forecastDate;
    String message;
    int notifiedDonors;
    String callToAction;
}
