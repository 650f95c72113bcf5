package com.bloodforecast.dto;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.Size;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;

@Value
@Builder
@Jacksonized
public class GenerateForecastRequest {

    @Min(value = 1, message = "hoursAhead must be between 1 and 168")
    @Max(value = 168, message = "hoursAhead must be between 1 and 168")
    @Builder.Default
    int hoursAhead = 48;

    @Size(max = 100, message = "regions supports up to 100 values")
    List<String> regions;

    boolean retrain;
}
