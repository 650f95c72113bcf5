package com.bloodforecast.dto;

/** Long-running work that can be started in the background. */
public enum ForecastJobType {
    TRAINING,
    FORECAST_GENERATION
}
