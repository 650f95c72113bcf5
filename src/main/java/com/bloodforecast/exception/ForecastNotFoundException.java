package com.bloodforecast.exception;

import java.util.UUID;

public class ForecastNotFoundException extends BloodForecastException {
    public ForecastNotFoundException(UUID forecastId) {
        super("FORECAST_NOT_FOUND", "Forecast with id '" + forecastId + "' not found.");
    }
}
