package com.bloodforecast.exception;

public class InvalidForecastRequestException extends BloodForecastException {
    public InvalidForecastRequestException(String message) {
        super("INVALID_FORECAST_REQUEST", message);
    }
}
