package com.bloodforecast.exception;

public class InvalidRedistributionException extends BloodForecastException {
    public InvalidRedistributionException(String message) {
        super("INVALID_REDISTRIBUTION", message);
    }
}
