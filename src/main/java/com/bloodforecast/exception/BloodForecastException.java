package com.bloodforecast.exception;

import lombok.Getter;

@Getter
public abstract class BloodForecastException extends RuntimeException {
    private final String errorCode;
    protected BloodForecastException(String errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }
    protected BloodForecastException(String errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }
}
