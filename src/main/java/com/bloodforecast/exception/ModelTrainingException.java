package com.bloodforecast.exception;

public class ModelTrainingException extends BloodForecastException {
    public ModelTrainingException(String message) {
        super("MODEL_TRAINING_FAILED", message);
    }
    public ModelTrainingException(String message, Throwable cause) {
        super("MODEL_TRAINING_FAILED", message, cause);
    }
}
