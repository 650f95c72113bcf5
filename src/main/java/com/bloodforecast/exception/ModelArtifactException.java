package com.bloodforecast.exception;

public class ModelArtifactException extends BloodForecastException {
    public ModelArtifactException(String message) {
        super("MODEL_ARTIFACT_ERROR", message);
    }
    public ModelArtifactException(String message, Throwable cause) {
        super("MODEL_ARTIFACT_ERROR", message, cause);
    }
}
