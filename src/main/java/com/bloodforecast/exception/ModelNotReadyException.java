package com.bloodforecast.exception;

import com.bloodforecast.dto.ForecasterState;

public class ModelNotReadyException extends BloodForecastException {
    public ModelNotReadyException(ForecasterState state) {
        super("MODEL_NOT_READY",
              "Demand model is not trained yet (state=" + state + "). Train the model and retry.");
    }
}
