package com.bloodforecast.exception;

import java.util.UUID;

public class JobNotFoundException extends BloodForecastException {
    public JobNotFoundException(UUID jobId) {
        super("JOB_NOT_FOUND", "No forecasting job " + jobId + " is registered; finished jobs are evicted after a while.");
    }
}
