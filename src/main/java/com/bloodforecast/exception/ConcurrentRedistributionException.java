package com.bloodforecast.exception;

public class ConcurrentRedistributionException extends BloodForecastException {
    public ConcurrentRedistributionException(Long hospitalId, String bloodType, Throwable cause) {
        super("CONCURRENT_REDISTRIBUTION",
              "Inventory for " + bloodType + " at hospital " + hospitalId
                  + " was created by a concurrent transfer; retry the request.", cause);
    }
}
