package com.bloodforecast.exception;

public class CapacityExceededException extends BloodForecastException {
    public CapacityExceededException(Long hospitalId, String bloodType, int current, int incoming, int maxCapacity) {
        super("CAPACITY_EXCEEDED",
              "Hospital " + hospitalId + " cannot take " + incoming + " unit(s) of " + bloodType
                  + ": " + current + " on hand, capacity " + maxCapacity + ".");
    }
}
