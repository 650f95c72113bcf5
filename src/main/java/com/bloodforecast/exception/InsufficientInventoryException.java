package com.bloodforecast.exception;

public class InsufficientInventoryException extends BloodForecastException {
    public InsufficientInventoryException(Long hospitalId, String bloodType, int available, int requested) {
        super("INSUFFICIENT_INVENTORY",
              "Hospital " + hospitalId + " holds " + available + " unit(s) of " + bloodType
                  + ", cannot transfer " + requested + ".");
    }
}
