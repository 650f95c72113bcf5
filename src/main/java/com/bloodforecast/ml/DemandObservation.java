package com.bloodforecast.ml;

import java.time.LocalDate;

/**
 * One day of consumed units for a (blood type, region) cell, as fed to training.
 */
public record DemandObservation(
    String bloodType,
    String region,
    LocalDate date,
    int units,
    Season season,
    boolean outbreak
) {
    public DemandObservation {
        if (units < 0) {
            throw new IllegalArgumentException("units must be >= 0, got " + units);
        }
        if (season == null && date != null) {
            season = Season.of(date);
        }
    }
}
